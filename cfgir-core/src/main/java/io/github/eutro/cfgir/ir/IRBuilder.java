package io.github.eutro.cfgir.ir;

/**
 * An IR, or instruction, builder, which encapsulates a position in a function
 * where instructions are being inserted.
 * <p>
 * Jumps inserted through the builder have their edges recorded on the block as well.
 */
public class IRBuilder {
    /**
     * The context the function lives in.
     */
    public final IrContext ctx;
    /**
     * The function being inserted into.
     */
    public Func func;
    private Block bb;

    /**
     * Construct an instruction builder, inserting into
     * a specific basic block.
     *
     * @param ctx  The context.
     * @param func The function.
     * @param bb   One of the function's basic blocks.
     */
    public IRBuilder(IrContext ctx, Func func, Block bb) {
        this.ctx = ctx;
        this.func = func;
        this.bb = bb;
    }

    /**
     * Construct an instruction builder, inserting into a new block at the end of the function.
     *
     * @param ctx  The context.
     * @param func The function.
     */
    public IRBuilder(IrContext ctx, Func func) {
        this(ctx, func, func.newBlock(ctx));
    }

    /**
     * Get the block this builder is inserting at the end of.
     *
     * @return The block.
     */
    public Block getBlock() {
        return bb;
    }

    /**
     * Set the block this builder should insert at the end of.
     *
     * @param bb The block.
     */
    public void setBlock(Block bb) {
        this.bb = bb;
    }

    /**
     * Allocate a new block at the end of the function, without moving to it.
     *
     * @return The block.
     */
    public Block newBlock() {
        return func.newBlock(ctx);
    }

    /**
     * Insert an instruction at the end of the block.
     *
     * @param inst The instruction.
     * @return The same instruction.
     */
    public Inst insert(Inst inst) {
        bb.append(ctx, inst);
        return inst;
    }

    /**
     * Insert an unconditional jump at the end of the block, recording its edge.
     *
     * @param target The jump target.
     * @return The jump.
     */
    public Inst br(Block target) {
        Inst jump = insert(Inst.br(ctx, target));
        bb.addSuccessor(ctx, target, jump, false);
        return jump;
    }

    /**
     * Insert a conditional jump at the end of the block, recording an edge for each arm.
     *
     * @param cond    The condition.
     * @param ifTrue  The true arm's target.
     * @param ifFalse The false arm's target.
     * @return The jump.
     */
    public Inst brCond(Inst cond, Block ifTrue, Block ifFalse) {
        Inst jump = insert(Inst.brCond(ctx, cond, ifTrue, ifFalse));
        bb.addSuccessor(ctx, ifTrue, jump, true);
        bb.addSuccessor(ctx, ifFalse, jump, false);
        return jump;
    }

    public Inst ret() {
        return insert(Inst.ret(ctx));
    }

    public Inst ret(Inst value) {
        return insert(Inst.ret(ctx, value));
    }
}
