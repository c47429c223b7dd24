package io.github.eutro.cfgir.ir;

import io.github.eutro.cfgir.InvariantViolationException;
import io.github.eutro.cfgir.StructuralPreconditionException;
import io.github.eutro.cfgir.arena.Arena;
import io.github.eutro.cfgir.arena.ArenaPtr;
import io.github.eutro.cfgir.arena.Ptr;
import io.github.eutro.cfgir.defuse.Usable;
import io.github.eutro.cfgir.list.LinkedListContainer;
import io.github.eutro.cfgir.list.LinkedListNode;
import io.github.eutro.cfgir.util.IrVerifier;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * A handle to a basic block.
 * <p>
 * A block is a node in its function's block list, the container of its own instruction list,
 * and is used by the instructions that jump to it (or name it in a phi). Its outgoing
 * control-flow edges are recorded separately from the instructions, as a set of {@link BlockEdge}s
 * that is only changed through {@link #addSuccessor(IrContext, Block, Inst, boolean)},
 * {@link #removeSuccessor(IrContext, Block, Inst, boolean)} and the bulk accessors.
 */
public final class Block extends ArenaPtr<IrContext, BlockData> implements
        LinkedListNode<IrContext, Block, Func>,
        LinkedListContainer<IrContext, Inst, Block>,
        Usable<IrContext, User<Block>> {
    private static final Logger LOGGER = Logger.getLogger(Block.class.getName());

    Block(Ptr<BlockData> ptr) {
        super(ptr);
    }

    @Override
    protected Arena<BlockData> arena(IrContext ctx) {
        return ctx.blocks;
    }

    BlockData data(IrContext ctx) {
        return deref(ctx);
    }

    /**
     * Allocate a new block, with no instructions, no successors and no users,
     * that is not part of any function.
     *
     * @param ctx The context.
     * @return The block.
     */
    public static Block create(IrContext ctx) {
        return new Block(ctx.blocks.allocWith(ptr -> new BlockData()));
    }

    /**
     * Get a name for this block, for debugging.
     * <p>
     * This is derived from the arena slot, which is reused after deallocation,
     * so it is not an identity.
     *
     * @param ctx The context.
     * @return The name.
     */
    public String name(IrContext ctx) {
        return "%bb_" + index();
    }

    /**
     * Remove this block from its function, deallocating it.
     *
     * @param ctx The context.
     * @see Func#removeBlock(IrContext, Block)
     */
    public void remove(IrContext ctx) {
        Func func = container(ctx);
        if (func == null) {
            throw new StructuralPreconditionException(name(ctx) + " is not part of a function");
        }
        func.removeBlock(ctx, this);
    }

    /**
     * Unlink and deallocate an instruction of this block.
     * <p>
     * Any edges the instruction was the terminator of are dropped with it,
     * as are its uses of its own operands.
     *
     * @param ctx  The context.
     * @param inst The instruction, which must be in this block and must not be used by anything.
     */
    public void removeInstruction(IrContext ctx, Inst inst) {
        if (!contains(ctx, inst)) {
            throw new StructuralPreconditionException(inst.name(ctx) + " is not in " + name(ctx));
        }
        inst.checkUnused(ctx);
        inst.unlink(ctx);
        inst.release(ctx);
        if (ctx.isVerifying()) IrVerifier.verifyBlock(ctx, this);
    }

    /**
     * Get the terminator of this block.
     *
     * @param ctx The context.
     * @return The last instruction if it is a control instruction, otherwise null.
     */
    public @Nullable Inst terminator(IrContext ctx) {
        Inst tail = tail(ctx);
        return tail != null && tail.isControl(ctx) ? tail : null;
    }

    /**
     * Record a control-flow edge from this block.
     *
     * @param ctx        The context.
     * @param target     The block jumped to.
     * @param terminator The jump, which must be in this block, and must jump to {@code target} on the given arm.
     * @param whichArm   For a conditional jump, whether this is the true arm. Ignored otherwise.
     */
    public void addSuccessor(IrContext ctx, Block target, Inst terminator, boolean whichArm) {
        BlockEdge edge;
        InstKind kind = terminator.kind(ctx);
        switch (kind) {
            case BR:
                edge = new BlockEdge(target, terminator, false);
                break;
            case COND_BR:
                edge = new BlockEdge(target, terminator, whichArm);
                break;
            default:
                throw notABranch(ctx, terminator);
        }
        checkArm(ctx, target, terminator, kind, whichArm);
        data(ctx).successors.add(edge);
        if (ctx.isVerifying()) IrVerifier.verifyBlock(ctx, this);
    }

    /**
     * Remove a control-flow edge from this block, changing its terminator to match.
     * <p>
     * If the terminator is an unconditional jump, it is deleted and the block is left without one.
     * <p>
     * If the terminator is a conditional jump, it is replaced with an unconditional jump
     * to the target of the arm that was not removed. The replacement is linked in
     * before the old terminator is deleted, so the block is never without a terminator.
     *
     * @param ctx        The context.
     * @param target     The block jumped to.
     * @param terminator The jump, which must be in this block, and must jump to {@code target} on the given arm.
     * @param whichArm   For a conditional jump, whether the true arm is being removed. Ignored otherwise.
     * @return The new unconditional jump, or null if the terminator was an unconditional jump.
     */
    public @Nullable Inst removeSuccessor(IrContext ctx, Block target, Inst terminator, boolean whichArm) {
        InstKind kind = terminator.kind(ctx);
        switch (kind) {
            case BR:
                checkArm(ctx, target, terminator, kind, false);
                removeInstruction(ctx, terminator);
                return null;
            case COND_BR: {
                checkArm(ctx, target, terminator, kind, whichArm);
                terminator.checkUnused(ctx);
                Block survivor = terminator.target(ctx, kind.targetSlot(!whichArm));

                // both arms of the old jump go stale together
                Set<BlockEdge> successors = data(ctx).successors;
                successors.remove(new BlockEdge(target, terminator, whichArm));
                successors.remove(new BlockEdge(survivor, terminator, !whichArm));

                Inst jump = Inst.br(ctx, survivor);
                terminator.insertAfter(ctx, jump);
                removeInstruction(ctx, terminator);
                addSuccessor(ctx, survivor, jump, false);

                LOGGER.fine(() -> "Collapsed conditional jump in " + name(ctx)
                        + " to " + jump.display(ctx));
                return jump;
            }
            default:
                throw notABranch(ctx, terminator);
        }
    }

    private StructuralPreconditionException notABranch(IrContext ctx, Inst terminator) {
        return new StructuralPreconditionException("not a branch: " + terminator.display(ctx));
    }

    private void checkArm(IrContext ctx, Block target, Inst terminator, InstKind kind, boolean whichArm) {
        if (!contains(ctx, terminator)) {
            throw new StructuralPreconditionException(terminator.name(ctx) + " is not in " + name(ctx));
        }
        Block actual = terminator.target(ctx, kind.targetSlot(whichArm));
        if (!actual.equals(target)) {
            throw new StructuralPreconditionException(terminator.display(ctx)
                    + " does not jump to " + target.name(ctx)
                    + (kind == InstKind.COND_BR ? " on its " + whichArm + " arm" : ""));
        }
    }

    void dropEdgesFrom(IrContext ctx, Inst terminator) {
        data(ctx).successors.removeIf(edge -> edge.terminator().equals(terminator));
    }

    public void clearSuccessors(IrContext ctx) {
        data(ctx).successors.clear();
    }

    /**
     * Replace the successors of this block with a copy of {@code successors}.
     * <p>
     * This is for moving an entire edge set between blocks along with
     * the terminators it refers to.
     *
     * @param ctx        The context.
     * @param successors The new edges.
     */
    public void copySuccessors(IrContext ctx, Set<BlockEdge> successors) {
        data(ctx).successors = new LinkedHashSet<>(successors);
    }

    /**
     * Get the edges out of this block.
     *
     * @param ctx The context.
     * @return A snapshot of the edges, which is unaffected by later changes.
     */
    public Set<BlockEdge> successors(IrContext ctx) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(data(ctx).successors));
    }

    /**
     * Get the distinct blocks this block has edges to, in edge order.
     *
     * @param ctx The context.
     * @return The blocks.
     */
    public List<Block> successorBlocks(IrContext ctx) {
        Set<Block> blocks = new LinkedHashSet<>();
        for (BlockEdge edge : data(ctx).successors) {
            blocks.add(edge.target());
        }
        return new ArrayList<>(blocks);
    }

    /**
     * Make every user of this block use {@code other} instead.
     * <p>
     * Edges recorded for the redirected jumps are retargeted too.
     *
     * @param ctx   The context.
     * @param other The replacement.
     */
    public void replaceAllUsesWith(IrContext ctx, Block other) {
        if (other.equals(this)) return;
        other.data(ctx);
        for (User<Block> user : users(ctx)) {
            Inst inst = user.inst();
            Block owner = inst.container(ctx);
            InstKind kind = inst.kind(ctx);
            boolean arm = kind.armOf(user.slot());
            boolean hadEdge = owner != null
                    && kind != InstKind.OTHER
                    && owner.data(ctx).successors.remove(new BlockEdge(this, inst, arm));
            inst.setTarget(ctx, user.slot(), other);
            if (hadEdge) {
                owner.data(ctx).successors.add(new BlockEdge(other, inst, arm));
            }
        }
    }

    /**
     * Deallocate this block.
     * <p>
     * The block must already be detached from its function, empty, without successors, and unused.
     *
     * @param ctx The context.
     * @return True if the block was deallocated, false if it already had been.
     * @throws InvariantViolationException If the block is still linked or referenced.
     */
    public boolean dealloc(IrContext ctx) {
        BlockData data = tryDeref(ctx);
        if (data == null) return false;
        if (data.container != null) {
            throw new InvariantViolationException(name(ctx) + " is still part of " + data.container.name(ctx));
        }
        if (data.head != null) {
            throw new InvariantViolationException(name(ctx) + " still has instructions");
        }
        if (!data.successors.isEmpty()) {
            throw new InvariantViolationException(name(ctx) + " still has successors " + data.successors);
        }
        if (!data.users.isEmpty()) {
            throw new InvariantViolationException(name(ctx) + " is still used by " + data.users);
        }
        ctx.blocks.tryDealloc(ptr);
        LOGGER.finer(() -> "Deallocated " + this);
        return true;
    }

    /**
     * Render this block: a label line, then one indented line per instruction.
     *
     * @param ctx The context.
     * @return The rendered block.
     */
    public String display(IrContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append("bb_").append(index()).append(':');
        for (Inst inst : iter(ctx)) {
            sb.append("\n\t").append(inst.display(ctx));
        }
        return sb.toString();
    }

    @Override
    public Set<User<Block>> users(IrContext ctx) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(data(ctx).users));
    }

    @Override
    public void insertUser(IrContext ctx, User<Block> user) {
        data(ctx).users.add(user);
    }

    @Override
    public void removeUser(IrContext ctx, User<Block> user) {
        data(ctx).users.remove(user);
    }

    // block list

    @Override
    public @Nullable Block next(IrContext ctx) {
        return data(ctx).next;
    }

    @Override
    public @Nullable Block prev(IrContext ctx) {
        return data(ctx).prev;
    }

    @Override
    public @Nullable Func container(IrContext ctx) {
        return data(ctx).container;
    }

    @Override
    public void setNext(IrContext ctx, @Nullable Block next) {
        data(ctx).next = next;
    }

    @Override
    public void setPrev(IrContext ctx, @Nullable Block prev) {
        data(ctx).prev = prev;
    }

    @Override
    public void setContainer(IrContext ctx, @Nullable Func container) {
        data(ctx).container = container;
    }

    // instruction list

    @Override
    public @Nullable Inst head(IrContext ctx) {
        return data(ctx).head;
    }

    @Override
    public @Nullable Inst tail(IrContext ctx) {
        return data(ctx).tail;
    }

    @Override
    public void setHead(IrContext ctx, @Nullable Inst head) {
        data(ctx).head = head;
    }

    @Override
    public void setTail(IrContext ctx, @Nullable Inst tail) {
        data(ctx).tail = tail;
    }
}
