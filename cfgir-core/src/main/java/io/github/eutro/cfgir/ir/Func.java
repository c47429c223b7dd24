package io.github.eutro.cfgir.ir;

import io.github.eutro.cfgir.InvariantViolationException;
import io.github.eutro.cfgir.StructuralPreconditionException;
import io.github.eutro.cfgir.arena.Arena;
import io.github.eutro.cfgir.arena.ArenaPtr;
import io.github.eutro.cfgir.arena.Ptr;
import io.github.eutro.cfgir.list.LinkedListContainer;
import io.github.eutro.cfgir.util.GraphWalker;
import io.github.eutro.cfgir.util.IrVerifier;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * A handle to a function: a named list of basic blocks, the first of which is the entry.
 * <p>
 * The function is the only thing that can remove one of its blocks, since it is
 * the only thing that can enumerate every other block that might still refer to it.
 */
public final class Func extends ArenaPtr<IrContext, FuncData> implements LinkedListContainer<IrContext, Block, Func> {
    private static final Logger LOGGER = Logger.getLogger(Func.class.getName());

    Func(Ptr<FuncData> ptr) {
        super(ptr);
    }

    @Override
    protected Arena<FuncData> arena(IrContext ctx) {
        return ctx.funcs;
    }

    FuncData data(IrContext ctx) {
        return deref(ctx);
    }

    public static Func create(IrContext ctx, String name) {
        return new Func(ctx.funcs.allocWith(ptr -> new FuncData(name)));
    }

    public String name(IrContext ctx) {
        return data(ctx).name;
    }

    /**
     * Allocate a new block at the end of this function.
     *
     * @param ctx The context.
     * @return The block.
     */
    public Block newBlock(IrContext ctx) {
        Block bb = Block.create(ctx);
        append(ctx, bb);
        return bb;
    }

    public @Nullable Block entry(IrContext ctx) {
        return head(ctx);
    }

    public Iterable<Block> blocks(IrContext ctx) {
        return iter(ctx);
    }

    /**
     * Detach a block from this function and deallocate it.
     * <p>
     * The block's own instructions are removed along with it, which also drops its outgoing
     * edges and the uses its instructions hold on other blocks and values.
     * References <i>into</i> the block are not touched: the block must not be the target of any
     * other block's edges or instructions, and its values must not be used outside of it.
     * Callers should redirect or delete those first.
     *
     * @param ctx   The context.
     * @param block The block, which must be in this function.
     * @throws InvariantViolationException If anything outside the block still refers to it or its values.
     */
    public void removeBlock(IrContext ctx, Block block) {
        if (!contains(ctx, block)) {
            throw new StructuralPreconditionException(block.name(ctx) + " is not in " + name(ctx));
        }
        for (User<Block> user : block.users(ctx)) {
            if (!block.equals(user.inst().container(ctx))) {
                throw new InvariantViolationException(block.name(ctx) + " is still used by " + user.inst().display(ctx));
            }
        }
        for (Block other : iter(ctx)) {
            if (other.equals(block)) continue;
            for (BlockEdge edge : other.data(ctx).successors) {
                if (edge.target().equals(block)) {
                    throw new InvariantViolationException(block.name(ctx) + " is still a successor of " + other.name(ctx));
                }
            }
        }
        for (Inst inst : block.iter(ctx)) {
            for (User<Inst> user : inst.users(ctx)) {
                if (!block.equals(user.inst().container(ctx))) {
                    throw new InvariantViolationException(inst.name(ctx) + " is still used by " + user.inst().display(ctx));
                }
            }
        }

        block.clearSuccessors(ctx);
        for (Inst inst : block.iter(ctx)) {
            inst.dropOperands(ctx);
        }
        for (Inst inst : block.iter(ctx)) {
            inst.unlink(ctx);
            inst.release(ctx);
        }
        block.unlink(ctx);
        block.dealloc(ctx);

        LOGGER.fine(() -> "Removed " + block + " from " + name(ctx));
        if (ctx.isVerifying()) IrVerifier.verifyBlockList(ctx, this);
    }

    /**
     * Find the blocks of this function that have an edge to {@code block}.
     * <p>
     * Predecessors are not stored; this scans every block's successors.
     *
     * @param ctx   The context.
     * @param block The block.
     * @return The predecessors, in block order, without duplicates.
     */
    public List<Block> predecessors(IrContext ctx, Block block) {
        List<Block> preds = new ArrayList<>();
        for (Block bb : iter(ctx)) {
            for (BlockEdge edge : bb.data(ctx).successors) {
                if (edge.target().equals(block)) {
                    preds.add(bb);
                    break;
                }
            }
        }
        return preds;
    }

    /**
     * Get the blocks reachable from the entry block along successor edges, in depth-first pre-order.
     *
     * @param ctx The context.
     * @return The reachable blocks.
     */
    public List<Block> reachableBlocks(IrContext ctx) {
        Block entry = entry(ctx);
        if (entry == null) return Collections.emptyList();
        return GraphWalker.blockWalker(ctx, entry).preOrder().toList();
    }

    /**
     * Deallocate this function, with all of its blocks and instructions.
     *
     * @param ctx The context.
     * @throws InvariantViolationException If anything outside this function refers to its blocks or values.
     */
    public void destroy(IrContext ctx) {
        for (Block block : iter(ctx)) {
            for (User<Block> user : block.users(ctx)) {
                checkInternal(ctx, block.name(ctx), user.inst());
            }
            for (Inst inst : block.iter(ctx)) {
                for (User<Inst> user : inst.users(ctx)) {
                    checkInternal(ctx, inst.name(ctx), user.inst());
                }
            }
        }

        for (Block block : iter(ctx)) {
            block.clearSuccessors(ctx);
            for (Inst inst : block.iter(ctx)) {
                inst.dropOperands(ctx);
            }
        }
        for (Block block : iter(ctx)) {
            for (Inst inst : block.iter(ctx)) {
                inst.unlink(ctx);
                inst.release(ctx);
            }
            block.unlink(ctx);
            block.dealloc(ctx);
        }
        ctx.funcs.tryDealloc(ptr);
        LOGGER.fine(() -> "Destroyed " + this);
    }

    private void checkInternal(IrContext ctx, String what, Inst user) {
        Block userBlock = user.container(ctx);
        if (userBlock == null || !equals(userBlock.container(ctx))) {
            throw new InvariantViolationException(what + " is still used outside of " + name(ctx)
                    + " by " + user.display(ctx));
        }
    }

    /**
     * Render this function and all its blocks.
     *
     * @param ctx The context.
     * @return The rendered function.
     */
    public String display(IrContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(name(ctx)).append(" {\n");
        for (Block block : iter(ctx)) {
            sb.append(block.display(ctx)).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }

    @Override
    public @Nullable Block head(IrContext ctx) {
        return data(ctx).head;
    }

    @Override
    public @Nullable Block tail(IrContext ctx) {
        return data(ctx).tail;
    }

    @Override
    public void setHead(IrContext ctx, @Nullable Block head) {
        data(ctx).head = head;
    }

    @Override
    public void setTail(IrContext ctx, @Nullable Block tail) {
        data(ctx).tail = tail;
    }
}
