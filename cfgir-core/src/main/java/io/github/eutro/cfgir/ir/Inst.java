package io.github.eutro.cfgir.ir;

import io.github.eutro.cfgir.InvariantViolationException;
import io.github.eutro.cfgir.StructuralPreconditionException;
import io.github.eutro.cfgir.arena.Arena;
import io.github.eutro.cfgir.arena.ArenaPtr;
import io.github.eutro.cfgir.arena.Ptr;
import io.github.eutro.cfgir.defuse.Usable;
import io.github.eutro.cfgir.list.LinkedListNode;
import io.github.eutro.cfgir.ops.CommonOps;
import io.github.eutro.cfgir.ops.Op;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A handle to an instruction.
 * <p>
 * An instruction has an {@link Op operation}, a list of argument instructions whose values it uses,
 * and a list of target blocks. It is a node in its block's instruction list, and keeps track of
 * every operand slot that uses its value.
 */
public final class Inst extends ArenaPtr<IrContext, InstData> implements
        LinkedListNode<IrContext, Inst, Block>,
        Usable<IrContext, User<Inst>> {
    Inst(Ptr<InstData> ptr) {
        super(ptr);
    }

    @Override
    protected Arena<InstData> arena(IrContext ctx) {
        return ctx.insts;
    }

    InstData data(IrContext ctx) {
        return deref(ctx);
    }

    /**
     * Create a new, unlinked instruction, registering it as a user of each of its operands.
     *
     * @param ctx     The context.
     * @param op      The operation.
     * @param args    The argument instructions.
     * @param targets The target blocks.
     * @return The instruction.
     */
    public static Inst create(IrContext ctx, Op op, List<Inst> args, List<Block> targets) {
        for (Inst arg : args) arg.data(ctx);
        for (Block target : targets) target.data(ctx);
        Inst inst = new Inst(ctx.insts.allocWith(ptr -> new InstData(op, args, targets)));
        for (int i = 0; i < args.size(); i++) {
            args.get(i).insertUser(ctx, User.of(inst, i));
        }
        for (int i = 0; i < targets.size(); i++) {
            targets.get(i).insertUser(ctx, User.of(inst, i));
        }
        return inst;
    }

    /**
     * Create an unconditional jump to {@code target}.
     *
     * @param ctx    The context.
     * @param target The jump target.
     * @return The jump instruction.
     */
    public static Inst br(IrContext ctx, Block target) {
        return CommonOps.BR.insn(ctx, Collections.emptyList(), Collections.singletonList(target));
    }

    /**
     * Create a conditional jump.
     *
     * @param ctx     The context.
     * @param cond    The condition.
     * @param ifTrue  The target when the condition holds, the true arm.
     * @param ifFalse The target otherwise, the false arm.
     * @return The jump instruction.
     */
    public static Inst brCond(IrContext ctx, Inst cond, Block ifTrue, Block ifFalse) {
        return CommonOps.BR_COND.insn(ctx, Collections.singletonList(cond), Arrays.asList(ifTrue, ifFalse));
    }

    public static Inst ret(IrContext ctx) {
        return CommonOps.RETURN.insn(ctx);
    }

    public static Inst ret(IrContext ctx, Inst value) {
        return CommonOps.RETURN.insn(ctx, Collections.singletonList(value));
    }

    public static Inst constant(IrContext ctx, @Nullable Object k) {
        return CommonOps.CONST.create(k).insn(ctx);
    }

    public static Inst arg(IrContext ctx, int n) {
        return CommonOps.ARG.create(n).insn(ctx);
    }

    /**
     * Create a phi, selecting {@code values.get(i)} when control came from {@code preds.get(i)}.
     *
     * @param ctx    The context.
     * @param preds  The incoming blocks.
     * @param values The incoming values.
     * @return The phi instruction.
     */
    public static Inst phi(IrContext ctx, List<Block> preds, List<Inst> values) {
        if (preds.size() != values.size()) {
            throw new StructuralPreconditionException("phi has " + preds.size()
                    + " incoming blocks but " + values.size() + " values");
        }
        return CommonOps.PHI.insn(ctx, values, preds);
    }

    public Op op(IrContext ctx) {
        return data(ctx).op;
    }

    public InstKind kind(IrContext ctx) {
        return InstKind.of(op(ctx).key);
    }

    public boolean isControl(IrContext ctx) {
        return op(ctx).key.isControl();
    }

    public List<Inst> args(IrContext ctx) {
        return Collections.unmodifiableList(data(ctx).args);
    }

    public Inst argAt(IrContext ctx, int i) {
        return data(ctx).args.get(i);
    }

    public List<Block> targets(IrContext ctx) {
        return Collections.unmodifiableList(data(ctx).targets);
    }

    public Block target(IrContext ctx, int i) {
        return data(ctx).targets.get(i);
    }

    /**
     * Replace an argument, moving the use from the old value to the new one.
     *
     * @param ctx   The context.
     * @param i     The argument slot.
     * @param value The new argument.
     */
    public void setArg(IrContext ctx, int i, Inst value) {
        value.data(ctx);
        List<Inst> args = data(ctx).args;
        Inst old = args.set(i, value);
        User<Inst> user = User.of(this, i);
        old.removeUser(ctx, user);
        value.insertUser(ctx, user);
    }

    /**
     * Replace a target, moving the use from the old block to the new one.
     * <p>
     * This only touches the operand; the edges recorded on the containing block are
     * the responsibility of the caller (see {@link Block#replaceAllUsesWith(IrContext, Block)}).
     *
     * @param ctx    The context.
     * @param i      The target slot.
     * @param target The new target.
     */
    public void setTarget(IrContext ctx, int i, Block target) {
        target.data(ctx);
        List<Block> targets = data(ctx).targets;
        Block old = targets.set(i, target);
        User<Block> user = User.of(this, i);
        old.removeUser(ctx, user);
        target.insertUser(ctx, user);
    }

    /**
     * Make every user of this instruction use {@code other} instead.
     *
     * @param ctx   The context.
     * @param other The replacement.
     */
    public void replaceAllUsesWith(IrContext ctx, Inst other) {
        if (other.equals(this)) return;
        for (User<Inst> user : users(ctx)) {
            user.inst().setArg(ctx, user.slot(), other);
        }
    }

    /**
     * Get the block this instruction is in.
     *
     * @param ctx The context.
     * @return The block, or null if it is not linked into one.
     */
    public @Nullable Block block(IrContext ctx) {
        return container(ctx);
    }

    /**
     * Unlink this instruction from its block.
     * <p>
     * Any edges the block recorded with this instruction as their terminator are dropped,
     * so relinking a jump elsewhere requires recording its edges again.
     *
     * @param ctx The context.
     */
    @Override
    public void unlink(IrContext ctx) {
        Block block = container(ctx);
        if (block != null) block.dropEdgesFrom(ctx, this);
        LinkedListNode.super.unlink(ctx);
    }

    /**
     * Remove this instruction from its block (if any) and deallocate it.
     *
     * @param ctx The context.
     * @throws InvariantViolationException If anything still uses this instruction.
     */
    public void remove(IrContext ctx) {
        Block block = container(ctx);
        if (block != null) {
            block.removeInstruction(ctx, this);
        } else {
            release(ctx);
        }
    }

    // drops this instruction's own uses of its operands
    void dropOperands(IrContext ctx) {
        InstData data = data(ctx);
        for (int i = 0; i < data.args.size(); i++) {
            Inst arg = data.args.get(i);
            if (arg.isValid(ctx)) arg.removeUser(ctx, User.of(this, i));
        }
        for (int i = 0; i < data.targets.size(); i++) {
            Block target = data.targets.get(i);
            if (target.isValid(ctx)) target.removeUser(ctx, User.of(this, i));
        }
        data.args.clear();
        data.targets.clear();
    }

    void checkUnused(IrContext ctx) {
        Set<User<Inst>> users = data(ctx).users;
        if (!users.isEmpty()) {
            throw new InvariantViolationException(name(ctx) + " is still used by " + users);
        }
    }

    void release(IrContext ctx) {
        InstData data = data(ctx);
        if (data.container != null) {
            throw new InvariantViolationException(name(ctx) + " is still linked into " + data.container.name(ctx));
        }
        checkUnused(ctx);
        dropOperands(ctx);
        ctx.insts.tryDealloc(ptr);
    }

    /**
     * Get the stack trace this instruction was created at, if {@link IrContext#TRACK_INST_CREATIONS} was set.
     *
     * @param ctx The context.
     * @return The creation trace, or null.
     */
    public @Nullable Throwable created(IrContext ctx) {
        return data(ctx).created;
    }

    public String name(IrContext ctx) {
        return "%v" + index();
    }

    /**
     * Render this instruction on a single line.
     *
     * @param ctx The context.
     * @return The rendered instruction.
     */
    public String display(IrContext ctx) {
        InstData data = data(ctx);
        StringBuilder sb = new StringBuilder();
        if (!data.op.key.isControl()) {
            sb.append(name(ctx)).append(" = ");
        }
        sb.append(data.op);
        for (Inst arg : data.args) {
            sb.append(' ').append(arg.name(ctx));
        }
        if (!data.targets.isEmpty()) {
            sb.append(" ->");
            for (Block target : data.targets) {
                sb.append(' ').append(target.name(ctx));
            }
        }
        return sb.toString();
    }

    @Override
    public Set<User<Inst>> users(IrContext ctx) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(data(ctx).users));
    }

    @Override
    public void insertUser(IrContext ctx, User<Inst> user) {
        data(ctx).users.add(user);
    }

    @Override
    public void removeUser(IrContext ctx, User<Inst> user) {
        data(ctx).users.remove(user);
    }

    @Override
    public @Nullable Inst next(IrContext ctx) {
        return data(ctx).next;
    }

    @Override
    public @Nullable Inst prev(IrContext ctx) {
        return data(ctx).prev;
    }

    @Override
    public @Nullable Block container(IrContext ctx) {
        return data(ctx).container;
    }

    @Override
    public void setNext(IrContext ctx, @Nullable Inst next) {
        data(ctx).next = next;
    }

    @Override
    public void setPrev(IrContext ctx, @Nullable Inst prev) {
        data(ctx).prev = prev;
    }

    @Override
    public void setContainer(IrContext ctx, @Nullable Block container) {
        data(ctx).container = container;
    }
}
