package io.github.eutro.cfgir.ops;

import io.github.eutro.cfgir.ir.Block;
import io.github.eutro.cfgir.ir.Inst;
import io.github.eutro.cfgir.ir.IrContext;

import java.util.Collections;
import java.util.List;

/**
 * An operation, encapsulating an {@link OpKey operation key} and any intermediates.
 */
public /* virtual */ class Op {
    public final OpKey key;

    public Op(OpKey key) {
        this.key = key;
    }

    @Override
    public String toString() {
        return key.toString();
    }

    public Inst insn(IrContext ctx, List<Inst> args, List<Block> targets) {
        return Inst.create(ctx, this, args, targets);
    }

    public Inst insn(IrContext ctx, List<Inst> args) {
        return insn(ctx, args, Collections.emptyList());
    }

    public Inst insn(IrContext ctx) {
        return insn(ctx, Collections.emptyList());
    }
}
