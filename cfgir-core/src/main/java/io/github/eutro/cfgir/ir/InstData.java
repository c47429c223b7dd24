package io.github.eutro.cfgir.ir;

import io.github.eutro.cfgir.ops.Op;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

final class InstData {
    final Op op;
    final List<Inst> args;
    final List<Block> targets;
    final Set<User<Inst>> users = new LinkedHashSet<>();

    @Nullable Inst next;
    @Nullable Inst prev;
    @Nullable Block container;

    final @Nullable Throwable created;

    InstData(Op op, List<Inst> args, List<Block> targets) {
        this.op = op;
        this.args = new ArrayList<>(args);
        this.targets = new ArrayList<>(targets);
        this.created = IrContext.TRACK_INST_CREATIONS ? new Throwable("constructed") : null;
    }
}
