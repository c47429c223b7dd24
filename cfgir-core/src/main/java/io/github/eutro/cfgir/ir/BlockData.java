package io.github.eutro.cfgir.ir;

import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashSet;
import java.util.Set;

final class BlockData {
    final Set<User<Block>> users = new LinkedHashSet<>();

    @Nullable Block next;
    @Nullable Block prev;
    @Nullable Func container;

    Set<BlockEdge> successors = new LinkedHashSet<>();

    @Nullable Inst head;
    @Nullable Inst tail;
}
