package io.github.eutro.cfgir.ir;

import org.jetbrains.annotations.Nullable;

final class FuncData {
    final String name;

    @Nullable Block head;
    @Nullable Block tail;

    FuncData(String name) {
        this.name = name;
    }
}
