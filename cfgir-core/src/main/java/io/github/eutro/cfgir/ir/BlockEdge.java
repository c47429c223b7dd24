package io.github.eutro.cfgir.ir;

import java.util.Objects;

/**
 * A control-flow edge out of a block: its target, the terminator that jumps there,
 * and which arm of the terminator it is.
 * <p>
 * Both arms of a conditional branch are distinct edges, even when they target the same block.
 * Unconditional branches always have {@code isTrueArm == false}.
 */
public final class BlockEdge {
    private final Block target;
    private final Inst terminator;
    private final boolean isTrueArm;

    public BlockEdge(Block target, Inst terminator, boolean isTrueArm) {
        this.target = target;
        this.terminator = terminator;
        this.isTrueArm = isTrueArm;
    }

    public Block target() {
        return target;
    }

    public Inst terminator() {
        return terminator;
    }

    public boolean isTrueArm() {
        return isTrueArm;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BlockEdge edge = (BlockEdge) o;
        return isTrueArm == edge.isTrueArm
                && target.equals(edge.target)
                && terminator.equals(edge.terminator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, terminator, isTrueArm);
    }

    @Override
    public String toString() {
        return "(" + target + ", " + terminator + ", " + isTrueArm + ")";
    }
}
