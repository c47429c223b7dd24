package io.github.eutro.cfgir.ir;

import io.github.eutro.cfgir.StructuralPreconditionException;
import io.github.eutro.cfgir.ops.CommonOps;
import io.github.eutro.cfgir.ops.OpKey;

/**
 * The kinds of instruction the control-flow graph distinguishes.
 */
public enum InstKind {
    /**
     * {@link CommonOps#BR}, with one edge.
     */
    BR(1),
    /**
     * {@link CommonOps#BR_COND}, with an edge for each arm.
     */
    COND_BR(2),
    /**
     * Anything else, which never has edges.
     */
    OTHER(0);

    /**
     * The number of edges a terminator of this kind has while it is live.
     */
    public final int edgeCount;

    InstKind(int edgeCount) {
        this.edgeCount = edgeCount;
    }

    static InstKind of(OpKey key) {
        if (key == CommonOps.BR.key) return BR;
        if (key == CommonOps.BR_COND.key) return COND_BR;
        return OTHER;
    }

    /**
     * Get the target slot that holds the destination of the given arm.
     *
     * @param trueArm Which arm. Ignored for {@link #BR}.
     * @return The index into the instruction's targets.
     */
    public int targetSlot(boolean trueArm) {
        switch (this) {
            case BR:
                return 0;
            case COND_BR:
                return trueArm ? 0 : 1;
            default:
                throw new StructuralPreconditionException(this + " instructions have no control-flow arms");
        }
    }

    /**
     * Get the arm the given target slot belongs to.
     *
     * @param slot The index into the instruction's targets.
     * @return Whether it is the true arm.
     */
    public boolean armOf(int slot) {
        return this == COND_BR && slot == 0;
    }
}
