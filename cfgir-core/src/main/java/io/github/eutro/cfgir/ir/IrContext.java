package io.github.eutro.cfgir.ir;

import io.github.eutro.cfgir.arena.Arena;

/**
 * The aggregate owning every arena of a piece of IR.
 * <p>
 * All handles ({@link Block}, {@link Inst}, {@link Func}) are only meaningful
 * relative to the context they were allocated in, and every operation on them
 * takes that context explicitly. A context must only be mutated by one thread at a time;
 * independent compilation units should use independent contexts.
 */
public final class IrContext {
    /**
     * Whether new contexts run the {@link io.github.eutro.cfgir.util.IrVerifier verifier}
     * after each structural mutation.
     */
    public static boolean VERIFY_BY_DEFAULT = System.getenv("CFGIR_VERIFY") != null;
    /**
     * Whether new instructions remember the stack trace they were created at.
     */
    public static boolean TRACK_INST_CREATIONS = System.getenv("CFGIR_TRACK_INST_CREATIONS") != null;

    final Arena<BlockData> blocks = new Arena<>("block");
    final Arena<InstData> insts = new Arena<>("instruction");
    final Arena<FuncData> funcs = new Arena<>("function");

    private boolean verifying = VERIFY_BY_DEFAULT;

    public boolean isVerifying() {
        return verifying;
    }

    public void setVerifying(boolean verifying) {
        this.verifying = verifying;
    }

    public int liveBlocks() {
        return blocks.size();
    }

    public int liveInsts() {
        return insts.size();
    }

    public int liveFuncs() {
        return funcs.size();
    }
}
