package io.github.eutro.cfgir.ops;

/**
 * The {@link Op}s and {@link OpKey}s the control-flow layer knows about.
 * <p>
 * Only {@link #BR} and {@link #BR_COND} produce control-flow edges.
 */
public class CommonOps {
    /**
     * Control: an unconditional jump to its only target.
     */
    public static final Op BR = control("br");
    /**
     * Control: jumps to its first target if its only argument is true, otherwise to its second target.
     */
    public static final Op BR_COND = control("br_cond");
    /**
     * Control: returns from the function, with its argument if there is one.
     */
    public static final Op RETURN = control("return");

    /**
     * Effect: returns the argument corresponding to the predecessor that was jumped from.
     * The incoming blocks are its targets, in the same order as its arguments.
     * <p>
     * Must precede any other (non-phi) instruction within its basic block.
     */
    public static final Op PHI = new SimpleOpKey("phi").create();

    /**
     * Effect: returns the {@code n}th argument of the function.
     */
    public static final UnaryOpKey<Integer> ARG = new UnaryOpKey<>("arg");
    /**
     * Effect: returns the constant.
     */
    public static final UnaryOpKey<Object> CONST = new UnaryOpKey<>("const").allowNull();

    private static Op control(String mnemonic) {
        SimpleOpKey key = new SimpleOpKey(mnemonic);
        key.markControl();
        return key.create();
    }
}
