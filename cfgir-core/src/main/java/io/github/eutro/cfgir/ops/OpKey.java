package io.github.eutro.cfgir.ops;

/**
 * An operation key, representing a type of operation, without intermediates.
 */
public abstract class OpKey {
    public final String mnemonic;
    private boolean control = false;

    public OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    /**
     * Mark this as a control operation, which may only end a block and produces no value.
     *
     * @return This key.
     */
    public OpKey markControl() {
        control = true;
        return this;
    }

    public boolean isControl() {
        return control;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
