package io.github.eutro.cfgir.ops;

import org.jetbrains.annotations.Nullable;

/**
 * A key for operations that carry a single immediate of type {@code T}.
 *
 * @param <T> The type of the immediate.
 */
public class UnaryOpKey<T> extends OpKey {
    private boolean nullable = false;

    public UnaryOpKey(String mnemonic) {
        super(mnemonic);
    }

    /**
     * Permit null immediates.
     *
     * @return This key.
     */
    public UnaryOpKey<T> allowNull() {
        nullable = true;
        return this;
    }

    public class UnaryOp extends Op {
        public final @Nullable T arg;

        UnaryOp(@Nullable T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return key + " " + arg;
        }
    }

    public UnaryOp create(@Nullable T arg) {
        if (arg == null && !nullable) {
            throw new IllegalArgumentException(mnemonic + " takes no null immediate");
        }
        return new UnaryOp(arg);
    }

    /**
     * Read the immediate of an operation with this key.
     *
     * @param op The operation.
     * @return The immediate.
     * @throws ClassCastException If the operation has a different key.
     */
    public @Nullable T immediate(Op op) {
        if (op.key != this) {
            throw new ClassCastException(op + " is not a " + mnemonic + " operation");
        }
        @SuppressWarnings("unchecked")
        UnaryOp unary = (UnaryOp) op;
        return unary.arg;
    }
}
