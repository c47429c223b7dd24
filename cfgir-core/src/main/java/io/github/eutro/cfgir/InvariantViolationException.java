package io.github.eutro.cfgir;

/**
 * Thrown when the IR would be (or already is) left in a state that breaks one of its invariants,
 * such as deallocating a node that is still linked or still referenced.
 */
public class InvariantViolationException extends IrException {
    public InvariantViolationException(String message) {
        super(message);
    }
}
