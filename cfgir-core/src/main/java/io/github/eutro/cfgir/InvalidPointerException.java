package io.github.eutro.cfgir;

/**
 * Thrown when dereferencing a pointer whose arena slot is absent,
 * either because it was deallocated or because it was reused by a later allocation.
 */
public class InvalidPointerException extends IrException {
    public InvalidPointerException(String message) {
        super(message);
    }
}
