package io.github.eutro.cfgir;

/**
 * A compiler-internal error raised by the IR layer.
 * <p>
 * These are never caused by end-user input; they indicate malformed IR
 * produced by a bug in whichever pass is manipulating it. A pass may catch
 * this to report an internal error and abort cleanly.
 */
public abstract class IrException extends RuntimeException {
    protected IrException(String message) {
        super(message);
    }
}
