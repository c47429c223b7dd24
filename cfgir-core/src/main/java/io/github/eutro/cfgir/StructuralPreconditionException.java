package io.github.eutro.cfgir;

/**
 * Thrown when an operation is applied to IR that is not shaped the way the operation requires,
 * such as removing an instruction from a block that does not contain it,
 * or recording a control-flow edge for an instruction that is not a branch.
 * <p>
 * The IR is left unchanged when this is thrown.
 */
public class StructuralPreconditionException extends IrException {
    public StructuralPreconditionException(String message) {
        super(message);
    }
}
