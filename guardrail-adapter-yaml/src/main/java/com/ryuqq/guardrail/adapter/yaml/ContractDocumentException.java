package com.ryuqq.guardrail.adapter.yaml;

/**
 * Thrown when a contract document or dependency snapshot cannot be mapped to the model.
 *
 * <p>The message and {@link #getPointer()} name the JSON pointer of the offending node
 * (e.g. {@code /rules/0/machine/initial_state}) so the author can locate the problem.</p>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public class ContractDocumentException extends RuntimeException {

    private final String pointer;

    /**
     * Creates a new exception.
     *
     * @param pointer JSON pointer of the offending node ("" for the document root)
     * @param message what is wrong with the node
     */
    public ContractDocumentException(String pointer, String message) {
        super(format(pointer, message));
        this.pointer = pointer;
    }

    /**
     * Creates a new exception with a cause.
     *
     * @param pointer JSON pointer of the offending node ("" for the document root)
     * @param message what is wrong with the node
     * @param cause the underlying parse or validation error
     */
    public ContractDocumentException(String pointer, String message, Throwable cause) {
        super(format(pointer, message), cause);
        this.pointer = pointer;
    }

    private static String format(String pointer, String message) {
        return "Invalid document at '" + (pointer == null || pointer.isEmpty() ? "/" : pointer) + "': " + message;
    }

    /**
     * Returns the JSON pointer of the offending node.
     *
     * @return the pointer ("" for the document root)
     */
    public String getPointer() {
        return pointer;
    }
}
