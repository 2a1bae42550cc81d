package com.mimecast.outpost.expr;

/**
 * Thrown when an expression cannot be parsed.
 */
public class ExpressionException extends Exception {

    /**
     * Constructs a new ExpressionException instance.
     *
     * @param message Error message.
     */
    public ExpressionException(String message) {
        super(message);
    }
}
