package com.mimecast.outpost.expr;

/**
 * Thrown while evaluating an expression that cannot produce a value.
 */
class EvaluationException extends RuntimeException {

    EvaluationException(String message) {
        super(message);
    }
}
