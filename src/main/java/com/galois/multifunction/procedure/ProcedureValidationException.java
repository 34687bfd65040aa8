package com.galois.multifunction.procedure;

/**
 * Thrown by {@link Procedure#assertValid()} when a procedure is not
 * well-formed.
 */
public class ProcedureValidationException extends RuntimeException {
    ProcedureValidationException(String message) {
        super(message);
    }
}
