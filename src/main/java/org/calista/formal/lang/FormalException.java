package org.calista.formal.lang;

/**
 * Root of the formal language failures (lexical, syntactic, evaluation).
 */
public class FormalException extends RuntimeException {

    public FormalException(String message) {
        super(message);
    }

    public FormalException(String message, Throwable cause) {
        super(message, cause);
    }
}
