package com.finlens.backend.exceptions;

/**
 * Terminal, file-level failure: the whole statement is rejected.
 */
public class StatementProcessingException extends IllegalArgumentException {

    public StatementProcessingException(String message) {
        super(message);
    }

    public StatementProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
