package com.finlens.backend.exceptions;

/**
 * Non-fatal: the classifier artifact could not be loaded, categorization runs rule-only.
 */
public class ModelUnavailableException extends RuntimeException {

    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
