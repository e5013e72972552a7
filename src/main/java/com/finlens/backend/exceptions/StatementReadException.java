package com.finlens.backend.exceptions;

public class StatementReadException extends StatementProcessingException {

    public StatementReadException(String message) {
        super(message);
    }

    public StatementReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
