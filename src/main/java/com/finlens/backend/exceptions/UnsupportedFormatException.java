package com.finlens.backend.exceptions;

public class UnsupportedFormatException extends StatementProcessingException {

    private final String filename;

    public UnsupportedFormatException(String filename, String reason) {
        super("Unsupported statement format for '" + filename + "': " + reason);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
