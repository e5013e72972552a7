package com.finlens.backend.exceptions;

import java.util.List;

public class EncodingException extends StatementProcessingException {

    private final List<String> encodingsAttempted;

    public EncodingException(List<String> encodingsAttempted) {
        super("Could not decode CSV with any supported encoding; attempted=" + encodingsAttempted);
        this.encodingsAttempted = List.copyOf(encodingsAttempted);
    }

    public List<String> getEncodingsAttempted() {
        return encodingsAttempted;
    }
}
