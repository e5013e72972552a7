package com.finlens.backend.exceptions;

import java.util.List;

public class MissingColumnsException extends StatementProcessingException {

    private final List<String> missingFields;
    private final List<String> headersFound;

    public MissingColumnsException(List<String> missingFields, List<String> headersFound) {
        super("CSV is missing required column(s) " + missingFields + "; headers found=" + headersFound);
        this.missingFields = List.copyOf(missingFields);
        this.headersFound = List.copyOf(headersFound);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }

    public List<String> getHeadersFound() {
        return headersFound;
    }
}
