package com.finlens.backend.exceptions;

/**
 * Non-fatal: no usable exchange rate. Callers keep the amount in its original currency.
 */
public class RateUnavailableException extends RuntimeException {

    private final String base;
    private final String quote;

    public RateUnavailableException(String base, String quote, String reason) {
        super("Exchange rate " + base + "->" + quote + " unavailable: " + reason);
        this.base = base;
        this.quote = quote;
    }

    public RateUnavailableException(String base, String quote, String reason, Throwable cause) {
        super("Exchange rate " + base + "->" + quote + " unavailable: " + reason, cause);
        this.base = base;
        this.quote = quote;
    }

    public String getBase() {
        return base;
    }

    public String getQuote() {
        return quote;
    }
}
