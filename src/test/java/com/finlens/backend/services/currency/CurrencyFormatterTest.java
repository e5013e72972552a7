package com.finlens.backend.services.currency;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

class CurrencyFormatterTest {

    @Test
    void formatsWithCurrencyConventions() {
        assertEquals("$1,234.56", CurrencyFormatter.format(new BigDecimal("1234.56"), "USD"));
        assertEquals("1.234,56 €", CurrencyFormatter.format(new BigDecimal("1234.56"), "EUR"));
        assertEquals("¥1,235", CurrencyFormatter.format(new BigDecimal("1234.56"), "JPY"));
        assertEquals("R$1.000,00", CurrencyFormatter.format(new BigDecimal("1000"), "BRL"));
    }

    @Test
    void prefixesSignBeforeSymbol() {
        assertEquals("-$4.50", CurrencyFormatter.format(new BigDecimal("-4.5"), "usd"));
    }

    @Test
    void unknownCodeIsAppended() {
        assertEquals("10.00 XYZ", CurrencyFormatter.format(new BigDecimal("10"), "XYZ"));
    }
}
