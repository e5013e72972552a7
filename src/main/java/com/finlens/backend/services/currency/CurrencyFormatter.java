package com.finlens.backend.services.currency;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.Map;

/**
 * Renders amounts for messages with each currency's symbol, position, decimals and separators,
 * e.g. "$1,234.56", "1.234,56 €", "¥1,235".
 */
public final class CurrencyFormatter {

    record Style(String symbol, boolean symbolBefore, int decimals, char groupSeparator, char decimalSeparator) {
    }

    private static final Map<String, Style> STYLES = Map.ofEntries(
            Map.entry("USD", new Style("$", true, 2, ',', '.')),
            Map.entry("EUR", new Style(" €", false, 2, '.', ',')),
            Map.entry("GBP", new Style("£", true, 2, ',', '.')),
            Map.entry("JPY", new Style("¥", true, 0, ',', '.')),
            Map.entry("CNY", new Style("¥", true, 2, ',', '.')),
            Map.entry("INR", new Style("₹", true, 2, ',', '.')),
            Map.entry("CAD", new Style("C$", true, 2, ',', '.')),
            Map.entry("AUD", new Style("A$", true, 2, ',', '.')),
            Map.entry("NZD", new Style("NZ$", true, 2, ',', '.')),
            Map.entry("HKD", new Style("HK$", true, 2, ',', '.')),
            Map.entry("SGD", new Style("S$", true, 2, ',', '.')),
            Map.entry("BRL", new Style("R$", true, 2, '.', ',')),
            Map.entry("MXN", new Style("$", true, 2, ',', '.')),
            Map.entry("ZAR", new Style("R", true, 2, ',', '.')),
            Map.entry("CHF", new Style(" CHF", false, 2, '\'', '.')),
            Map.entry("KRW", new Style("₩", true, 0, ',', '.')),
            Map.entry("PHP", new Style("₱", true, 2, ',', '.')),
            Map.entry("RUB", new Style(" ₽", false, 2, ' ', ',')),
            Map.entry("THB", new Style("฿", true, 2, ',', '.')),
            Map.entry("MYR", new Style("RM", true, 2, ',', '.')),
            Map.entry("IDR", new Style("Rp", true, 0, '.', ',')),
            Map.entry("SEK", new Style(" kr", false, 2, ' ', ',')),
            Map.entry("NOK", new Style(" kr", false, 2, ' ', ',')),
            Map.entry("DKK", new Style(" kr", false, 2, '.', ',')),
            Map.entry("PLN", new Style(" zł", false, 2, ' ', ',')));

    private CurrencyFormatter() {}

    public static String format(BigDecimal amount, String currency) {
        String code = currency == null ? "" : currency.trim().toUpperCase(Locale.ROOT);
        Style style = STYLES.getOrDefault(code, new Style(" " + code, false, 2, ',', '.'));

        BigDecimal value = amount == null ? BigDecimal.ZERO : amount;
        BigDecimal rounded = value.abs().setScale(style.decimals(), RoundingMode.HALF_UP);

        DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(Locale.ROOT);
        symbols.setGroupingSeparator(style.groupSeparator());
        symbols.setDecimalSeparator(style.decimalSeparator());
        String pattern = style.decimals() > 0 ? "#,##0." + "0".repeat(style.decimals()) : "#,##0";
        String number = new DecimalFormat(pattern, symbols).format(rounded);
        String sign = value.signum() < 0 && rounded.signum() != 0 ? "-" : "";

        return style.symbolBefore()
                ? sign + style.symbol() + number
                : sign + number + style.symbol();
    }
}
