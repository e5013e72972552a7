package com.finlens.backend.services.currency;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Currency;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.finlens.backend.config.CurrencyProperties;
import com.finlens.backend.dto.Transaction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Assigns a currency per transaction and elects the batch's primary currency.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CurrencyDetector {

    private static final Set<String> ISO_CODES = Currency.getAvailableCurrencies().stream()
            .map(Currency::getCurrencyCode)
            .collect(Collectors.toUnmodifiableSet());

    record SymbolPattern(Pattern pattern, String currency) {
        static SymbolPattern of(String regex, String currency) {
            return new SymbolPattern(Pattern.compile(regex), currency);
        }
    }

    /**
     * Precedence-ordered symbol and code patterns. A null currency means the ISO code is taken from the match itself.
     */
    static final List<SymbolPattern> PATTERNS = List.of(
            SymbolPattern.of("(?<![A-Za-z])US\\$", "USD"),
            SymbolPattern.of("(?<![A-Za-z])HK\\$", "HKD"),
            SymbolPattern.of("(?<![A-Za-z])NZ\\$", "NZD"),
            SymbolPattern.of("(?<![A-Za-z])CA?\\$", "CAD"),
            SymbolPattern.of("(?<![A-Za-z])AU?\\$", "AUD"),
            SymbolPattern.of("(?<![A-Za-z])R\\$", "BRL"),
            SymbolPattern.of("(?<![A-Za-z])S\\$", "SGD"),
            SymbolPattern.of("(?<![A-Za-z])RM(?=\\s?\\d)", "MYR"),
            SymbolPattern.of("(?<![A-Za-z])Rp(?=\\s?\\d)", "IDR"),
            SymbolPattern.of("\\b(USD|EUR|GBP|JPY|CNY|INR|CAD|AUD|BRL|MXN|CHF|SGD|HKD|NZD|MYR|IDR|PHP|RUB|KRW|THB|ZAR|SEK|NOK|DKK|PLN|TRY)\\b", null),
            SymbolPattern.of("₹", "INR"),
            SymbolPattern.of("€", "EUR"),
            SymbolPattern.of("£", "GBP"),
            SymbolPattern.of("₱", "PHP"),
            SymbolPattern.of("₽", "RUB"),
            SymbolPattern.of("₩", "KRW"),
            SymbolPattern.of("฿", "THB"),
            SymbolPattern.of("¥", "JPY"),
            SymbolPattern.of("￥", "CNY"));

    /**
     * Weakest signal: tried on amount and description only after every pattern above missed on both.
     */
    static final SymbolPattern BARE_DOLLAR = SymbolPattern.of("\\$", "USD");

    private final CurrencyProperties currencyProperties;

    public String detect(Transaction tx) {
        String explicit = normalizeCode(tx.getSourceCurrency());
        if (explicit != null) {
            return explicit;
        }

        String fromAmount = scanQualified(tx.getRawAmount());
        if (fromAmount != null) return fromAmount;

        String fromDescription = scanQualified(tx.getDescription());
        if (fromDescription != null) return fromDescription;

        if (matches(BARE_DOLLAR, tx.getRawAmount()) || matches(BARE_DOLLAR, tx.getDescription())) {
            return BARE_DOLLAR.currency();
        }
        return defaultCurrency();
    }

    public void assign(Transaction tx) {
        tx.setCurrency(detect(tx));
    }

    /**
     * score = frequencyWeight * (count / n) + valueWeight * (|value| / sum|value|).
     * Ties keep the currency seen first; an empty batch elects the default currency.
     */
    public String electPrimary(List<Transaction> transactions) {
        if (transactions == null || transactions.isEmpty()) {
            return defaultCurrency();
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        BigDecimal totalValue = BigDecimal.ZERO;
        for (Transaction tx : transactions) {
            String currency = tx.getCurrency() != null ? tx.getCurrency() : defaultCurrency();
            BigDecimal abs = tx.getAmount() == null ? BigDecimal.ZERO : tx.getAmount().abs();
            counts.merge(currency, 1, Integer::sum);
            values.merge(currency, abs, BigDecimal::add);
            totalValue = totalValue.add(abs);
        }

        int n = transactions.size();
        String best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            double frequencyShare = (double) e.getValue() / n;
            double valueShare = totalValue.signum() == 0
                    ? 0.0
                    : values.get(e.getKey()).divide(totalValue, MathContext.DECIMAL64).doubleValue();
            double score = currencyProperties.getFrequencyWeight() * frequencyShare
                    + currencyProperties.getValueWeight() * valueShare;
            if (score > bestScore) {
                best = e.getKey();
                bestScore = score;
            }
        }

        if (counts.size() > 1) {
            log.info("[CurrencyDetector] mixed currencies {} -> primary={}", counts, best);
        }
        return best;
    }

    static String scan(String text) {
        String qualified = scanQualified(text);
        if (qualified != null) return qualified;
        return matches(BARE_DOLLAR, text) ? BARE_DOLLAR.currency() : null;
    }

    private static String scanQualified(String text) {
        if (text == null || text.isBlank()) return null;
        for (SymbolPattern sp : PATTERNS) {
            Matcher m = sp.pattern().matcher(text);
            if (m.find()) {
                return sp.currency() != null ? sp.currency() : m.group(1);
            }
        }
        return null;
    }

    private static boolean matches(SymbolPattern sp, String text) {
        return text != null && sp.pattern().matcher(text).find();
    }

    static String normalizeCode(String raw) {
        if (raw == null) return null;
        String code = raw.trim().toUpperCase(Locale.ROOT);
        if (code.length() != 3 || !ISO_CODES.contains(code)) return null;
        return code;
    }

    private String defaultCurrency() {
        String code = normalizeCode(currencyProperties.getDefaultCurrency());
        return code != null ? code : "USD";
    }
}
