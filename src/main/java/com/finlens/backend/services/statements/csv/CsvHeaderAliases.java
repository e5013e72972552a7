package com.finlens.backend.services.statements.csv;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.finlens.backend.services.statements.util.NormalizeUtil;

/**
 * Maps header variants onto canonical columns.
 */
final class CsvHeaderAliases {

    enum Column {
        DATE,
        DESCRIPTION,
        AMOUNT,
        DEBIT,
        CREDIT,
        CATEGORY,
        CURRENCY,
        TYPE
    }

    private static final Map<String, Column> ALIASES;

    static {
        Map<String, Column> map = new LinkedHashMap<>();
        map.put("date", Column.DATE);
        map.put("transaction_date", Column.DATE);
        map.put("posted_date", Column.DATE);
        map.put("posting_date", Column.DATE);

        map.put("description", Column.DESCRIPTION);
        map.put("merchant", Column.DESCRIPTION);
        map.put("payee", Column.DESCRIPTION);
        map.put("memo", Column.DESCRIPTION);

        map.put("amount", Column.AMOUNT);
        map.put("transaction_amount", Column.AMOUNT);
        map.put("debit", Column.DEBIT);
        map.put("credit", Column.CREDIT);

        map.put("category", Column.CATEGORY);
        map.put("transaction_category", Column.CATEGORY);

        map.put("currency", Column.CURRENCY);
        map.put("currency_code", Column.CURRENCY);

        map.put("type", Column.TYPE);
        map.put("transaction_type", Column.TYPE);
        ALIASES = Collections.unmodifiableMap(map);
    }

    private CsvHeaderAliases() {}

    /**
     * Column index per canonical column. The first header that maps to a column wins.
     */
    static Map<Column, Integer> resolve(List<String> headers) {
        Map<Column, Integer> indexes = new EnumMap<>(Column.class);
        for (int i = 0; i < headers.size(); i++) {
            Column column = ALIASES.get(NormalizeUtil.normalizeHeader(headers.get(i)));
            if (column != null) {
                indexes.putIfAbsent(column, i);
            }
        }
        return indexes;
    }
}
