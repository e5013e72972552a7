package com.finlens.backend.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.finlens.backend.enums.StatementFormat;

import lombok.Getter;
import lombok.Setter;

/**
 * Counters collected while a single statement is parsed. Not thread-safe; owned by one parser call.
 */
@Getter
@Setter
public class ParseDiagnostics {

    public enum SkipReason {
        INVALID_DATE,
        INVALID_AMOUNT,
        ZERO_AMOUNT,
        EMPTY_DESCRIPTION,
        BALANCE_LINE,
        UNMATCHED_LINE
    }

    private final StatementFormat format;
    private String encoding;
    private final List<String> encodingsAttempted = new ArrayList<>();
    private Character delimiter;
    private int pagesRead;
    private int rowsRead;
    private int rowsAccepted;
    private final Map<SkipReason, Integer> skipped = new EnumMap<>(SkipReason.class);

    public ParseDiagnostics(StatementFormat format) {
        this.format = format;
    }

    public void recordAttempt(String encodingName) {
        encodingsAttempted.add(encodingName);
    }

    public void recordRead() {
        rowsRead++;
    }

    public void recordAccepted() {
        rowsAccepted++;
    }

    public void recordSkip(SkipReason reason) {
        skipped.merge(reason, 1, Integer::sum);
    }

    public int skippedCount(SkipReason reason) {
        return skipped.getOrDefault(reason, 0);
    }

    public int skippedTotal() {
        return skipped.values().stream().mapToInt(Integer::intValue).sum();
    }

    public List<String> getEncodingsAttempted() {
        return Collections.unmodifiableList(encodingsAttempted);
    }

    public Map<SkipReason, Integer> getSkipped() {
        return Collections.unmodifiableMap(skipped);
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("format=").append(format);
        if (encoding != null) sb.append(" encoding=").append(encoding);
        if (!encodingsAttempted.isEmpty()) sb.append(" encodingsAttempted=").append(encodingsAttempted);
        if (format == StatementFormat.PDF) sb.append(" pagesRead=").append(pagesRead);
        sb.append(" rowsRead=").append(rowsRead)
                .append(" rowsAccepted=").append(rowsAccepted)
                .append(" skipped=").append(skipped);
        return sb.toString();
    }
}
