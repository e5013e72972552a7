package com.finlens.backend.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * PDF extraction settings.
 *
 * Rules are tried in declaration order; when none are configured the built-in layouts are used.
 * <pre>
 * finlens.pdf.rules[0].name=iso-line
 * finlens.pdf.rules[0].pattern=^(\d{4}-\d{2}-\d{2})\s+(.+?)\s+(-?[\d.,]+)$
 * finlens.pdf.rules[0].date-group=1
 * finlens.pdf.rules[0].description-group=2
 * finlens.pdf.rules[0].amount-group=3
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "finlens.pdf")
public class PdfProperties {

    private int maxPages = 50;

    private List<Rule> rules = new ArrayList<>();

    @Data
    public static class Rule {
        private String name;
        private String pattern;
        private int dateGroup = 1;
        private int descriptionGroup = 2;
        private int amountGroup = 3;
        /**
         * Optional group holding a CR/DR (or C/D) marker. Zero means the rule has none.
         */
        private int markerGroup = 0;
    }
}
