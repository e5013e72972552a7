package com.finlens.backend.classification.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.finlens.backend.enums.TransactionCategory;
import com.finlens.backend.services.statements.util.NormalizeUtil;

public final class KeywordHeuristics {

    private KeywordHeuristics() {}

    /**
     * Keyword weight (0.0 to 1.0) per category. Keywords are normalized (lowercase, accent and punctuation free)
     * and matched on word boundaries.
     */
    public record CategoryKeywordWeight(TransactionCategory category, String keyword, double weight) {
        public CategoryKeywordWeight {
            if (category == null) throw new IllegalArgumentException("category is required");
            if (keyword == null || keyword.isBlank()) throw new IllegalArgumentException("keyword is required");
            if (weight < 0.0 || weight > 1.0) throw new IllegalArgumentException("weight must be between 0.0 and 1.0");
            keyword = NormalizeUtil.normalizeForMatching(keyword);
        }
    }

    /**
     * category -> (keyword -> weight), in declaration order.
     */
    public static final Map<TransactionCategory, Map<String, Double>> CATEGORY_KEYWORD_WEIGHTS;

    public static final List<CategoryKeywordWeight> KEYWORDS;

    static {
        List<CategoryKeywordWeight> items = new ArrayList<>();

        // Food
        add(items, TransactionCategory.FOOD, 0.90, "starbucks", "mcdonalds", "chipotle", "dominos", "panera",
                "taco bell", "burger king", "kfc", "wendys", "dunkin", "tim hortons", "five guys", "doordash", "grubhub");
        add(items, TransactionCategory.FOOD, 0.70, "restaurant", "cafe", "grocery", "supermarket", "bistro", "diner",
                "eatery", "pizza", "sushi", "burger", "bakery");
        add(items, TransactionCategory.FOOD, 0.50, "food", "meal", "dining", "takeout", "coffee", "lunch", "dinner",
                "breakfast", "market");

        // Transport
        add(items, TransactionCategory.TRANSPORT, 0.90, "uber", "lyft", "exxon", "chevron", "shell", "valero",
                "mobil", "citgo", "sunoco", "speedway", "wawa");
        add(items, TransactionCategory.TRANSPORT, 0.70, "taxi", "fuel", "parking", "metro", "transit", "toll");
        add(items, TransactionCategory.TRANSPORT, 0.50, "gas station", "bus", "train", "commute", "transport");

        // Utilities
        add(items, TransactionCategory.UTILITIES, 0.90, "verizon", "comcast", "xfinity", "at t", "duke energy",
                "pg e", "spectrum", "directv");
        add(items, TransactionCategory.UTILITIES, 0.70, "electric", "electricity", "water bill", "internet",
                "utility", "utilities", "cable");
        add(items, TransactionCategory.UTILITIES, 0.50, "phone", "water", "bill");

        // Healthcare
        add(items, TransactionCategory.HEALTHCARE, 0.90, "cvs", "walgreens", "rite aid", "urgent care");
        add(items, TransactionCategory.HEALTHCARE, 0.70, "doctor", "hospital", "pharmacy", "clinic", "dental",
                "dentist", "optometrist", "medical");
        add(items, TransactionCategory.HEALTHCARE, 0.50, "health", "vision");

        // Insurance
        add(items, TransactionCategory.INSURANCE, 0.90, "geico", "state farm", "allstate", "progressive",
                "liberty mutual", "usaa");
        add(items, TransactionCategory.INSURANCE, 0.70, "insurance", "premium");

        // Education
        add(items, TransactionCategory.EDUCATION, 0.90, "coursera", "udemy", "edx", "skillshare", "khan academy");
        add(items, TransactionCategory.EDUCATION, 0.70, "tuition", "university", "college", "school", "textbook");
        add(items, TransactionCategory.EDUCATION, 0.50, "course", "education", "library", "book");

        // Investment
        add(items, TransactionCategory.INVESTMENT, 0.90, "fidelity", "vanguard", "schwab", "robinhood", "etrade",
                "td ameritrade", "merrill lynch", "401k");
        add(items, TransactionCategory.INVESTMENT, 0.70, "investment", "brokerage", "portfolio", "ira");
        add(items, TransactionCategory.INVESTMENT, 0.50, "stock", "bond", "fund", "trading");

        // Shopping
        add(items, TransactionCategory.SHOPPING, 0.90, "amazon", "walmart", "target", "costco", "best buy",
                "home depot", "lowes", "macys", "nordstrom", "kohls", "tj maxx", "marshalls", "old navy");
        add(items, TransactionCategory.SHOPPING, 0.60, "mall", "retail", "clothing", "electronics", "shopping");
        add(items, TransactionCategory.SHOPPING, 0.40, "store", "shop");

        // Travel
        add(items, TransactionCategory.TRAVEL, 0.90, "airbnb", "expedia", "marriott", "hilton", "booking com",
                "priceline", "kayak", "delta", "united airlines", "american airlines");
        add(items, TransactionCategory.TRAVEL, 0.70, "hotel", "airline", "flight", "motel", "resort");
        add(items, TransactionCategory.TRAVEL, 0.50, "vacation", "trip", "travel", "reservation");

        // Entertainment
        add(items, TransactionCategory.ENTERTAINMENT, 0.90, "netflix", "spotify", "hulu", "disney", "youtube",
                "ticketmaster", "fandango", "amc", "regal", "imax", "steam");
        add(items, TransactionCategory.ENTERTAINMENT, 0.70, "movie", "cinema", "theater", "concert");
        add(items, TransactionCategory.ENTERTAINMENT, 0.50, "game", "show", "entertainment");

        KEYWORDS = Collections.unmodifiableList(items);
        CATEGORY_KEYWORD_WEIGHTS = Collections.unmodifiableMap(buildCategoryMap(items));
    }

    /**
     * Builds a table from configuration (category code -> keyword -> weight).
     *
     * @throws IllegalArgumentException on an unknown category or an out-of-range weight
     */
    public static Map<TransactionCategory, Map<String, Double>> fromConfig(Map<String, Map<String, Double>> config) {
        List<CategoryKeywordWeight> items = new ArrayList<>();
        for (Map.Entry<String, Map<String, Double>> byCategory : config.entrySet()) {
            TransactionCategory category = TransactionCategory.fromCode(byCategory.getKey())
                    .orElseThrow(() -> new IllegalArgumentException("unknown category in keyword table: " + byCategory.getKey()));
            for (Map.Entry<String, Double> kw : byCategory.getValue().entrySet()) {
                double weight = kw.getValue() == null ? 0.0 : kw.getValue();
                items.add(new CategoryKeywordWeight(category, kw.getKey(), weight));
            }
        }
        return Collections.unmodifiableMap(buildCategoryMap(items));
    }

    private static void add(List<CategoryKeywordWeight> items, TransactionCategory category, double weight, String... keywords) {
        for (String keyword : keywords) {
            items.add(new CategoryKeywordWeight(category, keyword, weight));
        }
    }

    private static Map<TransactionCategory, Map<String, Double>> buildCategoryMap(List<CategoryKeywordWeight> items) {
        Map<TransactionCategory, Map<String, Double>> byCategory = new EnumMap<>(TransactionCategory.class);
        for (CategoryKeywordWeight item : items) {
            byCategory.computeIfAbsent(item.category(), k -> new LinkedHashMap<>()).put(item.keyword(), item.weight());
        }
        Map<TransactionCategory, Map<String, Double>> immutable = new EnumMap<>(TransactionCategory.class);
        for (Map.Entry<TransactionCategory, Map<String, Double>> e : byCategory.entrySet()) {
            immutable.put(e.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
        }
        return immutable;
    }
}
