package com.finlens.backend.classification;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.finlens.backend.dto.Transaction;
import com.finlens.backend.enums.TransactionCategory;
import com.finlens.backend.services.statements.util.NormalizeUtil;

import lombok.extern.slf4j.Slf4j;

/**
 * Sums keyword weights per category and picks the highest total. Ties go to the category listed first in the
 * priority order; no match at all yields no resolution.
 */
@Slf4j
public class KeywordRuleCategorizationStrategy implements CategorizationStrategy {

    private final Map<TransactionCategory, Map<String, Double>> keywordWeights;
    private final List<TransactionCategory> priority;

    public KeywordRuleCategorizationStrategy(Map<TransactionCategory, Map<String, Double>> keywordWeights,
                                             List<TransactionCategory> priority) {
        this.keywordWeights = keywordWeights;
        List<TransactionCategory> order = new ArrayList<>(priority == null ? List.of() : priority);
        // Categories missing from the configured order rank last, in enum order.
        for (TransactionCategory c : TransactionCategory.values()) {
            if (!order.contains(c)) order.add(c);
        }
        this.priority = List.copyOf(order);
    }

    @Override
    public String name() {
        return "keyword";
    }

    @Override
    public Optional<CategoryResolution> resolve(Transaction tx) {
        String normalized = NormalizeUtil.normalizeForMatching(tx.getDescription());
        if (normalized.isEmpty()) return Optional.empty();

        Map<TransactionCategory, Double> scores = calculateCategoryScores(" " + normalized + " ");

        TransactionCategory best = null;
        double bestScore = 0.0;
        for (TransactionCategory category : priority) {
            double score = scores.getOrDefault(category, 0.0);
            if (score > bestScore) {
                best = category;
                bestScore = score;
            }
        }

        if (best == null) return Optional.empty();
        log.debug("[Classifier] keyword scoring -> category={} score={}", best.getCode(), bestScore);
        return Optional.of(new CategoryResolution(best, Math.min(1.0, bestScore), name()));
    }

    private Map<TransactionCategory, Double> calculateCategoryScores(String paddedDescription) {
        Map<TransactionCategory, Double> scores = new EnumMap<>(TransactionCategory.class);
        for (Map.Entry<TransactionCategory, Map<String, Double>> byCategory : keywordWeights.entrySet()) {
            double total = 0.0;
            for (Map.Entry<String, Double> kw : byCategory.getValue().entrySet()) {
                if (paddedDescription.contains(" " + kw.getKey() + " ")) {
                    total += kw.getValue();
                }
            }
            if (total > 0.0) {
                scores.put(byCategory.getKey(), total);
            }
        }
        return scores;
    }
}
