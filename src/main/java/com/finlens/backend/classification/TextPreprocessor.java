package com.finlens.backend.classification;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.finlens.backend.services.statements.util.NormalizeUtil;

/**
 * Tokenizes a description for the classifier: case-folded, accent and punctuation free, English stopwords and
 * single characters removed.
 */
public final class TextPreprocessor {

    static final Set<String> STOPWORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "in", "into", "is", "it", "its",
            "of", "on", "or", "that", "the", "this", "to", "was", "were", "will", "with", "via", "per", "our",
            "your", "my", "we", "you", "i", "me", "he", "she", "they", "them", "his", "her", "their", "ref", "pos",
            "purchase", "payment", "card", "debit", "credit", "txn", "trx", "inc", "llc", "ltd", "co");

    private TextPreprocessor() {}

    public static List<String> tokenize(String description) {
        String normalized = NormalizeUtil.normalizeForMatching(description);
        if (normalized.isEmpty()) return List.of();

        List<String> tokens = new ArrayList<>();
        for (String token : normalized.split(" ")) {
            if (token.length() < 2) continue;
            if (STOPWORDS.contains(token)) continue;
            if (token.chars().allMatch(Character::isDigit)) continue;
            tokens.add(token);
        }
        return tokens;
    }

    public static String preprocess(String description) {
        return String.join(" ", tokenize(description));
    }
}
