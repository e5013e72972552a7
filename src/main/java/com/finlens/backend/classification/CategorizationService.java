package com.finlens.backend.classification;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.finlens.backend.classification.model.ClassifierModel;
import com.finlens.backend.classification.model.ClassifierModelLoader;
import com.finlens.backend.classification.rules.KeywordHeuristics;
import com.finlens.backend.config.ClassificationProperties;
import com.finlens.backend.dto.Transaction;
import com.finlens.backend.enums.TransactionCategory;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs the categorization chain: provided category, classifier, keyword rules, then "other".
 * The chain always resolves; the final step cannot decline.
 */
@Service
@Slf4j
public class CategorizationService {

    private final List<CategorizationStrategy> strategies;
    private final boolean classifierAvailable;

    @Autowired
    public CategorizationService(ClassificationProperties classificationProperties, ClassifierModelLoader modelLoader) {
        this(classificationProperties, modelLoader.load().orElse(null));
    }

    /**
     * @param model null for rule-only categorization
     */
    public CategorizationService(ClassificationProperties classificationProperties, ClassifierModel model) {
        Map<TransactionCategory, Map<String, Double>> keywords = classificationProperties.getKeywords() == null
                || classificationProperties.getKeywords().isEmpty()
                ? KeywordHeuristics.CATEGORY_KEYWORD_WEIGHTS
                : KeywordHeuristics.fromConfig(classificationProperties.getKeywords());

        List<CategorizationStrategy> chain = new ArrayList<>();
        chain.add(new ProvidedCategoryStrategy());
        if (model != null) {
            chain.add(new ClassifierCategorizationStrategy(model, classificationProperties.getConfidenceThreshold()));
        }
        chain.add(new KeywordRuleCategorizationStrategy(keywords, classificationProperties.getCategoryPriority()));
        chain.add(new DefaultCategoryStrategy());

        this.strategies = List.copyOf(chain);
        this.classifierAvailable = model != null;
        log.info("[Classifier] categorization chain={}", strategies.stream().map(CategorizationStrategy::name).toList());
    }

    public static CategorizationService ruleOnly(ClassificationProperties classificationProperties) {
        return new CategorizationService(classificationProperties, (ClassifierModel) null);
    }

    public CategoryResolution resolve(Transaction tx) {
        for (CategorizationStrategy strategy : strategies) {
            Optional<CategoryResolution> resolution = strategy.resolve(tx);
            if (resolution.isPresent()) {
                return resolution.get();
            }
        }
        return new CategoryResolution(TransactionCategory.OTHER, 0.0, "default");
    }

    public void categorize(Transaction tx) {
        CategoryResolution resolution = resolve(tx);
        tx.setCategory(resolution.category());
        tx.setConfidence(resolution.confidence());
    }

    public boolean isClassifierAvailable() {
        return classifierAvailable;
    }
}
