package com.finlens.backend.classification.model;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import com.finlens.backend.config.ClassificationProperties;
import com.finlens.backend.enums.TransactionCategory;
import com.finlens.backend.exceptions.ModelUnavailableException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Loads the naive-Bayes classifier artifact (JSON) named by {@code finlens.classification.model-path}.
 * Accepts {@code classpath:} and {@code file:} locations; a bare path is read from the file system.
 */
@Component
@Slf4j
public class ClassifierModelLoader {

    private final ObjectMapper objectMapper;
    private final ClassificationProperties classificationProperties;
    private final ResourceLoader resourceLoader = new DefaultResourceLoader();

    public ClassifierModelLoader(ObjectMapper objectMapper, ClassificationProperties classificationProperties) {
        this.objectMapper = objectMapper;
        this.classificationProperties = classificationProperties;
    }

    /**
     * @return the configured model, or empty (rule-only categorization) when none is configured or it cannot be loaded
     */
    public Optional<ClassifierModel> load() {
        String path = classificationProperties.getModelPath();
        if (path == null || path.isBlank()) {
            log.info("[Classifier] no model-path configured; categorization runs rule-only");
            return Optional.empty();
        }
        try {
            ClassifierModel model = loadModel(path.trim());
            log.info("[Classifier] loaded model from {}", path);
            return Optional.of(model);
        } catch (ModelUnavailableException e) {
            log.warn("[Classifier] {}; categorization runs rule-only", e.getMessage());
            return Optional.empty();
        }
    }

    public ClassifierModel loadModel(String path) {
        Resource resource = resolve(path);
        if (!resource.exists()) {
            throw new ModelUnavailableException("classifier artifact not found at " + path);
        }

        NaiveBayesArtifact artifact;
        try (InputStream in = resource.getInputStream()) {
            artifact = objectMapper.readValue(in, NaiveBayesArtifact.class);
        } catch (IOException e) {
            throw new ModelUnavailableException("classifier artifact at " + path + " is unreadable: " + e.getMessage(), e);
        }

        try {
            return toModel(artifact);
        } catch (IllegalArgumentException e) {
            throw new ModelUnavailableException("classifier artifact at " + path + " is invalid: " + e.getMessage(), e);
        }
    }

    private Resource resolve(String path) {
        if (path.startsWith("classpath:") || path.startsWith("file:")) {
            return resourceLoader.getResource(path);
        }
        return new FileSystemResource(path);
    }

    private static NaiveBayesClassifierModel toModel(NaiveBayesArtifact artifact) {
        if (artifact.classes() == null) {
            throw new IllegalArgumentException("classes are required");
        }
        List<TransactionCategory> classes = new ArrayList<>();
        for (String code : artifact.classes()) {
            classes.add(TransactionCategory.fromCode(code)
                    .orElseThrow(() -> new IllegalArgumentException("unknown class '" + code + "'")));
        }

        Map<String, double[]> likelihoods = new LinkedHashMap<>();
        if (artifact.tokenLogLikelihoods() != null) {
            likelihoods.putAll(artifact.tokenLogLikelihoods());
        }
        return new NaiveBayesClassifierModel(classes, artifact.logPriors(), likelihoods, artifact.unknownTokenLogLikelihoods());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record NaiveBayesArtifact(
            List<String> classes,
            double[] logPriors,
            Map<String, double[]> tokenLogLikelihoods,
            double[] unknownTokenLogLikelihoods
    ) {
    }
}
