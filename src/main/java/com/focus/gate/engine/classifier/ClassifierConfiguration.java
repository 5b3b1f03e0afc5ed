package com.focus.gate.engine.classifier;

import com.focus.gate.engine.feature.FeatureVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;

@Configuration
@Slf4j
public class ClassifierConfiguration {

    @Value("${focus.classifier.weights:classpath:model/productivity-classifier.fgcw}")
    private Resource weights;

    @Value("${focus.classifier.seed:42}")
    private long seed;

    @Value("${focus.engine.decision-threshold:0.5}")
    private double threshold;

    @Bean
    public ProductivityClassifier productivityClassifier() {
        try {
            ProductivityClassifier classifier = load(weights, threshold);
            log.info("Loaded productivity classifier {} from {}", classifier.version(), weights.getDescription());
            return classifier;
        } catch (ModelLoadException e) {
            log.warn("Could not load classifier weights from {} ({}), serving with an untrained network",
                    weights.getDescription(), e.getMessage());
            return ProductivityClassifier.untrained(FeatureVector.DIMENSION, threshold, seed);
        }
    }

    static ProductivityClassifier load(Resource resource, double threshold) {
        if (!resource.exists()) {
            throw new ModelLoadException("Weight file not found");
        }
        try (InputStream in = resource.getInputStream()) {
            ProductivityClassifier classifier = new WeightFileReader(FeatureVector.LAYOUT_VERSION).read(in, threshold);
            if (classifier.inputSize() != FeatureVector.DIMENSION) {
                throw new ModelLoadException("Network expects " + classifier.inputSize()
                        + " features, extractor produces " + FeatureVector.DIMENSION);
            }
            return classifier;
        } catch (IOException e) {
            throw new ModelLoadException("Failed to open weight file: " + e.getMessage(), e);
        }
    }
}
