package de.remsfal.defects.engine;

import de.remsfal.defects.classifier.ClassificationResult;
import de.remsfal.defects.classifier.DefectClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

public class ConfidenceScorer {

    public static final String RULE_BASED = "rule_based";
    public static final String HYBRID = "hybrid_ml_rule";

    private static final Logger log = LoggerFactory.getLogger(ConfidenceScorer.class);

    private final DefectClassifier classifier;
    private final double blendWeight;

    public ConfidenceScorer(DefectClassifier classifier, double blendWeight) {
        if (blendWeight < 0.0 || blendWeight > 1.0) {
            throw new IllegalArgumentException("blend weight must be within [0,1], got " + blendWeight);
        }
        this.classifier = classifier;
        this.blendWeight = blendWeight;
    }

    public double baseScore(KeywordRule rule) {
        Severity severity = rule.severity();
        double specificity = Math.min(0.8, 0.2 * rule.wordCount());
        return round(severity.getFloor() + (severity.getCeiling() - severity.getFloor()) * specificity);
    }

    public boolean isBlending() {
        return classifier != null && classifier.isAvailable() && blendWeight > 0.0;
    }

    /**
     * Starts scoring for one analysis. The returned session is not thread-safe; after the
     * first classifier failure it keeps rule-based confidence for everything it still scores.
     */
    public Session newSession() {
        return new Session();
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    public final class Session {

        private boolean classifierDown;
        private String modelVersion;

        private Session() {
        }

        public DefectMatch refine(DefectMatch match) {
            if (classifierDown || !isBlending()) {
                return match;
            }

            Optional<ClassificationResult> result;
            try {
                result = classifier.score(match.sentence(), match.category());
            } catch (RuntimeException ex) {
                classifierDown = true;
                log.warn("Classifier failed, using rule-based confidence for the rest of this analysis: {}",
                        ex.getMessage());
                return match;
            }

            if (result.isEmpty()) {
                return match;
            }
            double p = result.get().getProbability();
            if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
                log.warn("Classifier returned out-of-range probability {} for category={}, ignoring it",
                        p, match.category());
                return match;
            }
            if (result.get().getModelVersion() != null) {
                modelVersion = result.get().getModelVersion();
            }

            double blended = match.severity().clamp((1.0 - blendWeight) * match.confidence() + blendWeight * p);
            return match.withScore(round(blended), HYBRID);
        }

        public boolean isClassifierDown() {
            return classifierDown;
        }

        public String modelVersion() {
            return modelVersion;
        }
    }
}
