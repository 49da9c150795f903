package de.remsfal.defects.classifier;

import de.remsfal.defects.engine.DefectCategory;

import java.util.Optional;

public interface DefectClassifier {

    /**
     * Probability that the sentence describes a defect of the given category, or empty when
     * the classifier has no opinion.
     */
    Optional<ClassificationResult> score(String sentence, DefectCategory category);

    boolean isAvailable();

    String getMode();
}
