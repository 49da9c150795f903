package de.remsfal.defects.classifier;

import de.remsfal.defects.engine.DefectCategory;

public class ClassificationResult {

    private final DefectCategory category;
    private final double probability;  // 0..1
    private final String modelVersion;

    public ClassificationResult(DefectCategory category, double probability, String modelVersion) {
        this.category = category;
        this.probability = probability;
        this.modelVersion = modelVersion;
    }

    public DefectCategory getCategory() {
        return category;
    }

    public double getProbability() {
        return probability;
    }

    public String getModelVersion() {
        return modelVersion;
    }
}
