package de.remsfal.defects.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"type", "keyword", "sentence", "severity", "confidence", "area", "detection_method"})
public record DefectMatch(
        @JsonProperty("type") DefectCategory category,
        String keyword,
        String sentence,
        Severity severity,
        double confidence,
        String area,
        @JsonProperty("detection_method") String detectionMethod,
        @JsonIgnore int sentenceIndex
) {

    public DefectMatch withScore(double confidence, String detectionMethod) {
        return new DefectMatch(category, keyword, sentence, severity, confidence, area, detectionMethod, sentenceIndex);
    }
}
