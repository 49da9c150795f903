package de.remsfal.defects.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Complete defect report for one document.
 *
 * @param summary     category display name to defect count, in category order
 * @param percentages category display name to share of all defects, one decimal
 * @param modelVersion classifier model behind the blended confidences, null when none was blended
 */
@JsonPropertyOrder({"filename", "defects", "summary", "percentages", "total_defects",
        "processing_method", "model_version", "timestamp"})
public record AnalysisResult(
        String filename,
        List<DefectMatch> defects,
        Map<String, Integer> summary,
        Map<String, Double> percentages,
        @JsonProperty("total_defects") int totalDefects,
        @JsonProperty("processing_method") String processingMethod,
        @JsonProperty("model_version") @JsonInclude(JsonInclude.Include.NON_NULL) String modelVersion,
        Instant timestamp
) {}
