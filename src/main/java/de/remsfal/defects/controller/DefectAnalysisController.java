package de.remsfal.defects.controller;

import de.remsfal.defects.engine.AnalysisResult;
import de.remsfal.defects.engine.DefectDetectionEngine;
import de.remsfal.defects.export.DefectCsvExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/defects")
public class DefectAnalysisController {

    private static final Logger log = LoggerFactory.getLogger(DefectAnalysisController.class);

    private final DefectDetectionEngine engine;
    private final DefectCsvExporter csvExporter;

    public DefectAnalysisController(DefectDetectionEngine engine, DefectCsvExporter csvExporter) {
        this.engine = engine;
        this.csvExporter = csvExporter;
    }

    /**
     * Analyses the posted text and returns the defect report as JSON.
     *
     * <p>Endpoint: POST /api/defects/analyze
     */
    @PostMapping(value = "/analyze", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> analyze(@RequestBody AnalyzeRequest request) {
        String invalid = validate(request);
        if (invalid != null) {
            return badRequest(invalid);
        }

        log.info("Received analysis request for '{}' ({} characters)", request.filename(), request.text().length());
        try {
            return ResponseEntity.ok(engine.analyze(request.filename(), request.text()));
        } catch (Exception e) {
            log.error("Error during analysis of '{}'", request.filename(), e);
            return internalError(e);
        }
    }

    /**
     * Analyses the posted text and returns one CSV row per defect.
     *
     * <p>Endpoint: POST /api/defects/analyze/csv
     */
    @PostMapping(value = "/analyze/csv", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> analyzeCsv(@RequestBody AnalyzeRequest request) {
        String invalid = validate(request);
        if (invalid != null) {
            return badRequest(invalid);
        }

        try {
            AnalysisResult result = engine.analyze(request.filename(), request.text());
            return ResponseEntity.ok()
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            "attachment; filename=\"defect_analysis_" + safeName(request.filename()) + ".csv\"")
                    .contentType(new MediaType("text", "csv"))
                    .body(csvExporter.export(result));
        } catch (Exception e) {
            log.error("Error during CSV export of '{}'", request.filename(), e);
            return internalError(e);
        }
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "remsfal-defect-detection",
                "processingMethod", engine.processingMethod(),
                "mlAvailable", engine.isClassifierAvailable(),
                "keywordRules", engine.getTaxonomy().size()
        ));
    }

    private String validate(AnalyzeRequest request) {
        if (request == null || request.filename() == null || request.filename().isBlank()) {
            return "filename is missing";
        }
        if (request.text() == null) {
            return "text is missing, report extraction failures instead of sending no text";
        }
        return null;
    }

    private static String safeName(String filename) {
        return filename.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }

    private ResponseEntity<Map<String, String>> internalError(Exception e) {
        return ResponseEntity.internalServerError()
                .body(Map.of(
                        "error", "Error during analysis",
                        "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
                ));
    }
}
