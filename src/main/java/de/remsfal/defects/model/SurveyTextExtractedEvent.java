package de.remsfal.defects.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SurveyTextExtractedEvent {

    private UUID documentId;
    private UUID projectId;
    private String filename;
    private String text;
    private ExtractionStatus extractionStatus;
    private String extractionError;

    public UUID getDocumentId() { return documentId; }
    public void setDocumentId(UUID documentId) { this.documentId = documentId; }

    public UUID getProjectId() { return projectId; }
    public void setProjectId(UUID projectId) { this.projectId = projectId; }

    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public ExtractionStatus getExtractionStatus() { return extractionStatus; }
    public void setExtractionStatus(ExtractionStatus extractionStatus) { this.extractionStatus = extractionStatus; }

    public String getExtractionError() { return extractionError; }
    public void setExtractionError(String extractionError) { this.extractionError = extractionError; }
}
