package de.remsfal.defects.model;

import de.remsfal.defects.engine.AnalysisResult;

import java.time.Instant;
import java.util.UUID;

public class DefectReportEvent {

    private UUID documentId;
    private UUID projectId;
    private String analysisModel;
    private Instant analyzedAt;
    private AnalysisResult report;

    public UUID getDocumentId() { return documentId; }
    public void setDocumentId(UUID documentId) { this.documentId = documentId; }

    public UUID getProjectId() { return projectId; }
    public void setProjectId(UUID projectId) { this.projectId = projectId; }

    public String getAnalysisModel() { return analysisModel; }
    public void setAnalysisModel(String analysisModel) { this.analysisModel = analysisModel; }

    public Instant getAnalyzedAt() { return analyzedAt; }
    public void setAnalyzedAt(Instant analyzedAt) { this.analyzedAt = analyzedAt; }

    public AnalysisResult getReport() { return report; }
    public void setReport(AnalysisResult report) { this.report = report; }
}
