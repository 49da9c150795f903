package de.remsfal.defects.model;

public enum ExtractionStatus {
    SUCCEEDED,
    FAILED
}
