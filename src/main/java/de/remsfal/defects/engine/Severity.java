package de.remsfal.defects.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {

    HIGH("High", 3, 0.85, 1.00),
    MEDIUM("Medium", 2, 0.55, 0.84),
    LOW("Low", 1, 0.25, 0.54);

    private final String label;
    private final int rank;
    private final double floor;
    private final double ceiling;

    Severity(String label, int rank, double floor, double ceiling) {
        this.label = label;
        this.rank = rank;
        this.floor = floor;
        this.ceiling = ceiling;
    }

    @JsonValue
    public String getLabel() { return label; }

    public int getRank() { return rank; }

    public double getFloor() { return floor; }

    public double getCeiling() { return ceiling; }

    public double clamp(double confidence) {
        return Math.max(floor, Math.min(ceiling, confidence));
    }
}
