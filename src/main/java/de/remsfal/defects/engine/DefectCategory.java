package de.remsfal.defects.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DefectCategory {

    STRUCTURAL("Structural"),
    MOISTURE("Moisture & Damp"),
    ELECTRICAL("Electrical"),
    PLUMBING("Plumbing"),
    MOLD("Mold & Fungus"),
    CORROSION("Corrosion & Rust"),
    GENERAL_STRUCTURAL("General Structural");

    private final String displayName;

    DefectCategory(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }
}
