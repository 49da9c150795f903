package de.remsfal.defects.engine;

public enum MatchMode {
    /** Plain containment, "electrical" also hits "non-electrical". */
    SUBSTRING,
    /** Keyword must not be flanked by letters or digits. */
    WORD_BOUNDARY
}
