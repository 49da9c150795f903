package de.remsfal.defects.engine;

import java.util.List;

public enum BuildingArea {

    BASEMENT("basement", List.of("basement", "cellar")),
    FOUNDATION("foundation", List.of("foundation", "footing")),
    KITCHEN("kitchen", List.of("kitchen")),
    BATHROOM("bathroom", List.of("bathroom", "shower", "toilet")),
    ELECTRICAL("electrical", List.of("electrical", "wiring", "fuse board", "consumer unit")),
    EXTERIOR("exterior", List.of("exterior", "outside", "external", "facade")),
    ROOF("roof", List.of("roof", "ceiling", "loft", "attic", "gutter")),
    GENERAL("general", List.of());

    private final String label;
    private final List<String> keywords;

    BuildingArea(String label, List<String> keywords) {
        this.label = label;
        this.keywords = keywords;
    }

    public String getLabel() { return label; }

    public List<String> getKeywords() { return keywords; }

    boolean mentionedIn(String normalizedText) {
        for (String keyword : keywords) {
            if (normalizedText.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
