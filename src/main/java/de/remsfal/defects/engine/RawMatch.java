package de.remsfal.defects.engine;

public record RawMatch(Sentence sentence, KeywordRule rule, int position) {

    public DefectCategory category() {
        return rule.category();
    }
}
