package de.remsfal.defects.engine;

import static de.remsfal.defects.engine.DefectCategory.CORROSION;
import static de.remsfal.defects.engine.DefectCategory.ELECTRICAL;
import static de.remsfal.defects.engine.DefectCategory.GENERAL_STRUCTURAL;
import static de.remsfal.defects.engine.DefectCategory.MOISTURE;
import static de.remsfal.defects.engine.DefectCategory.MOLD;
import static de.remsfal.defects.engine.DefectCategory.PLUMBING;
import static de.remsfal.defects.engine.DefectCategory.STRUCTURAL;
import static de.remsfal.defects.engine.Severity.HIGH;
import static de.remsfal.defects.engine.Severity.LOW;
import static de.remsfal.defects.engine.Severity.MEDIUM;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable, ordered table of keyword rules. Rule order matters: when two rules of the same
 * category tie on severity and confidence in one sentence, the earlier rule wins.
 */
public final class KeywordTaxonomy {

    private static final List<KeywordRule> DEFAULT_RULES = List.of(
            KeywordRule.of(STRUCTURAL, "structural crack", HIGH),
            KeywordRule.of(STRUCTURAL, "foundation crack", HIGH),
            KeywordRule.of(STRUCTURAL, "settlement crack", HIGH),
            KeywordRule.of(STRUCTURAL, "major crack", HIGH),
            KeywordRule.of(STRUCTURAL, "fracture", HIGH),
            KeywordRule.of(STRUCTURAL, "crack", MEDIUM),
            KeywordRule.of(STRUCTURAL, "fissure", MEDIUM),
            KeywordRule.of(STRUCTURAL, "hairline crack", LOW),

            KeywordRule.of(MOISTURE, "rising damp", HIGH),
            KeywordRule.of(MOISTURE, "penetrating damp", HIGH),
            KeywordRule.of(MOISTURE, "water damage", HIGH),
            KeywordRule.of(MOISTURE, "water ingress", HIGH),
            KeywordRule.of(MOISTURE, "damp", MEDIUM),
            KeywordRule.of(MOISTURE, "moisture", MEDIUM),
            KeywordRule.of(MOISTURE, "water stain", MEDIUM),
            KeywordRule.of(MOISTURE, "condensation", LOW),
            KeywordRule.of(MOISTURE, "humidity", LOW),

            KeywordRule.of(ELECTRICAL, "exposed wiring", HIGH),
            KeywordRule.of(ELECTRICAL, "faulty wiring", HIGH),
            KeywordRule.of(ELECTRICAL, "electrical hazard", HIGH),
            KeywordRule.of(ELECTRICAL, "electric shock", HIGH),
            KeywordRule.of(ELECTRICAL, "overloaded circuit", HIGH),
            KeywordRule.of(ELECTRICAL, "electrical", MEDIUM),
            KeywordRule.of(ELECTRICAL, "wiring", MEDIUM),
            KeywordRule.of(ELECTRICAL, "circuit", MEDIUM),
            KeywordRule.of(ELECTRICAL, "consumer unit", MEDIUM),
            KeywordRule.of(ELECTRICAL, "fuse", LOW),
            KeywordRule.of(ELECTRICAL, "socket", LOW),

            KeywordRule.of(PLUMBING, "burst pipe", HIGH),
            KeywordRule.of(PLUMBING, "sewage", HIGH),
            KeywordRule.of(PLUMBING, "leak", MEDIUM),
            KeywordRule.of(PLUMBING, "pipe", MEDIUM),
            KeywordRule.of(PLUMBING, "plumbing", MEDIUM),
            KeywordRule.of(PLUMBING, "blockage", MEDIUM),
            KeywordRule.of(PLUMBING, "drain", LOW),
            KeywordRule.of(PLUMBING, "dripping", LOW),
            KeywordRule.of(PLUMBING, "water pressure", LOW),

            KeywordRule.of(MOLD, "black mold", HIGH),
            KeywordRule.of(MOLD, "black mould", HIGH),
            KeywordRule.of(MOLD, "toxic mold", HIGH),
            KeywordRule.of(MOLD, "dry rot", HIGH),
            KeywordRule.of(MOLD, "mold", MEDIUM),
            KeywordRule.of(MOLD, "mould", MEDIUM),
            KeywordRule.of(MOLD, "fungus", MEDIUM),
            KeywordRule.of(MOLD, "fungal", MEDIUM),
            KeywordRule.of(MOLD, "wet rot", MEDIUM),
            KeywordRule.of(MOLD, "mildew", LOW),
            KeywordRule.of(MOLD, "spores", LOW),

            KeywordRule.of(CORROSION, "severe corrosion", HIGH),
            KeywordRule.of(CORROSION, "metal fatigue", HIGH),
            KeywordRule.of(CORROSION, "corrosion", MEDIUM),
            KeywordRule.of(CORROSION, "corroded", MEDIUM),
            KeywordRule.of(CORROSION, "rust", MEDIUM),
            KeywordRule.of(CORROSION, "oxidation", LOW),
            KeywordRule.of(CORROSION, "oxidised", LOW),
            KeywordRule.of(CORROSION, "oxidized", LOW),

            KeywordRule.of(GENERAL_STRUCTURAL, "structural damage", HIGH),
            KeywordRule.of(GENERAL_STRUCTURAL, "subsidence", HIGH),
            KeywordRule.of(GENERAL_STRUCTURAL, "load-bearing", HIGH),
            KeywordRule.of(GENERAL_STRUCTURAL, "foundation movement", HIGH),
            KeywordRule.of(GENERAL_STRUCTURAL, "settlement", MEDIUM),
            KeywordRule.of(GENERAL_STRUCTURAL, "deflection", MEDIUM),
            KeywordRule.of(GENERAL_STRUCTURAL, "bowing", MEDIUM),
            KeywordRule.of(GENERAL_STRUCTURAL, "beam", MEDIUM),
            KeywordRule.of(GENERAL_STRUCTURAL, "lintel", MEDIUM),
            KeywordRule.of(GENERAL_STRUCTURAL, "uneven floor", LOW)
    );

    private static final KeywordTaxonomy DEFAULT = new KeywordTaxonomy(DEFAULT_RULES);

    private final List<KeywordRule> rules;

    public KeywordTaxonomy(List<KeywordRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("taxonomy has no rules");
        }
        Set<String> seen = new HashSet<>();
        for (KeywordRule rule : rules) {
            if (rule == null) {
                throw new IllegalArgumentException("taxonomy contains a null rule");
            }
            if (!seen.add(rule.category() + "|" + rule.keyword())) {
                throw new IllegalArgumentException(
                        "duplicate keyword '" + rule.keyword() + "' in category " + rule.category());
            }
        }
        this.rules = List.copyOf(rules);
    }

    public static KeywordTaxonomy defaults() {
        return DEFAULT;
    }

    /**
     * Returns a new taxonomy with the given rules appended after this one's.
     */
    public KeywordTaxonomy withAdditionalRules(List<KeywordRule> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        List<KeywordRule> merged = new ArrayList<>(rules);
        merged.addAll(extra);
        return new KeywordTaxonomy(merged);
    }

    public List<KeywordRule> rules() {
        return rules;
    }

    public List<KeywordRule> rulesFor(DefectCategory category) {
        return rules.stream().filter(r -> r.category() == category).toList();
    }

    public int size() {
        return rules.size();
    }
}
