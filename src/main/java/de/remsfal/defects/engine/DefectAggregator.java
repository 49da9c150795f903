package de.remsfal.defects.engine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class DefectAggregator {

    static final Comparator<DefectMatch> STRENGTH = Comparator
            .comparingInt((DefectMatch m) -> m.severity().getRank())
            .thenComparingDouble(DefectMatch::confidence);

    static final Comparator<DefectMatch> REPORT_ORDER = STRENGTH.reversed()
            .thenComparingInt(DefectMatch::sentenceIndex)
            .thenComparing(DefectMatch::category);

    public AnalysisResult aggregate(String filename, List<DefectMatch> matches,
                                    String processingMethod, String modelVersion, Instant timestamp) {
        List<DefectMatch> defects = new ArrayList<>(deduplicate(matches));
        defects.sort(REPORT_ORDER);

        Map<DefectCategory, Integer> counts = new EnumMap<>(DefectCategory.class);
        for (DefectMatch m : defects) {
            counts.merge(m.category(), 1, Integer::sum);
        }

        Map<String, Integer> summary = new LinkedHashMap<>();
        Map<String, Double> percentages = new LinkedHashMap<>();
        counts.forEach((category, count) -> {
            summary.put(category.getDisplayName(), count);
            percentages.put(category.getDisplayName(), Math.round(count * 1000.0 / defects.size()) / 10.0);
        });

        return new AnalysisResult(
                filename,
                List.copyOf(defects),
                Collections.unmodifiableMap(summary),
                Collections.unmodifiableMap(percentages),
                defects.size(),
                processingMethod,
                modelVersion,
                timestamp
        );
    }

    /**
     * One match per (sentence, category): highest severity, then highest confidence; on a
     * full tie the earlier match is kept.
     */
    List<DefectMatch> deduplicate(List<DefectMatch> matches) {
        Map<SentenceCategory, DefectMatch> best = new LinkedHashMap<>();
        for (DefectMatch m : matches) {
            best.merge(new SentenceCategory(m.sentenceIndex(), m.category()), m,
                    (kept, candidate) -> STRENGTH.compare(candidate, kept) > 0 ? candidate : kept);
        }
        return new ArrayList<>(best.values());
    }

    private record SentenceCategory(int sentenceIndex, DefectCategory category) {}
}
