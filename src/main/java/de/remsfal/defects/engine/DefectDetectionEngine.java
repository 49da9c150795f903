package de.remsfal.defects.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class DefectDetectionEngine {

    public static final String RULE_BASED = "rule_based";
    public static final String HYBRID = "hybrid_ml";

    private static final Logger log = LoggerFactory.getLogger(DefectDetectionEngine.class);

    private final KeywordTaxonomy taxonomy;
    private final TextNormalizer normalizer;
    private final KeywordMatcher matcher;
    private final ConfidenceScorer scorer;
    private final AreaAttributor attributor;
    private final DefectAggregator aggregator;
    private final Clock clock;
    private final int maxSentences;

    public DefectDetectionEngine(KeywordTaxonomy taxonomy,
                                 TextNormalizer normalizer,
                                 KeywordMatcher matcher,
                                 ConfidenceScorer scorer,
                                 AreaAttributor attributor,
                                 DefectAggregator aggregator,
                                 Clock clock,
                                 int maxSentences) {
        this.taxonomy = taxonomy;
        this.normalizer = normalizer;
        this.matcher = matcher;
        this.scorer = scorer;
        this.attributor = attributor;
        this.aggregator = aggregator;
        this.clock = clock;
        this.maxSentences = maxSentences;
    }

    public AnalysisResult analyze(String filename, String text) {
        Objects.requireNonNull(filename, "filename is missing");
        if (text == null) {
            throw new IllegalArgumentException("text is missing for " + filename);
        }

        List<DefectMatch> candidates = new ArrayList<>();
        int sentences = 0;
        for (Sentence sentence : normalizer.sentences(text)) {
            if (maxSentences > 0 && sentences >= maxSentences) {
                log.warn("Sentence cap reached for '{}', analysed first {} sentences only", filename, maxSentences);
                break;
            }
            sentences++;
            for (RawMatch raw : matcher.match(sentence)) {
                BuildingArea area = attributor.attribute(sentence, raw.position());
                candidates.add(new DefectMatch(
                        raw.category(),
                        raw.rule().keyword(),
                        sentence.text(),
                        raw.rule().severity(),
                        scorer.baseScore(raw.rule()),
                        area.getLabel(),
                        ConfidenceScorer.RULE_BASED,
                        sentence.index()
                ));
            }
        }

        // the classifier only sees one match per (sentence, category)
        ConfidenceScorer.Session scoring = scorer.newSession();
        List<DefectMatch> defects = new ArrayList<>();
        for (DefectMatch survivor : aggregator.deduplicate(candidates)) {
            defects.add(scoring.refine(survivor));
        }
        boolean blended = defects.stream().anyMatch(d -> ConfidenceScorer.HYBRID.equals(d.detectionMethod()));

        AnalysisResult result = aggregator.aggregate(filename, defects, blended ? HYBRID : RULE_BASED,
                blended ? scoring.modelVersion() : null, clock.instant());
        log.info("Analysed '{}': sentences={} rawMatches={} defects={} method={}",
                filename, sentences, candidates.size(), result.totalDefects(), result.processingMethod());
        return result;
    }

    /**
     * Method reported while the classifier answers. A single result may still say
     * {@link #RULE_BASED} when no confidence could be blended.
     */
    public String processingMethod() {
        return scorer.isBlending() ? HYBRID : RULE_BASED;
    }

    public boolean isClassifierAvailable() {
        return scorer.isBlending();
    }

    public KeywordTaxonomy getTaxonomy() {
        return taxonomy;
    }
}
