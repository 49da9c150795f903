package de.remsfal.defects.config;

import de.remsfal.defects.classifier.DefectClassifier;
import de.remsfal.defects.engine.AreaAttributor;
import de.remsfal.defects.engine.ConfidenceScorer;
import de.remsfal.defects.engine.DefectAggregator;
import de.remsfal.defects.engine.DefectDetectionEngine;
import de.remsfal.defects.engine.KeywordMatcher;
import de.remsfal.defects.engine.KeywordTaxonomy;
import de.remsfal.defects.engine.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public KeywordTaxonomy keywordTaxonomy(DetectionConfig cfg) {
        KeywordTaxonomy taxonomy = KeywordTaxonomy.defaults().withAdditionalRules(cfg.toKeywordRules());
        log.info("Loaded keyword taxonomy with {} rules ({} from configuration)",
                taxonomy.size(), cfg.getExtraRules().size());
        return taxonomy;
    }

    @Bean
    public Clock analysisClock() {
        return Clock.systemUTC();
    }

    @Bean
    public DefectDetectionEngine defectDetectionEngine(KeywordTaxonomy taxonomy,
                                                       DefectClassifier classifier,
                                                       DetectionConfig cfg,
                                                       Clock analysisClock) {
        return new DefectDetectionEngine(
                taxonomy,
                new TextNormalizer(),
                new KeywordMatcher(taxonomy, cfg.getMatchMode()),
                new ConfidenceScorer(classifier, cfg.getBlendWeight()),
                new AreaAttributor(),
                new DefectAggregator(),
                analysisClock,
                cfg.getMaxSentences()
        );
    }
}
