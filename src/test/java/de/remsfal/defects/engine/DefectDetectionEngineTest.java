package de.remsfal.defects.engine;

import de.remsfal.defects.classifier.ClassificationResult;
import de.remsfal.defects.classifier.DefectClassifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefectDetectionEngineTest {

    private static final String SURVEY = """
            Building Survey Report
            Page 1 of 3
            The foundation shows visible cracks along the east wall, measuring approximately 2mm wide.
            Significant damp was observed in the basement area with moisture buildup on the concrete walls.
            The electrical wiring in the main panel appears to be corroded, with several connections showing oxidation.
            Black mould growth was detected on the north-facing exterior wall.
            The main water pipe running through the basement shows minor leakage at the joint connections.
            The garden is well maintained.
            """;

    private final DefectDetectionEngine engine = TestEngines.ruleBased();

    @Nested
    @DisplayName("Scenarios")
    class Scenarios {

        @Test
        @DisplayName("basement crack and kitchen mold in one sentence")
        void crackAndMold() {
            AnalysisResult result = engine.analyze("survey.txt",
                    "The basement shows severe cracks and the kitchen has mold growth.");

            assertThat(result.totalDefects()).isEqualTo(2);
            assertThat(result.summary()).isEqualTo(Map.of("Structural", 1, "Mold & Fungus", 1));

            DefectMatch crack = result.defects().stream()
                    .filter(d -> d.category() == DefectCategory.STRUCTURAL).findFirst().orElseThrow();
            assertThat(crack.keyword()).isEqualTo("crack");
            assertThat(crack.severity()).isIn(Severity.HIGH, Severity.MEDIUM);
            assertThat(crack.area()).isEqualTo("basement");

            DefectMatch mold = result.defects().stream()
                    .filter(d -> d.category() == DefectCategory.MOLD).findFirst().orElseThrow();
            assertThat(mold.keyword()).isEqualTo("mold");
            assertThat(mold.area()).isEqualTo("kitchen");
        }

        @Test
        @DisplayName("text without defect keywords")
        void noDefects() {
            AnalysisResult result = engine.analyze("survey.txt", "The property was painted blue.");

            assertThat(result.totalDefects()).isZero();
            assertThat(result.defects()).isEmpty();
            assertThat(result.summary()).isEmpty();
        }

        @Test
        @DisplayName("empty text is a valid zero-defect result")
        void emptyText() {
            AnalysisResult result = engine.analyze("f.txt", "");

            assertThat(result.filename()).isEqualTo("f.txt");
            assertThat(result.totalDefects()).isZero();
            assertThat(result.defects()).isEmpty();
            assertThat(result.processingMethod()).isEqualTo(DefectDetectionEngine.RULE_BASED);
        }

        @Test
        @DisplayName("synonyms of one category in one sentence collapse to one match")
        void dedup() {
            AnalysisResult result = engine.analyze("survey.txt",
                    "A crack runs from the foundation crack to the doorway.");

            assertThat(result.defects()).filteredOn(d -> d.category() == DefectCategory.STRUCTURAL)
                    .singleElement()
                    .satisfies(d -> {
                        assertThat(d.keyword()).isEqualTo("foundation crack");
                        assertThat(d.severity()).isEqualTo(Severity.HIGH);
                    });
        }

        @Test
        @DisplayName("one sentence can describe several defect types")
        void multipleCategories() {
            AnalysisResult result = engine.analyze("survey.txt", "The damp basement wall shows exposed wiring.");

            assertThat(result.summary()).containsOnlyKeys("Moisture & Damp", "Electrical");
            assertThat(result.defects()).allSatisfy(d -> assertThat(d.area()).isEqualTo("basement"));
        }
    }

    @Nested
    @DisplayName("Invariants")
    class Invariants {

        @Test
        @DisplayName("summary counts, total and defect list agree")
        void summaryConsistency() {
            AnalysisResult result = engine.analyze("survey.txt", SURVEY);

            int summed = result.summary().values().stream().mapToInt(Integer::intValue).sum();
            assertThat(summed).isEqualTo(result.totalDefects()).isEqualTo(result.defects().size());
            for (Map.Entry<String, Integer> e : result.summary().entrySet()) {
                assertThat(result.defects()).filteredOn(d -> d.category().getDisplayName().equals(e.getKey()))
                        .hasSize(e.getValue());
            }
        }

        @Test
        @DisplayName("every keyword occurs in its sentence")
        void keywordInSentence() {
            AnalysisResult result = engine.analyze("survey.txt", SURVEY);

            assertThat(result.defects()).isNotEmpty().allSatisfy(d ->
                    assertThat(d.sentence().toLowerCase()).contains(d.keyword()));
        }

        @Test
        @DisplayName("at most one match per sentence and category")
        void onePerSentenceAndCategory() {
            AnalysisResult result = engine.analyze("survey.txt", SURVEY);

            assertThat(result.defects())
                    .extracting(d -> d.sentenceIndex() + "|" + d.category())
                    .doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("confidence is bounded and High beats the Low band")
        void confidenceBounds() {
            AnalysisResult result = engine.analyze("survey.txt", SURVEY);

            assertThat(result.defects()).allSatisfy(d -> {
                assertThat(d.confidence()).isBetween(0.0, 1.0);
                if (d.severity() == Severity.HIGH) {
                    assertThat(d.confidence()).isGreaterThan(Severity.LOW.getCeiling());
                }
            });
        }

        @Test
        @DisplayName("repeated analysis returns an equal result")
        void deterministic() {
            assertThat(engine.analyze("survey.txt", SURVEY)).isEqualTo(engine.analyze("survey.txt", SURVEY));
        }

        @Test
        @DisplayName("ignores boilerplate header lines")
        void boilerplate() {
            AnalysisResult result = engine.analyze("survey.txt", SURVEY);

            assertThat(result.defects()).noneMatch(d -> d.sentence().contains("Page 1"));
            assertThat(result.timestamp()).isEqualTo(TestEngines.NOW);
        }
    }

    @Nested
    @DisplayName("Configuration")
    class EngineOptions {

        @Test
        @DisplayName("a classifier changes confidence but not the report structure")
        void withClassifier() {
            DefectClassifier classifier = mock(DefectClassifier.class);
            when(classifier.isAvailable()).thenReturn(true);
            when(classifier.score(anyString(), any()))
                    .thenAnswer(inv -> Optional.of(new ClassificationResult(inv.getArgument(1), 0.95, "test-v1")));
            DefectDetectionEngine hybrid = TestEngines.withClassifier(classifier, 0.3);

            AnalysisResult rules = engine.analyze("survey.txt", SURVEY);
            AnalysisResult blended = hybrid.analyze("survey.txt", SURVEY);

            assertThat(blended.processingMethod()).isEqualTo(DefectDetectionEngine.HYBRID);
            assertThat(blended.modelVersion()).isEqualTo("test-v1");
            assertThat(rules.modelVersion()).isNull();
            assertThat(blended.summary()).isEqualTo(rules.summary());
            assertThat(blended.defects()).allSatisfy(d -> {
                assertThat(d.detectionMethod()).isEqualTo(ConfidenceScorer.HYBRID);
                assertThat(d.confidence()).isBetween(d.severity().getFloor(), d.severity().getCeiling());
            });
        }

        @Test
        @DisplayName("a failing classifier never fails the analysis and is asked only once")
        void failingClassifier() {
            DefectClassifier classifier = mock(DefectClassifier.class);
            when(classifier.isAvailable()).thenReturn(true);
            when(classifier.score(anyString(), any())).thenThrow(new IllegalStateException("model offline"));
            DefectDetectionEngine hybrid = TestEngines.withClassifier(classifier, 0.3);

            AnalysisResult result = hybrid.analyze("survey.txt", SURVEY);

            assertThat(result.defects()).isNotEmpty()
                    .allSatisfy(d -> assertThat(d.detectionMethod()).isEqualTo(ConfidenceScorer.RULE_BASED));
            assertThat(result.summary()).isEqualTo(engine.analyze("survey.txt", SURVEY).summary());
            assertThat(result.processingMethod()).isEqualTo(DefectDetectionEngine.RULE_BASED);
            assertThat(result.modelVersion()).isNull();
            assertThat(hybrid.processingMethod()).isEqualTo(DefectDetectionEngine.HYBRID);
            verify(classifier, times(1)).score(anyString(), any());
        }

        @Test
        @DisplayName("the classifier scores only the match kept for each sentence and category")
        void classifierAfterDedup() {
            DefectClassifier classifier = mock(DefectClassifier.class);
            when(classifier.isAvailable()).thenReturn(true);
            when(classifier.score(anyString(), any()))
                    .thenAnswer(inv -> Optional.of(new ClassificationResult(inv.getArgument(1), 0.9, "test-v1")));

            AnalysisResult result = TestEngines.withClassifier(classifier, 0.3).analyze("survey.txt",
                    "The damp basement wall shows exposed wiring.");

            assertThat(result.defects()).extracting(DefectMatch::keyword)
                    .containsExactly("exposed wiring", "damp");
            verify(classifier, times(2)).score(anyString(), any());
            verify(classifier).score("The damp basement wall shows exposed wiring.", DefectCategory.ELECTRICAL);
            verify(classifier).score("The damp basement wall shows exposed wiring.", DefectCategory.MOISTURE);
        }

        @Test
        @DisplayName("a classifier without an answer leaves the report rule based")
        void classifierWithoutAnswer() {
            DefectClassifier classifier = mock(DefectClassifier.class);
            when(classifier.isAvailable()).thenReturn(true);
            when(classifier.score(anyString(), any())).thenReturn(Optional.empty());

            AnalysisResult result = TestEngines.withClassifier(classifier, 0.3).analyze("survey.txt", SURVEY);

            assertThat(result.processingMethod()).isEqualTo(DefectDetectionEngine.RULE_BASED);
            assertThat(result.modelVersion()).isNull();
        }

        @Test
        @DisplayName("the sentence cap stops analysis after the configured number of sentences")
        void sentenceCap() {
            KeywordTaxonomy taxonomy = KeywordTaxonomy.defaults();
            DefectDetectionEngine capped = new DefectDetectionEngine(taxonomy, new TextNormalizer(),
                    new KeywordMatcher(taxonomy, MatchMode.SUBSTRING),
                    new ConfidenceScorer(null, 0.3), new AreaAttributor(), new DefectAggregator(),
                    Clock.systemUTC(), 1);

            AnalysisResult result = capped.analyze("survey.txt", "Mold in the loft. Rust on the gate.");

            assertThat(result.summary()).containsOnlyKeys("Mold & Fungus");
        }

        @Test
        @DisplayName("missing text is rejected instead of reported as defect free")
        void missingText() {
            assertThatThrownBy(() -> engine.analyze("survey.pdf", null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
