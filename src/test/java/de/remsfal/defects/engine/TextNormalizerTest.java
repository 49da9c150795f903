package de.remsfal.defects.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    private List<Sentence> split(String text) {
        List<Sentence> out = new ArrayList<>();
        normalizer.sentences(text).forEach(out::add);
        return out;
    }

    @Test
    @DisplayName("empty and blank text yield no sentences")
    void emptyInput() {
        assertThat(split("")).isEmpty();
        assertThat(split("   \n\t ")).isEmpty();
        assertThat(split(null)).isEmpty();
    }

    @Test
    @DisplayName("splits on terminal punctuation followed by whitespace")
    void splitsOnTerminalPunctuation() {
        List<Sentence> sentences = split("Roof is sound. Is the cellar damp? Yes! Beam is 2.5m long.");

        assertThat(sentences).extracting(Sentence::text)
                .containsExactly("Roof is sound.", "Is the cellar damp?", "Yes!", "Beam is 2.5m long.");
        assertThat(sentences).extracting(Sentence::index).containsExactly(0, 1, 2, 3);
    }

    @Test
    @DisplayName("collapses whitespace and keeps original case while normalizing for matching")
    void collapsesWhitespace() {
        List<Sentence> sentences = split("The   Basement\twall\n  is DAMP.");

        assertThat(sentences).hasSize(1);
        assertThat(sentences.get(0).text()).isEqualTo("The Basement wall is DAMP.");
        assertThat(sentences.get(0).normalized()).isEqualTo("the basement wall is damp.");
    }

    @Test
    @DisplayName("text without terminal punctuation is a single sentence")
    void trailingFragment() {
        assertThat(split("Loose roof tiles")).extracting(Sentence::text).containsExactly("Loose roof tiles");
    }

    @Test
    @DisplayName("drops page markers, numbers and header lines")
    void stripsBoilerplate() {
        String text = """
                CONFIDENTIAL - Building Survey
                Date: 12/03/2024
                Ref: BS-2291
                The loft has a small leak.
                -----
                17
                Page 2 of 9
                Copyright 2024 Surveyors Ltd
                The kitchen floor is uneven.
                """;

        assertThat(split(text)).extracting(Sentence::text)
                .containsExactly("The loft has a small leak.", "The kitchen floor is uneven.");
    }

    @Test
    @DisplayName("sentences record their offset in the cleaned text")
    void offsets() {
        List<Sentence> sentences = split("Damp wall. Cracked lintel.");

        assertThat(sentences.get(0).offset()).isZero();
        assertThat(sentences.get(1).offset()).isEqualTo(11);
    }

    @Test
    @DisplayName("the sentence sequence can be iterated more than once")
    void restartable() {
        Iterable<Sentence> sentences = normalizer.sentences("One. Two. Three.");
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();
        sentences.forEach(s -> first.add(s.text()));
        sentences.forEach(s -> second.add(s.text()));

        assertThat(first).hasSize(3).isEqualTo(second);
    }
}
