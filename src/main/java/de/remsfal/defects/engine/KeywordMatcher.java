package de.remsfal.defects.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class KeywordMatcher {

    private final List<CompiledRule> rules;
    private final MatchMode mode;

    public KeywordMatcher(KeywordTaxonomy taxonomy, MatchMode mode) {
        this.mode = mode == null ? MatchMode.SUBSTRING : mode;
        this.rules = taxonomy.rules().stream()
                .map(r -> new CompiledRule(r, this.mode == MatchMode.WORD_BOUNDARY ? boundaryPattern(r) : null))
                .toList();
    }

    public List<RawMatch> match(Sentence sentence) {
        List<RawMatch> out = new ArrayList<>();
        String haystack = sentence.normalized();
        for (CompiledRule compiled : rules) {
            int position = compiled.find(haystack);
            if (position >= 0) {
                out.add(new RawMatch(sentence, compiled.rule(), position));
            }
        }
        return out;
    }

    public MatchMode getMode() {
        return mode;
    }

    private static Pattern boundaryPattern(KeywordRule rule) {
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(rule.keyword()) + "(?![\\p{L}\\p{N}])");
    }

    private record CompiledRule(KeywordRule rule, Pattern boundary) {

        int find(String haystack) {
            if (boundary == null) {
                return haystack.indexOf(rule.keyword());
            }
            Matcher m = boundary.matcher(haystack);
            return m.find() ? m.start() : -1;
        }
    }
}
