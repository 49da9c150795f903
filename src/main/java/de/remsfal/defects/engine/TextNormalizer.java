package de.remsfal.defects.engine;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

public class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final Pattern HAS_LETTER = Pattern.compile("\\p{L}");

    private static final List<Pattern> BOILERPLATE = List.of(
            Pattern.compile("^page\\s+\\d+(\\s+of\\s+\\d+)?$"),
            Pattern.compile("^(date|ref|reference|prepared by)\\s*:.*"),
            Pattern.compile("^(confidential|copyright|©).*")
    );

    /**
     * Lazily splits the text into sentences. The returned iterable may be iterated any
     * number of times; empty text yields no sentences.
     */
    public Iterable<Sentence> sentences(String text) {
        String cleaned = clean(text);
        return () -> new SentenceIterator(cleaned);
    }

    String clean(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (String line : LINE_BREAK.split(text)) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || isBoilerplate(trimmed)) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(trimmed);
        }
        return WHITESPACE.matcher(sb).replaceAll(" ").trim();
    }

    private boolean isBoilerplate(String line) {
        if (!HAS_LETTER.matcher(line).find()) {
            return true;
        }
        String lower = line.toLowerCase(Locale.ROOT);
        for (Pattern p : BOILERPLATE) {
            if (p.matcher(lower).matches()) {
                return true;
            }
        }
        return false;
    }

    private static boolean isTerminal(char c) {
        return c == '.' || c == '!' || c == '?';
    }

    private static final class SentenceIterator implements Iterator<Sentence> {

        private final String text;
        private int cursor;
        private int index;
        private Sentence next;

        SentenceIterator(String text) {
            this.text = text;
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public Sentence next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Sentence s = next;
            next = null;
            return s;
        }

        private Sentence advance() {
            while (cursor < text.length()) {
                int start = cursor;
                int end = findEnd(start);
                cursor = end;
                String raw = text.substring(start, end);
                String trimmed = raw.trim();
                if (!trimmed.isEmpty()) {
                    int offset = start + raw.indexOf(trimmed.charAt(0));
                    return Sentence.of(index++, offset, trimmed);
                }
            }
            return null;
        }

        private int findEnd(int start) {
            for (int i = start; i < text.length(); i++) {
                if (isTerminal(text.charAt(i))
                        && (i + 1 == text.length() || Character.isWhitespace(text.charAt(i + 1)))) {
                    return i + 1;
                }
            }
            return text.length();
        }
    }
}
