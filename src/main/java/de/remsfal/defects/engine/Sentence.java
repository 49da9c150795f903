package de.remsfal.defects.engine;

import java.util.Locale;

public record Sentence(int index, int offset, String text, String normalized) {

    public static Sentence of(int index, int offset, String text) {
        return new Sentence(index, offset, text, text.toLowerCase(Locale.ROOT));
    }
}
