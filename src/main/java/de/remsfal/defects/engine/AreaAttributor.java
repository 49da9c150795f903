package de.remsfal.defects.engine;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class AreaAttributor {

    private static final Pattern CLAUSE_BREAK =
            Pattern.compile("[,;:]|\\s(?:and|but|while|whereas)\\s");

    public BuildingArea attribute(Sentence sentence, int keywordPosition) {
        String text = sentence.normalized();
        BuildingArea area = firstArea(clauseAround(text, keywordPosition));
        if (area == BuildingArea.GENERAL) {
            area = firstArea(text);
        }
        return area;
    }

    private BuildingArea firstArea(String scope) {
        for (BuildingArea area : BuildingArea.values()) {
            if (area.mentionedIn(scope)) {
                return area;
            }
        }
        return BuildingArea.GENERAL;
    }

    private String clauseAround(String text, int position) {
        if (position < 0 || position >= text.length()) {
            return text;
        }
        int start = 0;
        int end = text.length();
        Matcher m = CLAUSE_BREAK.matcher(text);
        while (m.find()) {
            if (m.end() <= position) {
                start = m.end();
            } else if (m.start() > position) {
                end = m.start();
                break;
            }
        }
        return text.substring(start, end);
    }
}
