package de.remsfal.defects.config;

import de.remsfal.defects.engine.DefectCategory;
import de.remsfal.defects.engine.KeywordRule;
import de.remsfal.defects.engine.MatchMode;
import de.remsfal.defects.engine.Severity;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "remsfal.detection")
public class DetectionConfig {

    private MatchMode matchMode = MatchMode.SUBSTRING;
    private int maxSentences = 0;   // 0 = unlimited
    private double blendWeight = 0.3;
    private int contextLength = 200;
    private List<ExtraRule> extraRules = new ArrayList<>();

    public MatchMode getMatchMode() { return matchMode; }
    public void setMatchMode(MatchMode matchMode) { this.matchMode = matchMode; }

    public int getMaxSentences() { return maxSentences; }
    public void setMaxSentences(int maxSentences) { this.maxSentences = maxSentences; }

    public double getBlendWeight() { return blendWeight; }
    public void setBlendWeight(double blendWeight) { this.blendWeight = blendWeight; }

    public int getContextLength() { return contextLength; }
    public void setContextLength(int contextLength) { this.contextLength = contextLength; }

    public List<ExtraRule> getExtraRules() { return extraRules; }
    public void setExtraRules(List<ExtraRule> extraRules) { this.extraRules = extraRules; }

    public List<KeywordRule> toKeywordRules() {
        return extraRules.stream().map(ExtraRule::toKeywordRule).toList();
    }

    public static class ExtraRule {

        private DefectCategory category;
        private String keyword;
        private Severity severity = Severity.MEDIUM;

        public DefectCategory getCategory() { return category; }
        public void setCategory(DefectCategory category) { this.category = category; }

        public String getKeyword() { return keyword; }
        public void setKeyword(String keyword) { this.keyword = keyword; }

        public Severity getSeverity() { return severity; }
        public void setSeverity(Severity severity) { this.severity = severity; }

        KeywordRule toKeywordRule() {
            return new KeywordRule(category, keyword, severity);
        }
    }
}
