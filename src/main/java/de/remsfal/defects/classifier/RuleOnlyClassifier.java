package de.remsfal.defects.classifier;

import de.remsfal.defects.engine.DefectCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@ConditionalOnProperty(name = "remsfal.classifier.mode", havingValue = "rules", matchIfMissing = true)
public class RuleOnlyClassifier implements DefectClassifier {

    private static final Logger log = LoggerFactory.getLogger(RuleOnlyClassifier.class);

    public RuleOnlyClassifier() {
        log.info("No statistical classifier configured, confidence is rule-based only");
    }

    @Override
    public Optional<ClassificationResult> score(String sentence, DefectCategory category) {
        return Optional.empty();
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String getMode() {
        return "rules";
    }
}
