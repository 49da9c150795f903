package de.remsfal.defects.classifier;

import de.remsfal.defects.config.InferenceConfig;
import de.remsfal.defects.engine.DefectCategory;
import de.remsfal.defects.inference.InferenceDtos.ScoreRequest;
import de.remsfal.defects.inference.InferenceDtos.ScoreResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Optional;

@Component
@ConditionalOnProperty(name = "remsfal.classifier.mode", havingValue = "inference")
public class HttpInferenceClassifier implements DefectClassifier {

    private static final Logger log = LoggerFactory.getLogger(HttpInferenceClassifier.class);

    private final WebClient webClient;
    private final InferenceConfig cfg;
    private final String endpoint;

    public HttpInferenceClassifier(WebClient inferenceWebClient, InferenceConfig cfg) {
        this.webClient = inferenceWebClient;
        this.cfg = cfg;
        this.endpoint = mapProviderToEndpoint(cfg.getProvider());
        log.info("Statistical classifier enabled: baseUrl={} endpoint={}", cfg.getBaseUrl(), endpoint);
    }

    @Override
    public Optional<ClassificationResult> score(String sentence, DefectCategory category) {
        if (sentence == null || sentence.isBlank()) {
            return Optional.empty();
        }

        ScoreResponse resp = webClient.post()
                .uri(endpoint)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new ScoreRequest(sentence.trim(), category.getDisplayName()))
                .retrieve()
                .bodyToMono(ScoreResponse.class)
                .timeout(Duration.ofMillis(cfg.getTimeoutMs()))
                .block();

        if (resp == null || resp.probability() == null) {
            return Optional.empty();
        }

        return Optional.of(new ClassificationResult(category, resp.probability(), resp.modelVersion()));
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String getMode() {
        return "inference";
    }

    static String mapProviderToEndpoint(String provider) {
        if (provider == null) return "/score/baseline";
        return switch (provider.toLowerCase()) {
            case "tfidf", "baseline" -> "/score/baseline";
            case "distilbert" -> "/score/distilbert";
            default -> "/score/baseline";
        };
    }
}
