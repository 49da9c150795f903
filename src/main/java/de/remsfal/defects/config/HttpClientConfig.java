package de.remsfal.defects.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@ConditionalOnProperty(name = "remsfal.classifier.mode", havingValue = "inference")
public class HttpClientConfig {

    @Bean
    public WebClient inferenceWebClient(InferenceConfig cfg) {
        if (cfg.getBaseUrl() == null || cfg.getBaseUrl().isBlank()) {
            throw new IllegalStateException("remsfal.inference.base-url is required in inference mode");
        }
        return WebClient.builder()
                .baseUrl(cfg.getBaseUrl())
                .build();
    }
}
