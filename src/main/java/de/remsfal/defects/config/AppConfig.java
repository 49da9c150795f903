package de.remsfal.defects.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({KafkaTopicsConfig.class, InferenceConfig.class, DetectionConfig.class})
public class AppConfig {
}
