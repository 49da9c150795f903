package de.remsfal.defects.publisher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.remsfal.defects.config.KafkaTopicsConfig;
import de.remsfal.defects.model.DefectReportEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Component
public class DefectReportPublisher {

    private static final Logger log = LoggerFactory.getLogger(DefectReportPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final KafkaTopicsConfig topics;

    public DefectReportPublisher(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            KafkaTopicsConfig topics
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topics = topics;
    }

    public void publish(DefectReportEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            String key = event.getDocumentId().toString();

            kafkaTemplate.send(topics.getDefectReport(), key, payload);
            log.info("Published defect report documentId={} defects={} method={}",
                    event.getDocumentId(), event.getReport().totalDefects(), event.getAnalysisModel());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize DefectReportEvent documentId={}", event.getDocumentId(), e);
        }
    }
}
