package de.remsfal.defects.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.remsfal.defects.engine.AnalysisResult;
import de.remsfal.defects.engine.DefectDetectionEngine;
import de.remsfal.defects.model.DefectReportEvent;
import de.remsfal.defects.model.SurveyTextExtractedEvent;
import de.remsfal.defects.publisher.DefectReportPublisher;
import de.remsfal.defects.validation.SurveyTextValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

@Component
public class SurveyTextConsumer {

    private static final Logger log = LoggerFactory.getLogger(SurveyTextConsumer.class);

    private final ObjectMapper objectMapper;
    private final SurveyTextValidator validator;
    private final DefectDetectionEngine engine;
    private final DefectReportPublisher publisher;

    public SurveyTextConsumer(
            ObjectMapper objectMapper,
            SurveyTextValidator validator,
            DefectDetectionEngine engine,
            DefectReportPublisher publisher
    ) {
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.engine = engine;
        this.publisher = publisher;
    }

    @KafkaListener(topics = "${remsfal.kafka.topics.survey-text}", groupId = "${spring.kafka.consumer.group-id}")
    public void consume(String payload) {
        SurveyTextExtractedEvent event = null;
        try {
            event = objectMapper.readValue(payload, SurveyTextExtractedEvent.class);

            validator.validate(event);

            AnalysisResult report = engine.analyze(event.getFilename(), event.getText());

            DefectReportEvent out = new DefectReportEvent();
            out.setDocumentId(event.getDocumentId());
            out.setProjectId(event.getProjectId());
            out.setAnalysisModel(report.modelVersion() != null ? report.modelVersion() : report.processingMethod());
            out.setAnalyzedAt(report.timestamp());
            out.setReport(report);

            publisher.publish(out);

        } catch (Exception ex) {
            log.warn("Failed to process survey text event. documentId={} payloadLength={}",
                    event == null ? null : event.getDocumentId(),
                    payload == null ? 0 : payload.length(), ex);
        }
    }
}
