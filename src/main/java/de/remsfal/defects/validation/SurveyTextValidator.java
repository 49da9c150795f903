package de.remsfal.defects.validation;

import de.remsfal.defects.model.ExtractionStatus;
import de.remsfal.defects.model.SurveyTextExtractedEvent;
import org.springframework.stereotype.Component;

@Component
public class SurveyTextValidator {

    public void validate(SurveyTextExtractedEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event is null");
        }
        if (event.getDocumentId() == null) {
            throw new IllegalArgumentException("documentId is missing");
        }
        if (event.getFilename() == null || event.getFilename().isBlank()) {
            throw new IllegalArgumentException("filename is missing/empty");
        }
        if (event.getExtractionStatus() == null) {
            throw new IllegalArgumentException("extractionStatus is missing");
        }
        if (event.getExtractionStatus() == ExtractionStatus.FAILED) {
            throw new IllegalArgumentException("text extraction failed for " + event.getFilename()
                    + ": " + (event.getExtractionError() == null ? "no reason given" : event.getExtractionError()));
        }
        if (event.getText() == null) {
            throw new IllegalArgumentException("text is missing");
        }
    }
}
