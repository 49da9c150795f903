package de.remsfal.defects.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "remsfal.kafka.topics")
public class KafkaTopicsConfig {

    private String surveyText;
    private String defectReport;

    public String getSurveyText() { return surveyText; }
    public void setSurveyText(String surveyText) { this.surveyText = surveyText; }

    public String getDefectReport() { return defectReport; }
    public void setDefectReport(String defectReport) { this.defectReport = defectReport; }
}
