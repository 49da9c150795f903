package de.remsfal.defects.export;

import de.remsfal.defects.config.DetectionConfig;
import de.remsfal.defects.engine.AnalysisResult;
import de.remsfal.defects.engine.DefectMatch;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class DefectCsvExporter {

    static final List<String> HEADER = List.of("Type", "Keyword", "Severity", "Confidence", "Area", "Context");

    private final int contextLength;

    @Autowired
    public DefectCsvExporter(DetectionConfig cfg) {
        this(cfg.getContextLength());
    }

    public DefectCsvExporter(int contextLength) {
        if (contextLength <= 0) {
            throw new IllegalArgumentException("context length must be positive, got " + contextLength);
        }
        this.contextLength = contextLength;
    }

    public String export(AnalysisResult result) {
        StringBuilder csv = new StringBuilder();
        appendRow(csv, HEADER);
        for (DefectMatch defect : result.defects()) {
            List<String> row = new ArrayList<>(HEADER.size());
            row.add(defect.category().getDisplayName());
            row.add(defect.keyword());
            row.add(defect.severity().getLabel());
            row.add(String.format(Locale.ROOT, "%.3f", defect.confidence()));
            row.add(defect.area());
            row.add(truncate(defect.sentence()));
            appendRow(csv, row);
        }
        return csv.toString();
    }

    private String truncate(String sentence) {
        if (sentence == null) return "";
        return sentence.length() <= contextLength ? sentence : sentence.substring(0, contextLength);
    }

    private static void appendRow(StringBuilder csv, List<String> fields) {
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) csv.append(',');
            csv.append('"').append(fields.get(i).replace("\"", "\"\"")).append('"');
        }
        csv.append('\n');
    }
}
