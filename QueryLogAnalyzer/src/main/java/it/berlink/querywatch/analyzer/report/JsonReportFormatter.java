package it.berlink.querywatch.analyzer.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.berlink.querywatch.analyzer.model.AnalysisReport;
import it.berlink.querywatch.exception.QueryWatchException;
import org.springframework.stereotype.Component;

@Component
public class JsonReportFormatter implements ReportFormatter {

    private final ObjectMapper objectMapper;

    public JsonReportFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ReportFormat format() {
        return ReportFormat.JSON;
    }

    @Override
    public String render(AnalysisReport report) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new QueryWatchException("Failed to serialize analysis report", e);
        }
    }
}
