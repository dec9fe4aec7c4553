package it.berlink.querywatch.analyzer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result of analyzing a statement log. Times are in seconds unless the field name says otherwise.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisReport {

    private String source;
    private Instant generatedAt;
    private long linesRead;
    private long linesSkipped;

    private long totalQueries;
    private double totalTime;
    private double averageQueryTime;
    private double elapsedSeconds;
    private double queriesPerSecond;

    private SlowQuerySummary slowQueries;
    private List<PatternSummary> queryPatterns;
    @JsonProperty("nPlusOneCandidates")
    private List<PatternSummary> nPlusOneCandidates;
    private Map<String, Integer> statementTypes;
    private List<String> recommendations;
}
