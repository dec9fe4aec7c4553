package it.berlink.querywatch.analysis;

import it.berlink.querywatch.aggregate.PatternAggregator;
import it.berlink.querywatch.classifier.QueryClassifier;
import it.berlink.querywatch.config.ThresholdConfig;
import it.berlink.querywatch.model.Classification;
import it.berlink.querywatch.model.PatternGroup;
import it.berlink.querywatch.model.ScopeReport;
import it.berlink.querywatch.model.StatementRecord;
import it.berlink.querywatch.normalizer.SqlNormalizer;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregation and classification pipeline shared by live scopes and batch analysis.
 * Both paths go through {@link #analyze} so they group statements identically.
 */
public class StatementAnalyzer {

    private final PatternAggregator aggregator;
    private final QueryClassifier classifier;
    private final ThresholdConfig config;

    public StatementAnalyzer(ThresholdConfig config) {
        this(new PatternAggregator(new SqlNormalizer(config.getMaxPatternLength())),
            new QueryClassifier(), config);
    }

    public StatementAnalyzer(PatternAggregator aggregator, QueryClassifier classifier, ThresholdConfig config) {
        this.aggregator = aggregator;
        this.classifier = classifier;
        this.config = config;
    }

    /**
     * @param label        scope label, or the source name for batch input
     * @param records      statements in execution order
     * @param scopeSeconds duration used for the slow scope rule
     */
    public ScopeReport analyze(String label, List<StatementRecord> records, double scopeSeconds) {
        List<PatternGroup> groups = aggregator.aggregate(records);
        Classification classification = classifier.classify(records, groups, scopeSeconds, config);

        double totalTime = 0;
        for (StatementRecord record : records) {
            totalTime += record.durationSeconds();
        }

        return ScopeReport.builder()
            .label(label)
            .totalStatementCount(records.size())
            .totalTime(totalTime)
            .elapsedSeconds(scopeSeconds)
            .groups(groups)
            .classification(classification)
            .statementTypes(countStatementTypes(records))
            .build();
    }

    static Map<String, Integer> countStatementTypes(List<StatementRecord> records) {
        Map<String, Integer> types = new TreeMap<>();
        for (StatementRecord record : records) {
            types.merge(statementType(record.text()), 1, Integer::sum);
        }
        return types;
    }

    static String statementType(String sql) {
        if (sql == null || sql.isBlank()) {
            return "UNKNOWN";
        }
        String trimmed = sql.strip();
        int end = 0;
        while (end < trimmed.length() && Character.isLetter(trimmed.charAt(end))) {
            end++;
        }
        return end == 0 ? "UNKNOWN" : trimmed.substring(0, end).toUpperCase(Locale.ROOT);
    }

    public PatternAggregator getAggregator() {
        return aggregator;
    }

    public QueryClassifier getClassifier() {
        return classifier;
    }

    public ThresholdConfig getConfig() {
        return config;
    }
}
