package it.berlink.querywatch.analyzer.service;

import it.berlink.querywatch.analysis.StatementAnalyzer;
import it.berlink.querywatch.analyzer.model.AnalysisReport;
import it.berlink.querywatch.analyzer.model.PatternSummary;
import it.berlink.querywatch.analyzer.model.SlowQueryExample;
import it.berlink.querywatch.analyzer.model.SlowQuerySummary;
import it.berlink.querywatch.analyzer.parser.StatementLogReader.ReadResult;
import it.berlink.querywatch.config.ThresholdConfig;
import it.berlink.querywatch.model.PatternGroup;
import it.berlink.querywatch.model.ScopeReport;
import it.berlink.querywatch.model.StatementRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Offline analysis of a statement log.
 *
 * Grouping and classification go through {@link StatementAnalyzer}, the same
 * pipeline live scopes use, so a log analyzed here yields the same groups and
 * suspects as the scope that produced it.
 */
@Slf4j
@Service
public class BatchAnalyzer {

    static final int MAX_SQL_LENGTH = 200;
    static final int MAX_RECOMMENDATION_EXAMPLES = 3;
    static final double DOMINANT_PATTERN_PERCENT = 50.0;

    private final ThresholdConfig baseConfig;

    public BatchAnalyzer(ThresholdConfig baseConfig) {
        this.baseConfig = baseConfig;
    }

    /**
     * Analyzes records with the configured pattern limit.
     */
    public AnalysisReport analyze(List<StatementRecord> records, double slowThresholdMs) {
        return analyze("records", records, slowThresholdMs, baseConfig.getTopK());
    }

    public AnalysisReport analyze(ReadResult source, double slowThresholdMs, int top) {
        AnalysisReport report = analyze(source.source(), source.records(), slowThresholdMs, top);
        report.setLinesRead(source.linesRead());
        report.setLinesSkipped(source.linesSkipped());
        return report;
    }

    AnalysisReport analyze(String source, List<StatementRecord> records, double slowThresholdMs, int top) {
        ThresholdConfig config = baseConfig.toBuilder()
            .slowStatementMs(slowThresholdMs)
            .topK(top)
            .build();
        StatementAnalyzer analyzer = new StatementAnalyzer(config);

        double window = elapsedWindowSeconds(records);
        double totalTime = totalTime(records);
        double scopeSeconds = window > 0 ? window : totalTime;

        ScopeReport scope = analyzer.analyze(source, records, scopeSeconds);
        int total = scope.getTotalStatementCount();
        List<StatementRecord> slow = scope.getClassification().getSlowStatementRecords();
        List<PatternGroup> suspects = scope.getClassification().getSuspectedGroups();

        List<PatternSummary> patterns = scope.getGroups().stream()
            .limit(top)
            .map(BatchAnalyzer::toSummary)
            .toList();

        AnalysisReport report = AnalysisReport.builder()
            .source(source)
            .generatedAt(Instant.now())
            .linesRead(records.size())
            .totalQueries(total)
            .totalTime(totalTime)
            .averageQueryTime(total == 0 ? 0 : totalTime / total)
            .elapsedSeconds(scopeSeconds)
            .queriesPerSecond(scopeSeconds > 0 ? total / scopeSeconds : 0)
            .slowQueries(SlowQuerySummary.builder()
                .count(slow.size())
                .thresholdMs(slowThresholdMs)
                .percent(total == 0 ? 0 : round(slow.size() * 100.0 / total))
                .topExamples(slow.stream().limit(top).map(BatchAnalyzer::toExample).toList())
                .build())
            .queryPatterns(patterns)
            .nPlusOneCandidates(suspects.stream().map(BatchAnalyzer::toSummary).toList())
            .statementTypes(scope.getStatementTypes())
            .recommendations(recommendations(total, totalTime, slow.size(), slowThresholdMs, suspects, scope.getGroups()))
            .build();

        log.info("Analyzed {} statement(s) from {}: {} slow, {} N+1 candidate(s), {} pattern(s)",
            total, source, slow.size(), suspects.size(), scope.getGroups().size());
        return report;
    }

    static List<String> recommendations(int total, double totalTime, int slowCount, double slowThresholdMs,
                                        List<PatternGroup> suspects, List<PatternGroup> groups) {
        List<String> recommendations = new ArrayList<>();
        if (total == 0) {
            recommendations.add("No SQL statements found in the log");
            return recommendations;
        }

        if (slowCount > 0) {
            recommendations.add(String.format(Locale.ROOT,
                "%d slow queries found (> %s ms): review them and add appropriate indexes",
                slowCount, formatNumber(slowThresholdMs)));
        }

        if (!suspects.isEmpty()) {
            recommendations.add(String.format(Locale.ROOT,
                "%d high-frequency patterns found - consider batching these lookups or loading the related rows in one query",
                suspects.size()));
            suspects.stream()
                .limit(MAX_RECOMMENDATION_EXAMPLES)
                .forEach(group -> recommendations.add(String.format(Locale.ROOT,
                    "Example: %dx %s", group.getCount(), truncate(group.getExampleText()))));
        }

        if (totalTime > 0 && !groups.isEmpty()) {
            PatternGroup heaviest = groups.get(0);
            double share = heaviest.getTotalTime() * 100.0 / totalTime;
            if (share > DOMINANT_PATTERN_PERCENT) {
                recommendations.add(String.format(Locale.ROOT,
                    "Pattern %s accounts for %.1f%% of total query time", computeHash(heaviest.getPattern()), share));
            }
        }
        return recommendations;
    }

    static double elapsedWindowSeconds(List<StatementRecord> records) {
        Instant first = null;
        Instant last = null;
        for (StatementRecord record : records) {
            Instant at = record.executedAt();
            if (at == null) {
                continue;
            }
            if (first == null || at.isBefore(first)) {
                first = at;
            }
            if (last == null || at.isAfter(last)) {
                last = at;
            }
        }
        if (first == null) {
            return 0;
        }
        return Duration.between(first, last).toNanos() / 1_000_000_000.0;
    }

    /**
     * Computes a short, stable identifier for a normalized pattern.
     */
    public static String computeHash(String pattern) {
        return DigestUtils.md5Hex(pattern).substring(0, 16);
    }

    private static double totalTime(List<StatementRecord> records) {
        double total = 0;
        for (StatementRecord record : records) {
            total += record.durationSeconds();
        }
        return total;
    }

    private static PatternSummary toSummary(PatternGroup group) {
        return PatternSummary.builder()
            .hash(computeHash(group.getPattern()))
            .pattern(group.getPattern())
            .count(group.getCount())
            .totalTime(group.getTotalTime())
            .avgTime(group.getAvgTime())
            .maxTime(group.getMaxTime())
            .example(truncate(group.getExampleText()))
            .build();
    }

    private static SlowQueryExample toExample(StatementRecord record) {
        return SlowQueryExample.builder()
            .sequenceIndex(record.sequenceIndex())
            .durationMs(record.durationMs())
            .sql(truncate(record.text()))
            .origin(record.origin())
            .build();
    }

    static String truncate(String sql) {
        if (sql == null || sql.length() <= MAX_SQL_LENGTH) {
            return sql;
        }
        return sql.substring(0, MAX_SQL_LENGTH) + "...";
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
