package it.berlink.querywatch.reporter;

import it.berlink.querywatch.config.ThresholdConfig;
import it.berlink.querywatch.model.Classification;
import it.berlink.querywatch.model.FlagType;
import it.berlink.querywatch.model.PatternGroup;
import it.berlink.querywatch.model.ReportEvent;
import it.berlink.querywatch.model.ScopeReport;
import it.berlink.querywatch.model.StatementRecord;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.spi.LoggingEventBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes one structured log event per flag raised on a scope.
 *
 * Offending statements and groups are capped to the configured top-K. All N+1
 * suspects of a scope go into a single event, whatever their number.
 *
 * Slow statement lines have the form {@code Slow statement [42] 0.150s: SELECT ...},
 * which the batch analyzer reads back.
 */
@Slf4j
public class LiveReporter {

    static final int MAX_SQL_LENGTH = 500;

    private final ThresholdConfig config;

    public LiveReporter(ThresholdConfig config) {
        this.config = config;
    }

    /**
     * Logs the report and returns the events that were written, in flag order.
     */
    public List<ReportEvent> report(ScopeReport report) {
        logSummary(report);

        Classification classification = report.getClassification();
        List<ReportEvent> events = new ArrayList<>(3);

        if (classification.isSlowStatements()) {
            events.add(slowStatementEvent(report));
        }
        if (classification.isSuspectedNPlusOne()) {
            events.add(nPlusOneEvent(report));
            if (log.isDebugEnabled()) {
                log.debug("Statement breakdown for {}: {}", report.getLabel(), report.getStatementTypes());
            }
        }
        if (classification.isSlowScope()) {
            events.add(slowScopeEvent(report));
        }

        events.forEach(this::emit);
        return events;
    }

    private void logSummary(ScopeReport report) {
        if (report.getTotalStatementCount() == 0) {
            return;
        }
        log.atInfo()
            .addKeyValue("scope_label", report.getLabel())
            .addKeyValue("count", report.getTotalStatementCount())
            .addKeyValue("duration_ms", round(report.getElapsedSeconds() * 1000.0))
            .addKeyValue("statement_time_ms", round(report.getTotalTime() * 1000.0))
            .log("{} statements in {} ms for {}",
                report.getTotalStatementCount(),
                formatMs(report.getElapsedSeconds() * 1000.0),
                report.getLabel());
    }

    private ReportEvent slowStatementEvent(ScopeReport report) {
        List<StatementRecord> slow = report.getClassification().getSlowStatementRecords();
        StatementRecord slowest = slow.get(0);

        ReportEvent.ReportEventBuilder event = ReportEvent.builder()
            .flagType(FlagType.SLOW_STATEMENT)
            .scopeLabel(report.getLabel())
            .count(slow.size())
            .durationMs(round(slowest.durationMs()))
            .exampleSql(truncate(slowest.text()))
            .threshold("slow_statement_ms", config.getSlowStatementMs());

        slow.stream()
            .limit(config.getTopK())
            .forEach(r -> event.detail(String.format(Locale.ROOT, "Slow statement [%d] %.3fs: %s",
                r.sequenceIndex(), r.durationSeconds(), truncate(r.text()))));

        return event.build();
    }

    private ReportEvent nPlusOneEvent(ScopeReport report) {
        List<PatternGroup> suspects = report.getClassification().getSuspectedGroups();

        long statements = 0;
        double totalMs = 0;
        for (PatternGroup group : suspects) {
            statements += group.getCount();
            totalMs += group.getTotalTimeMs();
        }

        ReportEvent.ReportEventBuilder event = ReportEvent.builder()
            .flagType(FlagType.N_PLUS_ONE)
            .scopeLabel(report.getLabel())
            .count(statements)
            .durationMs(round(totalMs))
            .exampleSql(truncate(suspects.get(0).getExampleText()))
            .threshold("scope_statement_count_threshold", config.getScopeStatementCountThreshold())
            .threshold("min_group_size_for_n_plus_one", config.getMinGroupSizeForNPlusOne())
            .threshold("cheap_statement_ms", config.getCheapStatementMs());

        suspects.stream()
            .limit(config.getTopK())
            .forEach(g -> event.detail(String.format(Locale.ROOT, "%dx avg %.2fms total %.2fms: %s",
                g.getCount(), g.getAvgTimeMs(), g.getTotalTimeMs(), truncate(g.getExampleText()))));

        return event.build();
    }

    private ReportEvent slowScopeEvent(ScopeReport report) {
        List<PatternGroup> groups = report.getGroups();

        ReportEvent.ReportEventBuilder event = ReportEvent.builder()
            .flagType(FlagType.SLOW_SCOPE)
            .scopeLabel(report.getLabel())
            .count(report.getTotalStatementCount())
            .durationMs(round(report.getElapsedSeconds() * 1000.0))
            .exampleSql(groups.isEmpty() ? null : truncate(groups.get(0).getExampleText()))
            .threshold("slow_statement_ms", config.getSlowStatementMs())
            .threshold("slow_scope_multiplier", config.getSlowScopeMultiplier());

        groups.stream()
            .limit(config.getTopK())
            .forEach(g -> event.detail(String.format(Locale.ROOT, "%dx total %.2fms: %s",
                g.getCount(), g.getTotalTimeMs(), truncate(g.getExampleText()))));

        return event.build();
    }

    private void emit(ReportEvent event) {
        LoggingEventBuilder builder = log.atWarn()
            .addKeyValue("scope_label", event.getScopeLabel())
            .addKeyValue("flag_type", event.getFlagType().key())
            .addKeyValue("count", event.getCount())
            .addKeyValue("duration_ms", event.getDurationMs())
            .addKeyValue("example_sql", event.getExampleSql());
        for (Map.Entry<String, Number> threshold : event.getThresholds().entrySet()) {
            builder = builder.addKeyValue(threshold.getKey(), threshold.getValue());
        }
        builder.log(message(event));
    }

    private String message(ReportEvent event) {
        StringBuilder sb = new StringBuilder();
        switch (event.getFlagType()) {
            case SLOW_STATEMENT -> sb.append("Slow statements detected in ").append(event.getScopeLabel())
                .append(": ").append(event.getCount()).append(" over ")
                .append(formatMs(config.getSlowStatementMs())).append(" ms");
            case N_PLUS_ONE -> sb.append("Possible N+1 detected in ").append(event.getScopeLabel())
                .append(": ").append(event.getCount()).append(" repeated statements");
            case SLOW_SCOPE -> sb.append("Slow scope ").append(event.getScopeLabel())
                .append(": ").append(formatMs(event.getDurationMs())).append(" ms with ")
                .append(event.getCount()).append(" statements");
        }
        for (String detail : event.getDetails()) {
            sb.append(System.lineSeparator()).append("  ").append(detail);
        }
        return sb.toString();
    }

    static String truncate(String sql) {
        if (sql == null || sql.length() <= MAX_SQL_LENGTH) {
            return sql;
        }
        return sql.substring(0, MAX_SQL_LENGTH) + "...";
    }

    private static double round(double ms) {
        return Math.round(ms * 100.0) / 100.0;
    }

    private static String formatMs(double ms) {
        return String.format(Locale.ROOT, "%.2f", ms);
    }
}
