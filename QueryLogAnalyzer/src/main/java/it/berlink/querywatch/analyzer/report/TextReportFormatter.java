package it.berlink.querywatch.analyzer.report;

import it.berlink.querywatch.analyzer.model.AnalysisReport;
import it.berlink.querywatch.analyzer.model.PatternSummary;
import it.berlink.querywatch.analyzer.model.SlowQueryExample;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Human readable report for the console.
 */
@Component
public class TextReportFormatter implements ReportFormatter {

    static final int MAX_LISTED = 5;
    private static final String RULE = "=".repeat(50);

    @Override
    public ReportFormat format() {
        return ReportFormat.TEXT;
    }

    @Override
    public String render(AnalysisReport report) {
        StringBuilder out = new StringBuilder();
        line(out, RULE);
        line(out, "DATABASE QUERY REPORT");
        line(out, RULE);
        line(out, "Source: %s", report.getSource());
        line(out, "Lines read: %d (%d skipped)", report.getLinesRead(), report.getLinesSkipped());
        line(out, "Total queries: %d", report.getTotalQueries());
        line(out, "Total query time: %.4f seconds", report.getTotalTime());
        line(out, "Average query time: %.4f seconds", report.getAverageQueryTime());
        line(out, "Queries per second: %.2f", report.getQueriesPerSecond());

        if (report.getSlowQueries() != null && report.getSlowQueries().getCount() > 0) {
            line(out, "");
            line(out, "Slow queries (> %.0f ms): %d (%.2f%%)", report.getSlowQueries().getThresholdMs(),
                report.getSlowQueries().getCount(), report.getSlowQueries().getPercent());
            report.getSlowQueries().getTopExamples().stream()
                .limit(MAX_LISTED)
                .forEach(example -> line(out, "  - %.2f ms: %s", example.getDurationMs(), describe(example)));
        }

        if (report.getQueryPatterns() != null && !report.getQueryPatterns().isEmpty()) {
            line(out, "");
            line(out, "Top query patterns:");
            report.getQueryPatterns().stream()
                .limit(MAX_LISTED)
                .forEach(pattern -> describe(out, pattern));
        }

        if (report.getNPlusOneCandidates() != null && !report.getNPlusOneCandidates().isEmpty()) {
            line(out, "");
            line(out, "Possible N+1 patterns:");
            report.getNPlusOneCandidates().stream()
                .limit(MAX_LISTED)
                .forEach(pattern -> describe(out, pattern));
        }

        line(out, "");
        line(out, "Recommendations:");
        report.getRecommendations().forEach(recommendation -> line(out, "  - %s", recommendation));
        line(out, RULE);
        return out.toString();
    }

    private static void describe(StringBuilder out, PatternSummary pattern) {
        line(out, "  - [%s] Count: %d, Total: %.4fs, Avg: %.4fs", pattern.getHash(), pattern.getCount(),
            pattern.getTotalTime(), pattern.getAvgTime());
        line(out, "    Example: %s", pattern.getExample());
    }

    private static String describe(SlowQueryExample example) {
        return example.getOrigin() == null ? example.getSql() : example.getSql() + " (" + example.getOrigin() + ")";
    }

    private static void line(StringBuilder out, String format, Object... args) {
        out.append(args.length == 0 ? format : String.format(Locale.ROOT, format, args)).append(System.lineSeparator());
    }
}
