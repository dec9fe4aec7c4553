package it.berlink.querywatch.analyzer.report;

import it.berlink.querywatch.analyzer.model.AnalysisReport;

/**
 * Renders an analysis report in one output format.
 */
public interface ReportFormatter {

    ReportFormat format();

    String render(AnalysisReport report);
}
