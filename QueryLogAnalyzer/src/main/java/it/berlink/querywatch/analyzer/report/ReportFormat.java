package it.berlink.querywatch.analyzer.report;

import java.util.Locale;

public enum ReportFormat {
    TEXT,
    JSON;

    /**
     * @throws IllegalArgumentException for an unknown format name
     */
    public static ReportFormat fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown report format '" + name + "', expected text or json", e);
        }
    }
}
