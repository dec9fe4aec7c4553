package it.berlink.querywatch.model;

import java.time.Instant;

/**
 * One executed database statement, as captured by the driver or parsed from a log line.
 *
 * @param text            raw statement text
 * @param durationSeconds wall time spent executing the statement
 * @param sequenceIndex   capture order, unique within the process
 * @param executedAt      execution time, null when the source does not carry one
 * @param origin          calling method or component, null when unknown
 */
public record StatementRecord(
    String text,
    double durationSeconds,
    long sequenceIndex,
    Instant executedAt,
    String origin
) {

    public StatementRecord {
        if (durationSeconds < 0 || Double.isNaN(durationSeconds)) {
            throw new IllegalArgumentException("durationSeconds must be >= 0, was " + durationSeconds);
        }
    }

    public StatementRecord(String text, double durationSeconds, long sequenceIndex) {
        this(text, durationSeconds, sequenceIndex, null, null);
    }

    public double durationMs() {
        return durationSeconds * 1000.0;
    }
}
