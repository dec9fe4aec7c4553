package it.berlink.querywatch.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A single structured event written by the live reporter.
 */
@Value
@Builder
public class ReportEvent {

    FlagType flagType;
    String scopeLabel;
    long count;
    double durationMs;
    String exampleSql;

    /** Threshold name to configured value, for every threshold that was exceeded. */
    @Singular
    Map<String, Number> thresholds;

    /** One line per offending statement or group, capped to the configured top-K. */
    @Singular
    List<String> details;
}
