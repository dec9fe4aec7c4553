package it.berlink.querywatch.model;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregated statistics for one normalized statement pattern.
 */
@Value
@Builder
public class PatternGroup {

    String pattern;
    long count;
    double totalTime;
    double maxTime;
    String exampleText;

    public double getAvgTime() {
        return count == 0 ? 0 : totalTime / count;
    }

    public double getTotalTimeMs() {
        return totalTime * 1000.0;
    }

    public double getAvgTimeMs() {
        return getAvgTime() * 1000.0;
    }
}
