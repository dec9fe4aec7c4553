package it.berlink.querywatch.analyzer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One normalized statement pattern and its aggregate timings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternSummary {

    /** First 16 hex chars of the MD5 of the pattern, stable across runs. */
    private String hash;
    private String pattern;
    private long count;
    private double totalTime;
    private double avgTime;
    private double maxTime;
    private String example;
}
