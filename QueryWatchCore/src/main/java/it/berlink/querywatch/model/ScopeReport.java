package it.berlink.querywatch.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of closing a scope: what ran inside it and which flags it raised.
 */
@Value
@Builder
public class ScopeReport {

    String label;
    int totalStatementCount;

    /** Sum of statement durations, in seconds. */
    double totalTime;

    /** Wall clock time between begin and end, in seconds. */
    double elapsedSeconds;

    @Singular
    List<PatternGroup> groups;

    Classification classification;

    /** Statement count per leading SQL keyword. */
    @Singular
    Map<String, Integer> statementTypes;

    public boolean isSlowStatements() {
        return classification.isSlowStatements();
    }

    public boolean isSuspectedNPlusOne() {
        return classification.isSuspectedNPlusOne();
    }

    public boolean isSlowScope() {
        return classification.isSlowScope();
    }
}
