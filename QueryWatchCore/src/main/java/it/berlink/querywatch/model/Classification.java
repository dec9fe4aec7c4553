package it.berlink.querywatch.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Flags raised for a scope or batch window, with the records and groups that raised them.
 */
@Value
@Builder
public class Classification {

    boolean slowStatements;
    boolean suspectedNPlusOne;
    boolean slowScope;

    /** Statements over the slow threshold, slowest first. */
    @Singular
    List<StatementRecord> slowStatementRecords;

    /** Groups matching the N+1 rule, in aggregation order. */
    @Singular
    List<PatternGroup> suspectedGroups;

    double scopeSeconds;

    public Set<FlagType> getFlags() {
        Set<FlagType> flags = EnumSet.noneOf(FlagType.class);
        if (slowStatements) {
            flags.add(FlagType.SLOW_STATEMENT);
        }
        if (suspectedNPlusOne) {
            flags.add(FlagType.N_PLUS_ONE);
        }
        if (slowScope) {
            flags.add(FlagType.SLOW_SCOPE);
        }
        return flags;
    }

    public boolean isClean() {
        return !slowStatements && !suspectedNPlusOne && !slowScope;
    }
}
