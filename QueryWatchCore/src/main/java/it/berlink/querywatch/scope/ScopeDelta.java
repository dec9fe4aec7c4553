package it.berlink.querywatch.scope;

import it.berlink.querywatch.model.StatementRecord;

import java.util.List;

/**
 * Statements executed between the begin and end of a scope.
 */
public record ScopeDelta(String label, List<StatementRecord> records, double elapsedSeconds) {
}
