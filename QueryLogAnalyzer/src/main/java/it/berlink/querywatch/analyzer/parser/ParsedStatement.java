package it.berlink.querywatch.analyzer.parser;

import java.time.Instant;

/**
 * A statement extracted from one log line.
 *
 * @param timestamp when the statement ran, null if the format carries no timestamp
 * @param origin    calling method or class when the format records it, otherwise null
 */
public record ParsedStatement(String sql, double durationSeconds, Instant timestamp, String origin) {
}
