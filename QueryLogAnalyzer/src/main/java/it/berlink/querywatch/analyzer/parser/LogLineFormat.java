package it.berlink.querywatch.analyzer.parser;

import java.util.Optional;

/**
 * One supported log line layout.
 */
public interface LogLineFormat {

    /**
     * Short identifier used in logs.
     */
    String name();

    /**
     * @param line a trimmed, non-blank log line
     * @return the statement, or empty if the line is not in this format
     */
    Optional<ParsedStatement> parse(String line);
}
