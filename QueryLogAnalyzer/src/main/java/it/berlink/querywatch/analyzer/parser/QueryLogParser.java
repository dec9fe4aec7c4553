package it.berlink.querywatch.analyzer.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.berlink.querywatch.analyzer.exception.MalformedLogLineException;
import it.berlink.querywatch.analyzer.parser.format.ActiveJdbcFormat;
import it.berlink.querywatch.analyzer.parser.format.JsonRecordFormat;
import it.berlink.querywatch.analyzer.parser.format.LabelledSqlFormat;
import it.berlink.querywatch.analyzer.parser.format.P6SpyFormat;
import it.berlink.querywatch.analyzer.parser.format.PipeDelimitedFormat;
import it.berlink.querywatch.analyzer.parser.format.SlowStatementFormat;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Parses log lines containing SQL statement execution information.
 *
 * Spring injects the formats ordered by @Order; the first one that recognizes
 * a line wins.
 */
@Slf4j
@Component
public class QueryLogParser {

    private final List<LogLineFormat> formats;

    public QueryLogParser(List<LogLineFormat> formats) {
        this.formats = List.copyOf(formats);
    }

    /**
     * Parser with every built-in format in precedence order.
     */
    public static QueryLogParser withDefaultFormats(ObjectMapper objectMapper) {
        return new QueryLogParser(List.of(
            new JsonRecordFormat(objectMapper),
            new ActiveJdbcFormat(objectMapper),
            new PipeDelimitedFormat(),
            new P6SpyFormat(),
            new LabelledSqlFormat(),
            new SlowStatementFormat()));
    }

    @PostConstruct
    public void init() {
        log.info("Registered {} log line format(s):", formats.size());
        for (LogLineFormat format : formats) {
            log.info("  - {}", format.name());
        }
    }

    /**
     * Parses a single log line.
     *
     * @throws MalformedLogLineException if no format recognizes the line
     */
    public ParsedStatement parseLine(String line) {
        if (line == null || line.isBlank()) {
            throw new MalformedLogLineException("Blank log line");
        }
        String trimmedLine = line.trim();

        for (LogLineFormat format : formats) {
            Optional<ParsedStatement> parsed;
            try {
                parsed = format.parse(trimmedLine);
            } catch (RuntimeException e) {
                log.trace("Format {} rejected line: {} - Error: {}", format.name(), trimmedLine, e.getMessage());
                continue;
            }
            if (parsed.isPresent()) {
                ParsedStatement statement = parsed.get();
                if (Double.isNaN(statement.durationSeconds()) || statement.durationSeconds() < 0) {
                    throw new MalformedLogLineException(
                        "Invalid duration " + statement.durationSeconds() + " in line: " + abbreviate(trimmedLine));
                }
                return statement;
            }
        }
        throw new MalformedLogLineException("No known format matches line: " + abbreviate(trimmedLine));
    }

    /**
     * Like {@link #parseLine} but returns empty instead of throwing.
     */
    public Optional<ParsedStatement> parse(String line) {
        try {
            return Optional.of(parseLine(line));
        } catch (MalformedLogLineException e) {
            log.trace(e.getMessage());
            return Optional.empty();
        }
    }

    public List<LogLineFormat> getFormats() {
        return formats;
    }

    private static String abbreviate(String line) {
        return line.length() > 120 ? line.substring(0, 120) + "..." : line;
    }
}
