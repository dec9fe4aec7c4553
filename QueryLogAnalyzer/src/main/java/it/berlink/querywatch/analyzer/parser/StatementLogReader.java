package it.berlink.querywatch.analyzer.parser;

import it.berlink.querywatch.analyzer.exception.MalformedLogLineException;
import it.berlink.querywatch.analyzer.exception.ParseSourceUnavailableException;
import it.berlink.querywatch.model.StatementRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a whole log file into statement records, in file order.
 *
 * Unrecognized lines are skipped and counted. Blank lines are read but not
 * counted as skipped.
 */
@Slf4j
@Component
public class StatementLogReader {

    private final QueryLogParser parser;

    public StatementLogReader(QueryLogParser parser) {
        this.parser = parser;
    }

    public record ReadResult(String source, List<StatementRecord> records, long linesRead, long linesSkipped) {
    }

    /**
     * @throws ParseSourceUnavailableException if the file is missing or cannot be read
     */
    public ReadResult read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ParseSourceUnavailableException("Log file not found: " + path);
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(path.toString(), reader);
        } catch (IOException | UncheckedIOException e) {
            throw new ParseSourceUnavailableException("Cannot read log file " + path + ": " + e.getMessage(), e);
        }
    }

    ReadResult read(String source, BufferedReader reader) throws IOException {
        List<StatementRecord> records = new ArrayList<>();
        long linesRead = 0;
        long linesSkipped = 0;

        String line;
        while ((line = reader.readLine()) != null) {
            linesRead++;
            if (line.isBlank()) {
                continue;
            }
            try {
                ParsedStatement statement = parser.parseLine(line);
                records.add(new StatementRecord(statement.sql(), statement.durationSeconds(), records.size(),
                    statement.timestamp(), statement.origin()));
            } catch (MalformedLogLineException e) {
                linesSkipped++;
                log.trace("Skipping line {}: {}", linesRead, e.getMessage());
            }
        }

        log.info("Read {} line(s) from {}: {} statement(s), {} skipped", linesRead, source, records.size(), linesSkipped);
        return new ReadResult(source, records, linesRead, linesSkipped);
    }
}
