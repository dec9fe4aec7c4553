package it.berlink.querywatch.analyzer.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.berlink.querywatch.analyzer.config.JacksonConfig;
import it.berlink.querywatch.analyzer.parser.QueryLogParser;
import it.berlink.querywatch.analyzer.parser.StatementLogReader;
import it.berlink.querywatch.analyzer.report.JsonReportFormatter;
import it.berlink.querywatch.analyzer.report.TextReportFormatter;
import it.berlink.querywatch.analyzer.service.BatchAnalyzer;
import it.berlink.querywatch.config.ThresholdConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnalyzeCommandTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();
    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private AnalyzeCommand command;
    private Path logFile;

    @BeforeEach
    void setUp() throws IOException {
        ThresholdConfig config = ThresholdConfig.defaults();
        command = new AnalyzeCommand(
            new StatementLogReader(QueryLogParser.withDefaultFormats(objectMapper)),
            new BatchAnalyzer(config),
            List.of(new TextReportFormatter(), new JsonReportFormatter(objectMapper)),
            config,
            new PrintStream(stdout, true, StandardCharsets.UTF_8),
            new PrintStream(stderr, true, StandardCharsets.UTF_8));

        logFile = tempDir.resolve("queries.log");
        Files.write(logFile, List.of(
            "[SQL] (0.012s) SELECT * FROM post",
            "[SQL] (0.250s) SELECT * FROM archive WHERE year = 2024",
            "garbage"));
    }

    @Test
    void printsTextReportToStdout() {
        int exit = command.execute(new DefaultApplicationArguments(logFile.toString()));

        assertEquals(0, exit);
        String text = stdout.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("Total queries: 2"));
        assertTrue(text.contains("Lines read: 3 (1 skipped)"));
    }

    @Test
    void writesJsonReportToOutputFile() throws IOException {
        Path output = tempDir.resolve("report.json");

        int exit = command.execute(new DefaultApplicationArguments(
            logFile.toString(), "--format=json", "--output=" + output, "--threshold=10"));

        assertEquals(0, exit);
        JsonNode json = objectMapper.readTree(Files.readString(output));
        assertEquals(2, json.get("totalQueries").asInt());
        assertEquals(2, json.get("slowQueries").get("count").asInt());
        assertEquals(10.0, json.get("slowQueries").get("thresholdMs").asDouble());
    }

    @Test
    void emptyLogIsSuccess() throws IOException {
        Path empty = Files.createFile(tempDir.resolve("empty.log"));

        assertEquals(0, command.execute(new DefaultApplicationArguments(empty.toString())));
        assertTrue(stdout.toString(StandardCharsets.UTF_8).contains("No SQL statements found in the log"));
    }

    @Test
    void missingLogFileFails() {
        int exit = command.execute(new DefaultApplicationArguments(tempDir.resolve("missing.log").toString()));

        assertEquals(1, exit);
        assertTrue(stderr.toString(StandardCharsets.UTF_8).contains("Log file not found"));
    }

    @Test
    void usageErrorsFail() {
        assertEquals(1, command.execute(new DefaultApplicationArguments()));
        assertTrue(stderr.toString(StandardCharsets.UTF_8).contains("Usage: query-log-analyzer"));

        assertEquals(1, command.execute(new DefaultApplicationArguments(logFile.toString(), "--threshold=abc")));
        assertEquals(1, command.execute(new DefaultApplicationArguments(logFile.toString(), "--threshold=-5")));
        assertEquals(1, command.execute(new DefaultApplicationArguments(logFile.toString(), "--top=0")));
        assertEquals(1, command.execute(new DefaultApplicationArguments(logFile.toString(), "--format=xml")));
        assertEquals(1, command.execute(new DefaultApplicationArguments(logFile.toString(), "other.log")));
    }

    @Test
    void writeFailureFails() {
        Path output = tempDir.resolve("missing-dir").resolve("report.txt");

        assertEquals(1, command.execute(new DefaultApplicationArguments(logFile.toString(), "--output=" + output)));
    }

    @Test
    void runRecordsExitCode() {
        command.run(new DefaultApplicationArguments());

        assertEquals(1, command.getExitCode());
    }
}
