package it.berlink.querywatch.analyzer;

import it.berlink.querywatch.QueryWatchEngine;
import it.berlink.querywatch.analyzer.cli.AnalyzeCommand;
import it.berlink.querywatch.analyzer.parser.LogLineFormat;
import it.berlink.querywatch.analyzer.parser.QueryLogParser;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

/**
 * Started without a log file argument, so the command reports a usage error.
 */
@SpringBootTest
class QueryLogAnalyzerApplicationTest {

    @Autowired
    private QueryLogParser parser;

    @Autowired
    private AnalyzeCommand command;

    @Autowired
    private QueryWatchEngine engine;

    @Test
    void wiresFormatsInPrecedenceOrder() {
        assertEquals(
            List.of("json", "activejdbc", "pipe", "p6spy", "labelled", "slow-statement"),
            parser.getFormats().stream().map(LogLineFormat::name).toList());
    }

    @Test
    void missingArgumentsGiveErrorExitCode() {
        assertEquals(1, command.getExitCode());
    }

    @Test
    void liveMonitoringIsDisabled() {
        assertFalse(engine.isEnabled());
    }
}
