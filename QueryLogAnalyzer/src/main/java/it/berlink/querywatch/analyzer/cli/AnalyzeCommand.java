package it.berlink.querywatch.analyzer.cli;

import it.berlink.querywatch.analyzer.exception.ParseSourceUnavailableException;
import it.berlink.querywatch.analyzer.model.AnalysisReport;
import it.berlink.querywatch.analyzer.parser.StatementLogReader;
import it.berlink.querywatch.analyzer.report.ReportFormat;
import it.berlink.querywatch.analyzer.report.ReportFormatter;
import it.berlink.querywatch.analyzer.service.BatchAnalyzer;
import it.berlink.querywatch.config.ThresholdConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * query-log-analyzer &lt;log-file&gt; [--threshold=&lt;ms&gt;] [--output=&lt;file&gt;] [--format=text|json] [--top=&lt;n&gt;]
 *
 * Exit code 0 on success, 1 on a usage error, an unreadable log or a failed write.
 */
@Slf4j
@Component
public class AnalyzeCommand implements ApplicationRunner, ExitCodeGenerator {

    static final String USAGE =
        "Usage: query-log-analyzer <log-file> [--threshold=<ms>] [--output=<file>] [--format=text|json] [--top=<n>]";

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;

    private final StatementLogReader reader;
    private final BatchAnalyzer analyzer;
    private final Map<ReportFormat, ReportFormatter> formatters = new EnumMap<>(ReportFormat.class);
    private final ThresholdConfig config;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode = EXIT_OK;

    @Autowired
    public AnalyzeCommand(StatementLogReader reader, BatchAnalyzer analyzer, List<ReportFormatter> formatters,
                          ThresholdConfig config) {
        this(reader, analyzer, formatters, config, System.out, System.err);
    }

    AnalyzeCommand(StatementLogReader reader, BatchAnalyzer analyzer, List<ReportFormatter> formatters,
                   ThresholdConfig config, PrintStream out, PrintStream err) {
        this.reader = reader;
        this.analyzer = analyzer;
        this.config = config;
        this.out = out;
        this.err = err;
        for (ReportFormatter formatter : formatters) {
            this.formatters.put(formatter.format(), formatter);
        }
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        Options options;
        try {
            options = Options.parse(args, config);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_ERROR;
        }

        ReportFormatter formatter = formatters.get(options.format());
        if (formatter == null) {
            err.println("No formatter available for " + options.format());
            return EXIT_ERROR;
        }

        try {
            StatementLogReader.ReadResult source = reader.read(options.logFile());
            AnalysisReport report = analyzer.analyze(source, options.thresholdMs(), options.top());
            String rendered = formatter.render(report);

            if (options.output() == null) {
                out.print(rendered);
                out.flush();
            } else {
                Files.writeString(options.output(), rendered, StandardCharsets.UTF_8);
                log.info("Report written to {}", options.output());
            }
            return EXIT_OK;
        } catch (ParseSourceUnavailableException e) {
            log.error("Cannot analyze log: {}", e.getMessage());
            err.println(e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            log.error("Failed to write report to {}: {}", options.output(), e.getMessage());
            err.println("Failed to write report: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    record Options(Path logFile, double thresholdMs, Path output, ReportFormat format, int top) {

        static Options parse(ApplicationArguments args, ThresholdConfig config) {
            List<String> files = args.getNonOptionArgs();
            if (files.isEmpty()) {
                throw new IllegalArgumentException("Missing log file");
            }
            if (files.size() > 1) {
                throw new IllegalArgumentException("Expected one log file, got " + files.size());
            }

            double thresholdMs = config.getSlowStatementMs();
            String threshold = single(args, "threshold");
            if (threshold != null) {
                try {
                    thresholdMs = Double.parseDouble(threshold);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid --threshold: " + threshold, e);
                }
                if (Double.isNaN(thresholdMs) || thresholdMs < 0) {
                    throw new IllegalArgumentException("--threshold must be >= 0, was " + threshold);
                }
            }

            int top = config.getTopK();
            String topValue = single(args, "top");
            if (topValue != null) {
                try {
                    top = Integer.parseInt(topValue);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid --top: " + topValue, e);
                }
                if (top < 1) {
                    throw new IllegalArgumentException("--top must be >= 1, was " + topValue);
                }
            }

            String format = single(args, "format");
            String output = single(args, "output");
            return new Options(
                Path.of(files.get(0)),
                thresholdMs,
                output == null || output.isBlank() ? null : Path.of(output),
                format == null ? ReportFormat.TEXT : ReportFormat.fromName(format),
                top);
        }

        private static String single(ApplicationArguments args, String name) {
            List<String> values = args.getOptionValues(name);
            if (values == null || values.isEmpty()) {
                return null;
            }
            if (values.size() > 1) {
                throw new IllegalArgumentException("--" + name + " given more than once");
            }
            return values.get(0);
        }
    }
}
