package it.berlink.querywatch.analyzer.parser.format;

import it.berlink.querywatch.analyzer.parser.LogLineFormat;
import it.berlink.querywatch.analyzer.parser.LogTimestamps;
import it.berlink.querywatch.analyzer.parser.ParsedStatement;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 2025-01-24 10:15:32.456 | SELECT * FROM users WHERE id = ? | 45ms | rows:1
 */
@Component
@Order(3)
public class PipeDelimitedFormat implements LogLineFormat {

    private static final Pattern LINE_PATTERN = Pattern.compile(
        "^(\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}(?:\\.\\d{1,3})?)\\s*\\|\\s*(.+?)\\s*\\|\\s*(\\d+(?:\\.\\d+)?)\\s*ms\\s*(?:\\|\\s*rows?:\\s*(\\d+))?$"
    );

    @Override
    public String name() {
        return "pipe";
    }

    @Override
    public Optional<ParsedStatement> parse(String line) {
        Matcher matcher = LINE_PATTERN.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        double durationMs = Double.parseDouble(matcher.group(3));
        return Optional.of(new ParsedStatement(matcher.group(2), durationMs / 1000.0,
            LogTimestamps.parse(matcher.group(1)), null));
    }
}
