package it.berlink.querywatch.analyzer.parser.format;

import it.berlink.querywatch.analyzer.parser.LogLineFormat;
import it.berlink.querywatch.analyzer.parser.ParsedStatement;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Slow statement lines written by the live reporter, so that application logs
 * can be fed back into the analyzer:
 * Slow statement [3] 0.150s: SELECT * FROM post WHERE id = 7
 */
@Component
@Order(6)
public class SlowStatementFormat implements LogLineFormat {

    private static final Pattern LINE_PATTERN =
        Pattern.compile("Slow statement \\[\\d+] (\\d+(?:\\.\\d+)?)s: (.+)$");

    @Override
    public String name() {
        return "slow-statement";
    }

    @Override
    public Optional<ParsedStatement> parse(String line) {
        Matcher matcher = LINE_PATTERN.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new ParsedStatement(matcher.group(2).trim(), Double.parseDouble(matcher.group(1)), null, null));
    }
}
