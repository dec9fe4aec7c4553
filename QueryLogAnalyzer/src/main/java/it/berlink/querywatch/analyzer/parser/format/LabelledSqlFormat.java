package it.berlink.querywatch.analyzer.parser.format;

import it.berlink.querywatch.analyzer.parser.LogLineFormat;
import it.berlink.querywatch.analyzer.parser.ParsedStatement;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * [SQL] (0.012s) SELECT * FROM post
 */
@Component
@Order(5)
public class LabelledSqlFormat implements LogLineFormat {

    private static final Pattern LINE_PATTERN = Pattern.compile("\\[SQL]\\s*\\((\\d+(?:\\.\\d+)?)s\\)\\s*(.+)$");

    @Override
    public String name() {
        return "labelled";
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
