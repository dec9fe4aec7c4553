package it.berlink.querywatch.analyzer.parser.format;

import it.berlink.querywatch.analyzer.parser.LogLineFormat;
import it.berlink.querywatch.analyzer.parser.ParsedStatement;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * P6Spy single-line layout, possibly behind a logger prefix:
 * [Time: 3 ms][Caller: com.acme.PostRepository#findById:47][SQL: select * from post where id=7]
 */
@Component
@Order(4)
public class P6SpyFormat implements LogLineFormat {

    private static final Pattern LINE_PATTERN = Pattern.compile(
        "\\[Time: (\\d+(?:\\.\\d+)?) ms]\\[Caller: ([^\\]]*)]\\[SQL: (.+)]$"
    );

    @Override
    public String name() {
        return "p6spy";
    }

    @Override
    public Optional<ParsedStatement> parse(String line) {
        Matcher matcher = LINE_PATTERN.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String sql = matcher.group(3).trim();
        if (sql.isEmpty()) {
            return Optional.empty();
        }
        String caller = matcher.group(2).isBlank() ? null : matcher.group(2).trim();
        return Optional.of(new ParsedStatement(sql, Double.parseDouble(matcher.group(1)) / 1000.0, null, caller));
    }
}
