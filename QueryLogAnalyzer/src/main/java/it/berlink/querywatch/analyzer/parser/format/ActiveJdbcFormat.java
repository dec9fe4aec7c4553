package it.berlink.querywatch.analyzer.parser.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.berlink.querywatch.analyzer.parser.LogLineFormat;
import it.berlink.querywatch.analyzer.parser.LogTimestamps;
import it.berlink.querywatch.analyzer.parser.ParsedStatement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ActiveJDBC statement logging:
 * 2026-01-25 16:55:10.891 INFO  [823552] [OperationService.getAllOperations] org.javalite.activejdbc.LazyList - {"sql":"SELECT ...","params":[4],"duration_millis":1,"cache":"miss"}
 */
@Slf4j
@Component
@Order(2)
public class ActiveJdbcFormat implements LogLineFormat {

    // TIMESTAMP LEVEL [THREAD] [METHOD] LOGGER - JSON
    private static final Pattern LINE_PATTERN = Pattern.compile(
        "^(\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}\\.\\d{3})" +  // timestamp (group 1)
        "\\s+\\w+" +                                                // log level
        "\\s+\\[\\d+\\]" +                                          // thread id
        "\\s+\\[([^\\]]+)\\]" +                                     // method (group 2)
        ".* - " +                                                   // logger name + separator
        "(\\{.+\\})$"                                               // JSON payload (group 3)
    );

    private final ObjectMapper objectMapper;

    public ActiveJdbcFormat(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "activejdbc";
    }

    @Override
    public Optional<ParsedStatement> parse(String line) {
        Matcher matcher = LINE_PATTERN.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            JsonNode payload = objectMapper.readTree(matcher.group(3));
            String sql = payload.path("sql").asText(null);
            if (sql == null || sql.isBlank()) {
                log.trace("No SQL found in JSON payload: {}", matcher.group(3));
                return Optional.empty();
            }
            double durationMs = payload.path("duration_millis").asDouble(0);
            return Optional.of(new ParsedStatement(sql.trim(), durationMs / 1000.0,
                LogTimestamps.parse(matcher.group(1)), matcher.group(2)));
        } catch (JsonProcessingException e) {
            log.trace("Failed to parse JSON in ActiveJDBC log: {} - Error: {}", line, e.getMessage());
            return Optional.empty();
        }
    }
}
