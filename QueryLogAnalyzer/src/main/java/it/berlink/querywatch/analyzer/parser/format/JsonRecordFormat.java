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

import java.time.Instant;
import java.util.Optional;

/**
 * One JSON object per line:
 * {"sql": "SELECT ...", "time": 0.012, "timestamp": "2026-01-25T16:55:10.891Z"}
 *
 * {@code time} is in seconds and may be a number or a numeric string.
 * {@code duration_ms} and {@code duration_millis} are accepted in milliseconds.
 */
@Slf4j
@Component
@Order(1)
public class JsonRecordFormat implements LogLineFormat {

    private final ObjectMapper objectMapper;

    public JsonRecordFormat(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "json";
    }

    @Override
    public Optional<ParsedStatement> parse(String line) {
        if (!line.startsWith("{") || !line.endsWith("}")) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(line);
            String sql = node.path("sql").asText(null);
            if (sql == null || sql.isBlank()) {
                return Optional.empty();
            }
            Double seconds = durationSeconds(node);
            if (seconds == null) {
                log.trace("No duration in JSON record: {}", line);
                return Optional.empty();
            }
            return Optional.of(new ParsedStatement(sql.trim(), seconds, timestamp(node),
                node.path("origin").asText(null)));
        } catch (JsonProcessingException e) {
            log.trace("Not a JSON record: {} - Error: {}", line, e.getMessage());
            return Optional.empty();
        }
    }

    private static Double durationSeconds(JsonNode node) {
        if (node.hasNonNull("time")) {
            return numeric(node.get("time"));
        }
        if (node.hasNonNull("duration_ms")) {
            return millis(numeric(node.get("duration_ms")));
        }
        if (node.hasNonNull("duration_millis")) {
            return millis(numeric(node.get("duration_millis")));
        }
        return null;
    }

    private static Double millis(Double value) {
        return value == null ? null : value / 1000.0;
    }

    // Numbers or numeric text only; asDouble() would read "n/a" as 0.0
    private static Double numeric(JsonNode value) {
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (!value.isTextual()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value.textValue().trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Instant timestamp(JsonNode node) {
        String value = node.path("timestamp").asText(null);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LogTimestamps.parse(value);
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring unreadable timestamp {}", value);
            return null;
        }
    }
}
