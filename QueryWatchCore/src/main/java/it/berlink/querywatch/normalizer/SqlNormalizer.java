package it.berlink.querywatch.normalizer;

import it.berlink.querywatch.config.ThresholdConfig;

import java.util.regex.Pattern;

/**
 * Normalizes a SQL statement by replacing literal values with placeholders,
 * so that statements differing only in their parameters share one pattern.
 *
 * Steps, each applied to the output of the previous one:
 * <ol>
 *   <li>quoted literals become {@code '?'} or {@code "?"}</li>
 *   <li>every run of digits becomes {@code ?}</li>
 *   <li>whitespace runs collapse to a single space, ends trimmed</li>
 *   <li>the result is cut to the maximum pattern length</li>
 * </ol>
 * Two statements that only differ past the cut share a pattern.
 */
public class SqlNormalizer {

    // A doubled quote inside a literal belongs to the literal
    private static final Pattern QUOTED_LITERAL = Pattern.compile(
        "'[^']*+(?:''[^']*+)*+'" +
        "|\"[^\"]*+(?:\"\"[^\"]*+)*+\""
    );

    private static final Pattern DIGIT_RUN = Pattern.compile("\\d+");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int maxPatternLength;

    public SqlNormalizer() {
        this(ThresholdConfig.DEFAULT_MAX_PATTERN_LENGTH);
    }

    public SqlNormalizer(int maxPatternLength) {
        if (maxPatternLength < 1) {
            throw new IllegalArgumentException("maxPatternLength must be >= 1, was " + maxPatternLength);
        }
        this.maxPatternLength = maxPatternLength;
    }

    public String normalize(String sql) {
        if (sql == null || sql.isEmpty()) {
            return "";
        }

        String normalized = QUOTED_LITERAL.matcher(sql)
            .replaceAll(match -> match.group().charAt(0) == '\'' ? "'?'" : "\"?\"");
        normalized = DIGIT_RUN.matcher(normalized).replaceAll("?");
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ").trim();

        if (normalized.length() > maxPatternLength) {
            normalized = normalized.substring(0, maxPatternLength);
        }
        return normalized;
    }

    public int getMaxPatternLength() {
        return maxPatternLength;
    }
}
