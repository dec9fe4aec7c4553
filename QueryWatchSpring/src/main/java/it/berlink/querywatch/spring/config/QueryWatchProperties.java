package it.berlink.querywatch.spring.config;

import it.berlink.querywatch.config.ThresholdConfig;
import it.berlink.querywatch.log.InMemoryStatementLog;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed binding for the querywatch.* configuration.
 */
@Data
@ConfigurationProperties(prefix = "querywatch")
public class QueryWatchProperties {

    /** Turns live scope reporting on or off. */
    private boolean enabled = true;

    /** A statement slower than this is reported as slow. */
    private double slowStatementMs = ThresholdConfig.DEFAULT_SLOW_STATEMENT_MS;

    /** A pattern repeated more often than this within one scope is an N+1 suspect. */
    private int scopeStatementCountThreshold = ThresholdConfig.DEFAULT_SCOPE_STATEMENT_COUNT_THRESHOLD;

    /** A scope slower than slowStatementMs times this factor is reported as slow. */
    private double slowScopeMultiplier = ThresholdConfig.DEFAULT_SLOW_SCOPE_MULTIPLIER;

    /** Smallest group of cheap, identical statements reported as an N+1 suspect. */
    private int minGroupSizeForNPlusOne = ThresholdConfig.DEFAULT_MIN_GROUP_SIZE_FOR_N_PLUS_ONE;

    /** Average duration under which a repeated statement counts as cheap. */
    private double cheapStatementMs = ThresholdConfig.DEFAULT_CHEAP_STATEMENT_MS;

    /** Maximum offending statements or groups listed per event. */
    private int topK = ThresholdConfig.DEFAULT_TOP_K;

    /** Normalized patterns are cut to this length. */
    private int maxPatternLength = ThresholdConfig.DEFAULT_MAX_PATTERN_LENGTH;

    /** Request paths starting with one of these are not monitored. */
    private List<String> ignoredPathPrefixes = new ArrayList<>(List.of("/static/", "/media/", "/favicon.ico"));

    /** Adds X-DB-Query-Count and X-DB-Query-Time to monitored responses. */
    private boolean exposeHeaders = false;

    /** Maximum statements held per thread between two requests. */
    private int logCapacity = InMemoryStatementLog.DEFAULT_CAPACITY;

    public ThresholdConfig toThresholdConfig() {
        return ThresholdConfig.builder()
            .slowStatementMs(slowStatementMs)
            .scopeStatementCountThreshold(scopeStatementCountThreshold)
            .slowScopeMultiplier(slowScopeMultiplier)
            .minGroupSizeForNPlusOne(minGroupSizeForNPlusOne)
            .cheapStatementMs(cheapStatementMs)
            .topK(topK)
            .maxPatternLength(maxPatternLength)
            .build();
    }
}
