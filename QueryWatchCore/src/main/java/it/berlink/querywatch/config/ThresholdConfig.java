package it.berlink.querywatch.config;

import lombok.Getter;
import lombok.ToString;

/**
 * Classification thresholds. Built once at startup and shared read-only afterwards.
 */
@Getter
@ToString
public final class ThresholdConfig {

    public static final double DEFAULT_SLOW_STATEMENT_MS = 100;
    public static final int DEFAULT_SCOPE_STATEMENT_COUNT_THRESHOLD = 20;
    public static final double DEFAULT_SLOW_SCOPE_MULTIPLIER = 2.0;
    public static final int DEFAULT_MIN_GROUP_SIZE_FOR_N_PLUS_ONE = 3;
    public static final double DEFAULT_CHEAP_STATEMENT_MS = 10;
    public static final int DEFAULT_TOP_K = 10;
    public static final int DEFAULT_MAX_PATTERN_LENGTH = 150;

    private static final ThresholdConfig DEFAULTS = builder().build();

    private final double slowStatementMs;
    private final int scopeStatementCountThreshold;
    private final double slowScopeMultiplier;
    private final int minGroupSizeForNPlusOne;
    private final double cheapStatementMs;
    private final int topK;
    private final int maxPatternLength;

    private ThresholdConfig(Builder builder) {
        this.slowStatementMs = builder.slowStatementMs;
        this.scopeStatementCountThreshold = builder.scopeStatementCountThreshold;
        this.slowScopeMultiplier = builder.slowScopeMultiplier;
        this.minGroupSizeForNPlusOne = builder.minGroupSizeForNPlusOne;
        this.cheapStatementMs = builder.cheapStatementMs;
        this.topK = builder.topK;
        this.maxPatternLength = builder.maxPatternLength;
    }

    public static ThresholdConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .slowStatementMs(slowStatementMs)
            .scopeStatementCountThreshold(scopeStatementCountThreshold)
            .slowScopeMultiplier(slowScopeMultiplier)
            .minGroupSizeForNPlusOne(minGroupSizeForNPlusOne)
            .cheapStatementMs(cheapStatementMs)
            .topK(topK)
            .maxPatternLength(maxPatternLength);
    }

    /**
     * Scope duration above which a scope is reported as slow.
     */
    public double getSlowScopeMs() {
        return slowStatementMs * slowScopeMultiplier;
    }

    public static final class Builder {

        private double slowStatementMs = DEFAULT_SLOW_STATEMENT_MS;
        private int scopeStatementCountThreshold = DEFAULT_SCOPE_STATEMENT_COUNT_THRESHOLD;
        private double slowScopeMultiplier = DEFAULT_SLOW_SCOPE_MULTIPLIER;
        private int minGroupSizeForNPlusOne = DEFAULT_MIN_GROUP_SIZE_FOR_N_PLUS_ONE;
        private double cheapStatementMs = DEFAULT_CHEAP_STATEMENT_MS;
        private int topK = DEFAULT_TOP_K;
        private int maxPatternLength = DEFAULT_MAX_PATTERN_LENGTH;

        private Builder() {
        }

        public Builder slowStatementMs(double slowStatementMs) {
            this.slowStatementMs = slowStatementMs;
            return this;
        }

        public Builder scopeStatementCountThreshold(int scopeStatementCountThreshold) {
            this.scopeStatementCountThreshold = scopeStatementCountThreshold;
            return this;
        }

        public Builder slowScopeMultiplier(double slowScopeMultiplier) {
            this.slowScopeMultiplier = slowScopeMultiplier;
            return this;
        }

        public Builder minGroupSizeForNPlusOne(int minGroupSizeForNPlusOne) {
            this.minGroupSizeForNPlusOne = minGroupSizeForNPlusOne;
            return this;
        }

        public Builder cheapStatementMs(double cheapStatementMs) {
            this.cheapStatementMs = cheapStatementMs;
            return this;
        }

        public Builder topK(int topK) {
            this.topK = topK;
            return this;
        }

        public Builder maxPatternLength(int maxPatternLength) {
            this.maxPatternLength = maxPatternLength;
            return this;
        }

        public ThresholdConfig build() {
            requireNonNegative("slowStatementMs", slowStatementMs);
            requireNonNegative("cheapStatementMs", cheapStatementMs);
            if (scopeStatementCountThreshold < 0) {
                throw new IllegalArgumentException("scopeStatementCountThreshold must be >= 0, was " + scopeStatementCountThreshold);
            }
            if (!(slowScopeMultiplier > 0)) {
                throw new IllegalArgumentException("slowScopeMultiplier must be > 0, was " + slowScopeMultiplier);
            }
            if (minGroupSizeForNPlusOne < 2) {
                throw new IllegalArgumentException("minGroupSizeForNPlusOne must be >= 2, was " + minGroupSizeForNPlusOne);
            }
            if (topK < 1) {
                throw new IllegalArgumentException("topK must be >= 1, was " + topK);
            }
            if (maxPatternLength < 1) {
                throw new IllegalArgumentException("maxPatternLength must be >= 1, was " + maxPatternLength);
            }
            return new ThresholdConfig(this);
        }

        private static void requireNonNegative(String name, double value) {
            if (value < 0 || Double.isNaN(value)) {
                throw new IllegalArgumentException(name + " must be >= 0, was " + value);
            }
        }
    }
}
