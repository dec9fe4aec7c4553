package it.berlink.querywatch.model;

/**
 * Conditions the classifier can raise for a scope.
 */
public enum FlagType {

    SLOW_STATEMENT("slow_statements"),
    N_PLUS_ONE("suspected_n_plus_one"),
    SLOW_SCOPE("slow_scope");

    private final String key;

    FlagType(String key) {
        this.key = key;
    }

    /**
     * Name used in structured log events.
     */
    public String key() {
        return key;
    }
}
