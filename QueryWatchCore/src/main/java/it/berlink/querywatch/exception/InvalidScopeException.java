package it.berlink.querywatch.exception;

import lombok.Getter;

/**
 * Raised when a scope cannot be closed: the handle was already consumed,
 * was never attached to a log, or the log was reset underneath it.
 */
@Getter
public class InvalidScopeException extends QueryWatchException {

    public enum Reason {
        ALREADY_CLOSED,
        LOG_SHRUNK,
        DETACHED
    }

    private final Reason reason;
    private final String label;

    public InvalidScopeException(Reason reason, String label, String message) {
        super(message);
        this.reason = reason;
        this.label = label;
    }

    public static InvalidScopeException alreadyClosed(String label) {
        return new InvalidScopeException(Reason.ALREADY_CLOSED, label,
            "Scope '" + label + "' was already closed");
    }

    public static InvalidScopeException logShrunk(String label, int startIndex, int currentLength) {
        return new InvalidScopeException(Reason.LOG_SHRUNK, label,
            "Statement log for scope '" + label + "' shrank below its start offset (start "
                + startIndex + ", length " + currentLength + ")");
    }

    public static InvalidScopeException detached(String label) {
        return new InvalidScopeException(Reason.DETACHED, label,
            "Scope '" + label + "' is not attached to a statement log");
    }
}
