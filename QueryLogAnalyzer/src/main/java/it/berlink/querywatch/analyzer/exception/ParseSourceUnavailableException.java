package it.berlink.querywatch.analyzer.exception;

import it.berlink.querywatch.exception.QueryWatchException;

/**
 * Thrown when a log source cannot be opened or read.
 */
public class ParseSourceUnavailableException extends QueryWatchException {

    public ParseSourceUnavailableException(String message) {
        super(message);
    }

    public ParseSourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
