package it.berlink.querywatch.analyzer.exception;

import it.berlink.querywatch.exception.QueryWatchException;

/**
 * Thrown when a log line matches none of the supported statement formats.
 */
public class MalformedLogLineException extends QueryWatchException {

    public MalformedLogLineException(String message) {
        super(message);
    }

    public MalformedLogLineException(String message, Throwable cause) {
        super(message, cause);
    }
}
