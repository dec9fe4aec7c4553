package it.berlink.querywatch.exception;

/**
 * Base exception for statement monitoring and log analysis errors
 */
public class QueryWatchException extends RuntimeException {

    public QueryWatchException(String message) {
        super(message);
    }

    public QueryWatchException(String message, Throwable cause) {
        super(message, cause);
    }

}
