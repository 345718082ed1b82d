package dev.pagegraph.exception;

/**
 * Client error: the event cannot be accepted as sent. Never retried.
 */
public class InvalidEventException extends RuntimeException {
    public InvalidEventException(String message) {
        super(message);
    }
}
