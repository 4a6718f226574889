package com.chuntfm.schedule.domain.exception;

/**
 * A schedule query was missing required parameters or could not be parsed.
 */
public class InvalidQueryException extends RuntimeException {

    public InvalidQueryException(String message) {
        super(message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
