package com.openshaz.common.exception;

/**
 * Malformed job payload or invalid feature data. Retrying will not fix it,
 * so the retry governor treats it as terminal.
 */
public class JobValidationException extends RuntimeException {

    public JobValidationException(String message) {
        super(message);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
