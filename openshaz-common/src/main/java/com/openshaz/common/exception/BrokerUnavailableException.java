package com.openshaz.common.exception;

/**
 * Raised when the message broker cannot be reached for connect, publish,
 * consume or acknowledgement operations.
 */
public class BrokerUnavailableException extends RuntimeException {

    public BrokerUnavailableException(String message) {
        super(message);
    }

    public BrokerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
