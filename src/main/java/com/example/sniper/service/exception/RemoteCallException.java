package com.example.sniper.service.exception;

/**
 * A call to the booking platform failed: connection error, timeout, non-2xx status
 * or a body that could not be read. Always recoverable.
 */
public class RemoteCallException extends RuntimeException {

    public RemoteCallException(String message) {
        super(message);
    }

    public RemoteCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
