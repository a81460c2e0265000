package com.emma.client.core.model;

/**
 * Base class for every failure raised by the client.
 * Unchecked; callers catch the specific subtype they want to handle.
 */
public class EmmaClientException extends RuntimeException {

    public EmmaClientException(String message) {
        super(message);
    }

    public EmmaClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
