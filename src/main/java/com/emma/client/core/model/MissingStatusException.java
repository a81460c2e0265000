package com.emma.client.core.model;

/**
 * Thrown when a member's status has not been resolved but the operation requires it.
 */
public class MissingStatusException extends EmmaClientException {

    public MissingStatusException(String message) {
        super(message);
    }
}
