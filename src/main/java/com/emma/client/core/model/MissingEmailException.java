package com.emma.client.core.model;

/**
 * Thrown when a member has no email address but the operation requires one.
 */
public class MissingEmailException extends EmmaClientException {

    public MissingEmailException(String message) {
        super(message);
    }
}
