package com.emma.client.core.model;

/**
 * Thrown when an operation needs the server-assigned identifier of an entity
 * that has not been created remotely yet.
 */
public class MissingIdentifierException extends EmmaClientException {

    public MissingIdentifierException(String message) {
        super(message);
    }
}
