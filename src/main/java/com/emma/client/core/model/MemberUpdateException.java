package com.emma.client.core.model;

/**
 * Thrown when the API answers a member write with an empty or false result.
 * Local member state is left as it was before the call.
 */
public class MemberUpdateException extends EmmaClientException {

    public MemberUpdateException(String message) {
        super(message);
    }
}
