package com.emma.client.adapter;

import com.emma.client.core.model.EmmaClientException;

/**
 * Thrown when the API answers with a status other than success or 404.
 * Carries the status code and raw response body for inspection.
 */
public class ApiRequestFailedException extends EmmaClientException {

    private final int statusCode;
    private final String responseBody;

    public ApiRequestFailedException(String method, String path, int statusCode, String responseBody) {
        super(method + " " + path + " failed with status " + statusCode);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public ApiRequestFailedException(String method, String path, Throwable cause) {
        super(method + " " + path + " failed: " + cause.getMessage(), cause);
        this.statusCode = -1;
        this.responseBody = null;
    }

    /**
     * HTTP status code, or -1 when the request never produced a response.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
