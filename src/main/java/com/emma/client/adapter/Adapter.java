package com.emma.client.adapter;

import java.util.Map;

/**
 * Transport used by entities and collections to talk to the API.
 * Abstracts the HTTP client so the object model can be exercised without a network.
 *
 * <p>Every method returns the decoded JSON value ({@code Map}, {@code List},
 * {@code String}, {@code Number} or {@code Boolean}), or {@code null} when the
 * resource was not found. Any other unsuccessful status throws
 * {@link ApiRequestFailedException}.</p>
 *
 * <p>Paths are relative to the account, e.g. {@code /members/123}.</p>
 */
public interface Adapter {

    /**
     * Issues a GET request.
     *
     * @param path   path relative to the account
     * @param params query parameters, may be empty
     * @return decoded JSON, or null if not found
     */
    Object get(String path, Map<String, ?> params);

    /**
     * Issues a POST request with a JSON body.
     *
     * @param path path relative to the account
     * @param body value to encode as JSON, may be null
     * @return decoded JSON, or null if not found
     */
    Object post(String path, Object body);

    /**
     * Issues a PUT request with a JSON body.
     *
     * @param path path relative to the account
     * @param body value to encode as JSON, may be null
     * @return decoded JSON, or null if not found
     */
    Object put(String path, Object body);

    /**
     * Issues a DELETE request.
     *
     * @param path   path relative to the account
     * @param params query parameters, may be empty
     * @return decoded JSON, or null if not found
     */
    Object delete(String path, Map<String, ?> params);
}
