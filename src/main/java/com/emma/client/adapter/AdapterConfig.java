package com.emma.client.adapter;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Connection settings for {@link HttpClientAdapter}.
 *
 * @param accountId  the Emma account id, appended to the base URL
 * @param publicKey  API public key, used as the basic-auth user
 * @param privateKey API private key, used as the basic-auth password
 * @param baseUrl    API root without trailing slash
 * @param timeout    connect and request timeout
 */
public record AdapterConfig(String accountId, String publicKey, String privateKey,
                            String baseUrl, Duration timeout) {

    public static final String DEFAULT_BASE_URL = "https://api.e2ma.net";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    static final String ENV_ACCOUNT_ID = "EMMA_ACCOUNT_ID";
    static final String ENV_PUBLIC_KEY = "EMMA_PUBLIC_KEY";
    static final String ENV_PRIVATE_KEY = "EMMA_PRIVATE_KEY";
    static final String ENV_BASE_URL = "EMMA_BASE_URL";

    public AdapterConfig {
        requireText(accountId, "accountId");
        requireText(publicKey, "publicKey");
        requireText(privateKey, "privateKey");
        requireText(baseUrl, "baseUrl");
        Objects.requireNonNull(timeout, "timeout is required");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
    }

    /**
     * Configuration against the public API with the default timeout.
     */
    public static AdapterConfig of(String accountId, String publicKey, String privateKey) {
        return new AdapterConfig(accountId, publicKey, privateKey, DEFAULT_BASE_URL, DEFAULT_TIMEOUT);
    }

    /**
     * Reads {@code EMMA_ACCOUNT_ID}, {@code EMMA_PUBLIC_KEY}, {@code EMMA_PRIVATE_KEY}
     * and the optional {@code EMMA_BASE_URL} from the process environment.
     */
    public static AdapterConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static AdapterConfig fromEnvironment(Map<String, String> env) {
        String baseUrl = env.get(ENV_BASE_URL);
        return new AdapterConfig(
                env.get(ENV_ACCOUNT_ID),
                env.get(ENV_PUBLIC_KEY),
                env.get(ENV_PRIVATE_KEY),
                baseUrl != null && !baseUrl.isBlank() ? baseUrl : DEFAULT_BASE_URL,
                DEFAULT_TIMEOUT);
    }

    public AdapterConfig withBaseUrl(String baseUrl) {
        return new AdapterConfig(accountId, publicKey, privateKey, baseUrl, timeout);
    }

    public AdapterConfig withTimeout(Duration timeout) {
        return new AdapterConfig(accountId, publicKey, privateKey, baseUrl, timeout);
    }

    /**
     * Account-scoped root that request paths are appended to.
     */
    public String endpoint() {
        return baseUrl + "/" + accountId;
    }

    @Override
    public String toString() {
        return "AdapterConfig{" +
                "accountId='" + accountId + '\'' +
                ", publicKey='" + publicKey + '\'' +
                ", privateKey='***'" +
                ", baseUrl='" + baseUrl + '\'' +
                ", timeout=" + timeout +
                '}';
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
