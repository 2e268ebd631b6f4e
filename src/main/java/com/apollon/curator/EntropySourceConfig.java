package com.apollon.curator;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for the remote quantum entropy service.
 * <p>
 * {@link #fromEnvironment()} reads {@code OCCYBYTE_API_LINK}, {@code OCCYBYTE_API_KEY} and the optional
 * {@code OCCYBYTE_TIMEOUT_SECONDS} (default 10) from the environment or JVM system properties.
 *
 * @param baseUrl service root, without trailing slash
 * @param apiKey value sent in the {@code X-API-Key} header
 * @param timeout bound applied to connecting and to the whole request
 */
public record EntropySourceConfig(String baseUrl, String apiKey, Duration timeout) {

    public static final String API_LINK_VAR = "OCCYBYTE_API_LINK";
    public static final String API_KEY_VAR = "OCCYBYTE_API_KEY";
    public static final String TIMEOUT_VAR = "OCCYBYTE_TIMEOUT_SECONDS";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    public EntropySourceConfig {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(apiKey, "apiKey");
        if (baseUrl.isBlank()) throw new IllegalArgumentException("Entropy service URL cannot be blank");
        if (apiKey.isBlank()) throw new IllegalArgumentException("Entropy service API key cannot be blank");
        baseUrl = baseUrl.trim().replaceAll("/+$", "");
        URI.create(baseUrl);
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Entropy service timeout must be positive: " + timeout);
        }
    }

    public EntropySourceConfig(String baseUrl, String apiKey) {
        this(baseUrl, apiKey, DEFAULT_TIMEOUT);
    }

    /**
     * Builds the configuration from environment variables or system properties.
     * @throws IllegalStateException if the link or key is missing, or the timeout is not a positive integer
     */
    public static EntropySourceConfig fromEnvironment() {
        String link = Utils.envOrProp(API_LINK_VAR, "");
        String key = Utils.envOrProp(API_KEY_VAR, "");
        if (link.isBlank()) {
            throw new IllegalStateException("OccyByte API link not provided (" + API_LINK_VAR + ")");
        }
        if (key.isBlank()) {
            throw new IllegalStateException("OccyByte API key not provided (" + API_KEY_VAR + ")");
        }
        String timeoutStr = Utils.envOrProp(TIMEOUT_VAR, "");
        Duration timeout = DEFAULT_TIMEOUT;
        if (!timeoutStr.isBlank()) {
            try {
                long seconds = Long.parseLong(timeoutStr.trim());
                if (seconds <= 0) throw new NumberFormatException("not positive");
                timeout = Duration.ofSeconds(seconds);
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Invalid " + TIMEOUT_VAR + ": " + timeoutStr, e);
            }
        }
        return new EntropySourceConfig(link, key, timeout);
    }

    /**
     * @return request URI for {@code size} raw bytes
     */
    public URI rawBytesUri(int size) {
        return URI.create(baseUrl + "/api/eris/raw?size=" + size);
    }

    // keep the key out of logs
    @Override
    public String toString() {
        return "EntropySourceConfig[baseUrl=" + baseUrl + ", timeout=" + timeout + "]";
    }
}
