package com.apollon.curator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.Arrays;
import java.util.Objects;

/**
 * Client for the OccyByte Eris raw quantum randomness API.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Issues {@code GET {baseUrl}/api/eris/raw?size=n} with the {@code X-API-Key} and
 *   {@code Accept: application/octet-stream} headers.</li>
 *   <li>Connecting and the full request are both bounded by the configured timeout (10 seconds by default).</li>
 *   <li>A 2xx response body is returned as the random bytes; extra bytes are dropped and a short body is
 *   returned with a warning.</li>
 * </ul>
 * <p>
 * Error Handling:
 * <ul>
 *   <li>Non-2xx status (401/403 reported separately), connection failure, timeout, interruption and empty bodies all
 *   raise {@link EntropyUnavailableException}.</li>
 *   <li>No pseudo-random generator is ever substituted for the remote source.</li>
 * </ul>
 *
 * @author Curator Apollon Team
 * @since 1.0
 */
public class QuantumEntropySource implements EntropySourceInterface {
    private static final Logger logger = LoggerFactory.getLogger(QuantumEntropySource.class);

    private final EntropySourceConfig config;
    private final HttpClient httpClient;

    public QuantumEntropySource(EntropySourceConfig config) {
        this(config, HttpClient.newBuilder().connectTimeout(config.timeout()).build());
    }

    public QuantumEntropySource(EntropySourceConfig config, HttpClient httpClient) {
        this.config = Objects.requireNonNull(config, "config");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    public byte[] fetchRandomBytes(int count) throws EntropyUnavailableException {
        if (count <= 0) {
            throw new IllegalArgumentException("Requested byte count must be positive, got " + count);
        }
        HttpRequest request = HttpRequest.newBuilder(config.rawBytesUri(count))
            .timeout(config.timeout())
            .header("X-API-Key", config.apiKey())
            .header("Accept", "application/octet-stream")
            .GET()
            .build();

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            logger.warn("Entropy request timed out after {}", config.timeout());
            throw new EntropyUnavailableException(EntropyUnavailableException.Reason.TIMEOUT, "Entropy request timed out", e);
        } catch (ConnectException e) {
            logger.warn("Could not connect to entropy service at {}: {}", config.baseUrl(), e.getMessage());
            throw new EntropyUnavailableException(EntropyUnavailableException.Reason.CONNECTION, "Entropy service unreachable", e);
        } catch (IOException e) {
            logger.warn("I/O error while fetching entropy: {}", e.getMessage());
            throw new EntropyUnavailableException(EntropyUnavailableException.Reason.CONNECTION, "Entropy request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EntropyUnavailableException(EntropyUnavailableException.Reason.INTERRUPTED, "Interrupted while fetching entropy", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            EntropyUnavailableException.Reason reason = switch (status) {
                case 401 -> EntropyUnavailableException.Reason.UNAUTHORIZED;
                case 403 -> EntropyUnavailableException.Reason.FORBIDDEN;
                default -> EntropyUnavailableException.Reason.HTTP_STATUS;
            };
            if (reason == EntropyUnavailableException.Reason.HTTP_STATUS) {
                logger.warn("Entropy service returned HTTP {}", status);
            } else {
                logger.warn("Entropy service rejected the API key (HTTP {})", status);
            }
            throw new EntropyUnavailableException(reason, status, "Entropy service returned HTTP " + status, null);
        }

        byte[] body = response.body();
        if (body == null || body.length == 0) {
            logger.warn("Entropy service returned an empty body for {} bytes", count);
            throw new EntropyUnavailableException(EntropyUnavailableException.Reason.MALFORMED_RESPONSE, "Empty entropy response");
        }
        if (body.length > count) {
            return Arrays.copyOf(body, count);
        }
        if (body.length < count) {
            logger.warn("Entropy service returned {} of {} requested bytes", body.length, count);
        }
        return body;
    }

    @Override
    public boolean isAvailable() {
        try {
            fetchRandomBytes(1);
            return true;
        } catch (EntropyUnavailableException e) {
            logger.info("Entropy source probe failed: {}", e.getReason());
            return false;
        }
    }
}
