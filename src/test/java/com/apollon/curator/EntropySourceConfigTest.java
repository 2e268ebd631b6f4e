package com.apollon.curator;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EntropySourceConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(EntropySourceConfig.API_LINK_VAR);
        System.clearProperty(EntropySourceConfig.API_KEY_VAR);
        System.clearProperty(EntropySourceConfig.TIMEOUT_VAR);
    }

    @Test
    void stripsTrailingSlashesFromBaseUrl() {
        EntropySourceConfig config = new EntropySourceConfig("https://qrng.example.com//", "k");
        assertEquals("https://qrng.example.com", config.baseUrl());
        assertEquals(URI.create("https://qrng.example.com/api/eris/raw?size=16"), config.rawBytesUri(16));
        assertEquals(Duration.ofSeconds(10), config.timeout());
    }

    @Test
    void rejectsBlankValues() {
        assertThrows(IllegalArgumentException.class, () -> new EntropySourceConfig(" ", "k"));
        assertThrows(IllegalArgumentException.class, () -> new EntropySourceConfig("https://x", ""));
        assertThrows(IllegalArgumentException.class,
            () -> new EntropySourceConfig("https://x", "k", Duration.ZERO));
    }

    @Test
    void toStringHidesApiKey() {
        assertFalse(new EntropySourceConfig("https://x", "super-secret").toString().contains("super-secret"));
    }

    @Test
    void readsSystemPropertiesWhenEnvironmentIsUnset() {
        if (System.getenv(EntropySourceConfig.API_LINK_VAR) != null || System.getenv(EntropySourceConfig.API_KEY_VAR) != null
            || System.getenv(EntropySourceConfig.TIMEOUT_VAR) != null) {
            return;
        }
        System.setProperty(EntropySourceConfig.API_LINK_VAR, "https://qrng.example.com/");
        System.setProperty(EntropySourceConfig.API_KEY_VAR, "abc");
        System.setProperty(EntropySourceConfig.TIMEOUT_VAR, "3");
        EntropySourceConfig config = EntropySourceConfig.fromEnvironment();
        assertEquals("https://qrng.example.com", config.baseUrl());
        assertEquals("abc", config.apiKey());
        assertEquals(Duration.ofSeconds(3), config.timeout());
    }

    @Test
    void missingKeyFailsWithVariableName() {
        if (System.getenv(EntropySourceConfig.API_LINK_VAR) != null || System.getenv(EntropySourceConfig.API_KEY_VAR) != null) {
            return;
        }
        System.setProperty(EntropySourceConfig.API_LINK_VAR, "https://qrng.example.com");
        IllegalStateException e = assertThrows(IllegalStateException.class, EntropySourceConfig::fromEnvironment);
        assertTrue(e.getMessage().contains(EntropySourceConfig.API_KEY_VAR));
    }
}
