package io.eventrelay.config.impl;

import io.eventrelay.retry.RetryPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

final class RelayConfigTest {

    @TempDir
    Path dir;

    @Test
    void defaults() {
        final RelayConfig cfg = RelayConfig.defaults();

        assertEquals(0, cfg.getDefaultReadAhead());
        assertEquals(5, cfg.getEventBatchSize());
        assertEquals(Duration.ofSeconds(30), cfg.getPollTimeout());
        assertEquals(5, cfg.getStartupOffsetRetryAttempts());
        assertEquals(Duration.ofMinutes(2), cfg.getRequestTimeout());

        final RetryPolicy retry = cfg.getRetryPolicy();
        assertEquals(0, retry.getMaxAttempts());
        assertEquals(100L, retry.calculateDelayMs(1));
    }

    @Test
    void loadsYamlFileAndKeepsDefaultsForMissingKeys() throws Exception {
        final Path file = dir.resolve("relay.yaml");
        Files.writeString(file, """
                subscriptionDefaults:
                  readAhead: 4
                eventDispatcher:
                  bufferLength: 50
                  retry:
                    initialDelayMs: 10
                """);

        final RelayConfig cfg = RelayConfig.load(file.toString());

        assertEquals(4, cfg.getDefaultReadAhead());
        assertEquals(50, cfg.getEventBatchSize());
        assertEquals(10L, cfg.getRetryInitialDelayMs());
        assertEquals(30_000L, cfg.getRetryMaxDelayMs());
        assertEquals(30_000L, cfg.getPollTimeoutMs());
        assertEquals(120_000L, cfg.getRequestTimeoutMs());
    }

    @Test
    void emptyDocumentGivesDefaults() {
        final RelayConfig cfg = RelayConfig.load(new ByteArrayInputStream(new byte[0]));
        assertEquals(5, cfg.getEventBatchSize());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> load("eventDispatcher:\n  bufferLength: 0\n"));
        assertThrows(IllegalArgumentException.class, () -> load("eventDispatcher:\n  retry:\n    factor: 0.5\n"));
    }

    private static RelayConfig load(final String yaml) {
        return RelayConfig.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }
}
