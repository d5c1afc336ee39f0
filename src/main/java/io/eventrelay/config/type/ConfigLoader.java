package io.eventrelay.config.type;

import io.eventrelay.config.impl.RelayConfig;

import java.io.IOException;
import java.io.InputStream;

public final class ConfigLoader {

    public static final String DEFAULT_RESOURCE = "eventrelay.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads relay configuration from a YAML file by delegating to {@link RelayConfig#load(String)}.
     *
     * @param path the path to the YAML configuration file
     * @return a populated {@link RelayConfig} instance
     * @throws IOException if the file cannot be read
     */
    public static RelayConfig load(final String path) throws IOException {
        return RelayConfig.load(path);
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, falling back to built-in defaults
     * when no such resource is present.
     * <p>
     * Expected structure:
     * <pre>
     * subscriptionDefaults:
     *   readAhead: 0
     * eventDispatcher:
     *   bufferLength: 5
     *   pollTimeoutMs: 30000
     *   retry:
     *     initialDelayMs: 100
     *     maxDelayMs: 30000
     *     factor: 2.0
     * orchestrator:
     *   startupAttempts: 5
     * syncAsync:
     *   requestTimeoutMs: 120000
     * </pre>
     */
    public static RelayConfig loadFromClasspath() throws IOException {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) return RelayConfig.defaults();
            return RelayConfig.load(in);
        }
    }
}
