package io.silowatch.config.type;

import io.silowatch.config.impl.NodeConfig;

import java.io.IOException;

public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads node configuration from a YAML file by delegating to {@link NodeConfig#load(String)}.
     * <p>
     * Expected structure:
     * <pre>
     * node:
     *   host: 127.0.0.1
     *   port: 11111
     *   generation: 0
     * requestTimeoutMillis: 5000
     * health:
     *   queueDelayPerPointMillis: 100
     * peers:
     *   - host: 127.0.0.1
     *     port: 11112
     *     generation: 1
     * </pre>
     *
     * @param path the path to the node YAML configuration file
     * @return a populated {@link NodeConfig} instance
     * @throws IOException if the file cannot be read
     */
    public static NodeConfig load(final String path) throws IOException {
        return NodeConfig.load(path);
    }
}
