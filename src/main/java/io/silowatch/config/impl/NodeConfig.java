package io.silowatch.config.impl;

import io.silowatch.cluster.model.NodeAddress;
import lombok.Getter;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Immutable config holder loaded from node.yaml
 */
@Getter
public final class NodeConfig {

    private String host;
    private int port;
    private long generation;

    private Duration requestTimeout;
    private Duration healthDelayPerPoint;

    private List<NodeAddress> peers;

    /**
     * Address this node advertises; a generation of 0 is replaced by {@code startedAtMillis}.
     */
    public NodeAddress selfAddress(final long startedAtMillis) {
        return new NodeAddress(host, port, generation != 0 ? generation : startedAtMillis);
    }

    public static NodeConfig load(final String path) throws IOException {
        try (InputStream in = Files.newInputStream(Paths.get(path))) {
            return parse(in);
        }
    }

    @SuppressWarnings("unchecked")
    public static NodeConfig parse(final InputStream in) {
        final Yaml yaml = new Yaml();
        final Map<String, Object> m = yaml.load(in);
        if (m == null) {
            throw new IllegalArgumentException("Empty node configuration");
        }

        final Map<String, Object> node = (Map<String, Object>) m.get("node");
        if (node == null) {
            throw new IllegalArgumentException("Missing 'node' section");
        }

        if (!(node.get("port") instanceof Integer)) {
            throw new IllegalArgumentException("Missing or invalid 'node.port'");
        }

        final NodeConfig cfg = new NodeConfig();
        cfg.host       = (String) node.getOrDefault("host", "127.0.0.1");
        cfg.port       = (Integer) node.get("port");
        cfg.generation = ((Number) node.getOrDefault("generation", 0)).longValue();

        cfg.requestTimeout = Duration.ofMillis(((Number) m.getOrDefault("requestTimeoutMillis", 5_000)).longValue());

        final Map<String, Object> health = (Map<String, Object>) m.getOrDefault("health", Map.of());
        cfg.healthDelayPerPoint = Duration.ofMillis(
                ((Number) health.getOrDefault("queueDelayPerPointMillis", 100)).longValue());

        final List<Map<String, Object>> peers = (List<Map<String, Object>>) m.getOrDefault("peers", List.of());
        final List<NodeAddress> addresses = new ArrayList<>(peers.size());
        for (int i = 0; i < peers.size(); i++) {
            addresses.add(parsePeer(peers.get(i), i));
        }
        cfg.peers = List.copyOf(addresses);

        return cfg;
    }

    private static NodeAddress parsePeer(final Map<String, Object> p, final int index) {
        if (p == null || !(p.get("host") instanceof String host) || host.isBlank()) {
            throw new IllegalArgumentException("Missing or invalid 'peers[" + index + "].host'");
        }
        if (!(p.get("port") instanceof Integer port) || port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("Missing or invalid 'peers[" + index + "].port'");
        }
        final Object generation = p.getOrDefault("generation", 0);
        if (!(generation instanceof Number)) {
            throw new IllegalArgumentException("Invalid 'peers[" + index + "].generation'");
        }
        return new NodeAddress(host, port, ((Number) generation).longValue());
    }
}
