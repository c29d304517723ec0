package io.silowatch.cluster.model;

/**
 * Tag carried in every outbound envelope so the transport can tell probes from regular calls.
 */
public enum TrafficClass {
    APPLICATION,
    HEALTH_CHECK
}
