package io.clustermanager.enums;

/**
 * Monitoring state of a node as last reported by node discovery.
 */
public enum DiscoveryState {
    DISCOVERED,
    DISAPPEARED,
    UNKNOWN
}
