package io.clustermanager.enums;

/**
 * Topology groups a commissioned node can join.
 *
 * MASTER: control-plane nodes, WORKER: nodes that join an existing master
 */
public enum HostGroup {
    MASTER("service-master"),
    WORKER("service-worker");

    private final String value;

    HostGroup(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static HostGroup fromString(String value) {
        if (value == null) return null;

        String trimmed = value.trim();

        // Group names as used in the configuration engine's inventory
        for (HostGroup group : HostGroup.values()) {
            if (group.value.equalsIgnoreCase(trimmed)) {
                return group;
            }
        }

        // Enum names, e.g. "master" or "WORKER"
        for (HostGroup group : HostGroup.values()) {
            if (group.name().equalsIgnoreCase(trimmed)) {
                return group;
            }
        }

        return null;
    }

    public static boolean isValid(String value) {
        return fromString(value) != null;
    }
}
