package io.clustermanager.configuration;

import java.util.Map;

/**
 * Per-node configuration handed to the configuration engine.
 * Topology assignment only needs to set the group and variables and read the tag.
 */
public interface HostConfiguration {

    /**
     * Tag identifying the host in the engine's inventory
     */
    String getTag();

    /**
     * Address the engine uses to reach the host
     */
    String getAddress();

    String getGroup();

    void setGroup(String group);

    void setVar(String name, String value);

    /**
     * Snapshot of the host variables
     */
    Map<String, String> getVars();

    /**
     * Independent copy carrying the same tag, address, group and variables
     */
    HostConfiguration copy();
}
