package io.clustermanager.models;

import io.clustermanager.configuration.HostConfiguration;
import io.clustermanager.enums.DiscoveryState;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A bare-metal or virtual node known to the manager.
 * Allocation state is kept in the asset inventory under the node's name.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Node {

    private String name;

    private String mgmtAddress;

    private DiscoveryState discoveryState = DiscoveryState.UNKNOWN;

    private HostConfiguration hostConfig;

    public boolean isDiscovered() {
        return discoveryState == DiscoveryState.DISCOVERED;
    }
}
