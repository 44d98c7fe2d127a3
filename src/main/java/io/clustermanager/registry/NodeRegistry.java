package io.clustermanager.registry;

import io.clustermanager.enums.AssetStatus;
import io.clustermanager.enums.HostGroup;
import io.clustermanager.exceptions.NodeNotFoundException;
import io.clustermanager.inventory.AssetInventory;
import io.clustermanager.models.Node;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of nodes known to the manager, in registration order.
 *
 * Reads during a commission are not locked beyond the active job gate: only one
 * cluster-mutating job runs at a time.
 */
@Slf4j
public class NodeRegistry {

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final AssetInventory inventory;

    public NodeRegistry(AssetInventory inventory) {
        this.inventory = inventory;
    }

    public synchronized void upsertNode(Node node) {
        if (node == null || node.getName() == null || node.getName().isBlank()) {
            throw new IllegalArgumentException("node name is required");
        }
        Node previous = nodes.put(node.getName(), node);
        if (previous == null) {
            log.info("Registered node {} (address: {}, state: {})",
                node.getName(), node.getMgmtAddress(), node.getDiscoveryState());
        } else {
            log.debug("Updated node {} (address: {}, state: {})",
                node.getName(), node.getMgmtAddress(), node.getDiscoveryState());
        }
    }

    public synchronized boolean removeNode(String name) {
        return nodes.remove(name) != null;
    }

    public synchronized Optional<Node> getNode(String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    /**
     * Snapshot of all nodes, in registration order.
     */
    public synchronized List<Node> getNodes() {
        return new ArrayList<>(nodes.values());
    }

    public Node findNode(String name) throws NodeNotFoundException {
        return getNode(name).orElseThrow(() -> new NodeNotFoundException(name));
    }

    /**
     * Whether the node is reported by discovery and its asset is commissioned.
     */
    public boolean isDiscoveredAndAllocated(String name) throws Exception {
        Node node = findNode(name);
        if (!node.isDiscovered()) {
            return false;
        }
        return inventory.getAssetStatus(name) == AssetStatus.COMMISSIONED;
    }

    /**
     * Whether the node's host configuration places it in the master group.
     */
    public boolean isMasterNode(String name) throws Exception {
        Node node = findNode(name);
        if (node.getHostConfig() == null) {
            throw new IllegalStateException(String.format("the configuration info for node %s doesn't exist", name));
        }
        return HostGroup.MASTER.getValue().equals(node.getHostConfig().getGroup());
    }
}
