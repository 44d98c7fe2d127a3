package io.clustermanager.commission;

import io.clustermanager.configuration.HostConfiguration;
import io.clustermanager.enums.HostGroup;
import io.clustermanager.exceptions.TopologyException;
import io.clustermanager.models.Node;
import io.clustermanager.registry.NodeRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.clustermanager.config.Constants.ANSIBLE_ETCD_MASTER_ADDR_HOST_VAR;
import static io.clustermanager.config.Constants.ANSIBLE_ETCD_MASTER_NAME_HOST_VAR;

/**
 * Assigns the nodes of a commission event to a host group and points them at an existing master.
 *
 * Only safe while the caller holds the active job gate: the registry scan is not locked otherwise.
 */
@Slf4j
public class TopologyAssigner {

    private final NodeRegistry registry;

    public TopologyAssigner(NodeRegistry registry) {
        this.registry = registry;
    }

    /**
     * Find a commissioned master outside of {@code eventNodes} and build the host configuration
     * of every event node: the requested group plus the master's address and name.
     * The returned configurations are copies, the registry's nodes are left untouched.
     * When several masters exist, which one is used is not specified.
     *
     * @throws TopologyException if a worker is requested and no commissioned master exists
     */
    public List<HostConfiguration> assign(Map<String, Node> eventNodes, HostGroup group) throws TopologyException {
        String masterAddr = "";
        String masterName = "";
        boolean masterCommissioned = false;

        for (Node candidate : registry.getNodes()) {
            String name = candidate.getName();
            if (eventNodes.containsKey(name)) {
                continue;
            }
            // skip hosts that are not yet commissioned or not in discovered state
            if (!passes(name, registry::isDiscoveredAndAllocated)) {
                continue;
            }
            // skip hosts that are not in master group
            if (!passes(name, registry::isMasterNode)) {
                continue;
            }

            masterAddr = candidate.getMgmtAddress();
            masterName = candidate.getHostConfig().getTag();
            masterCommissioned = true;
            log.info("Using node {} ({}) as master for {}", name, masterAddr, eventNodes.keySet());
            break;
        }

        if (!masterCommissioned && group == HostGroup.WORKER) {
            throw new TopologyException("Cannot commission a worker node without existence of a master node in the cluster, "
                + "make sure at least one master node is commissioned.");
        }
        if (!masterCommissioned) {
            log.info("No commissioned master found, nodes {} will form the first master group", eventNodes.keySet());
        }

        List<HostConfiguration> hosts = new ArrayList<>();
        for (Node node : eventNodes.values()) {
            HostConfiguration host = node.getHostConfig().copy();
            host.setGroup(group.getValue());
            host.setVar(ANSIBLE_ETCD_MASTER_ADDR_HOST_VAR, masterAddr);
            host.setVar(ANSIBLE_ETCD_MASTER_NAME_HOST_VAR, masterName);
            hosts.add(host);
        }
        return hosts;
    }

    @FunctionalInterface
    private interface NodeCheck {
        boolean test(String name) throws Exception;
    }

    /**
     * A failed check is treated as no match.
     */
    private static boolean passes(String name, NodeCheck check) {
        try {
            return check.test(name);
        } catch (Exception e) {
            log.debug("a node check failed for {}. Error: {}", name, e.getMessage());
            return false;
        }
    }
}
