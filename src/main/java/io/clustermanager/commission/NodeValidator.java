package io.clustermanager.commission;

import io.clustermanager.exceptions.ValidationException;
import io.clustermanager.models.Node;
import io.clustermanager.registry.NodeRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves the node names of a cluster event and checks that each node can take part in it.
 */
@Slf4j
public class NodeValidator {

    private final NodeRegistry registry;

    public NodeValidator(NodeRegistry registry) {
        this.registry = registry;
    }

    /**
     * @return the resolved nodes by name, in request order
     * @throws ValidationException if no names are given, a node doesn't exist, has no
     *         configuration info or is not in discovered state
     */
    public Map<String, Node> validateForEvent(Collection<String> nodeNames) throws ValidationException {
        if (nodeNames == null || nodeNames.isEmpty()) {
            throw new ValidationException("one or more nodes need to be specified");
        }

        Map<String, Node> nodes = new LinkedHashMap<>();
        for (String name : nodeNames) {
            Node node = registry.findNode(name);
            if (node.getHostConfig() == null) {
                throw new ValidationException(String.format("the configuration info for node %s doesn't exist", name));
            }
            if (!node.isDiscovered()) {
                throw new ValidationException(String.format(
                    "node %s is not in discovered state (state: %s)", name, node.getDiscoveryState()));
            }
            nodes.put(name, node);
        }
        log.debug("Validated nodes {}", nodes.keySet());
        return nodes;
    }
}
