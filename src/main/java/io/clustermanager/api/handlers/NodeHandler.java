package io.clustermanager.api.handlers;

import io.clustermanager.ClusterManager;
import io.clustermanager.api.models.requests.NodeRequest;
import io.clustermanager.api.models.responses.ErrorResponse;
import io.clustermanager.api.models.responses.NodeResponse;
import io.clustermanager.configuration.AnsibleHost;
import io.clustermanager.enums.AssetStatus;
import io.clustermanager.enums.DiscoveryState;
import io.clustermanager.models.Node;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * REST API handler for the node registry.
 *
 * Supported operations:
 * - GET /info/nodes - All nodes with their asset status
 * - GET /info/node/{name} - One node with its asset status
 * - PUT /info/node/{name} - Register or update a node
 */
@Slf4j
@RestController
@RequestMapping("/info")
public class NodeHandler {

    private final ClusterManager clusterManager;

    public NodeHandler(ClusterManager clusterManager) {
        this.clusterManager = clusterManager;
    }

    @GetMapping("/nodes")
    public ResponseEntity<Object> getNodes() {
        try {
            List<NodeResponse> nodes = new ArrayList<>();
            for (Node node : clusterManager.getNodes()) {
                nodes.add(NodeResponse.from(node, assetStatusOf(node.getName())));
            }
            return ResponseEntity.ok(nodes);
        } catch (Exception e) {
            log.error("Error listing nodes: {}", e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @GetMapping("/node/{name}")
    public ResponseEntity<Object> getNode(@PathVariable String name) {
        Optional<Node> node = clusterManager.getNode(name);
        if (node.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Node '" + name + "'"));
        }
        return ResponseEntity.ok(NodeResponse.from(node.get(), assetStatusOf(name)));
    }

    /**
     * Register or update a node.
     * PUT /info/node/{name}
     */
    @PutMapping("/node/{name}")
    public ResponseEntity<Object> putNode(@PathVariable String name, @RequestBody NodeRequest request) {
        try {
            if (request.getAddress() == null || request.getAddress().isBlank()) {
                throw new IllegalArgumentException("node address is required");
            }
            log.info("Registering node '{}' at {}", name, request.getAddress());

            String tag = request.getTag() == null || request.getTag().isBlank() ? name : request.getTag();
            AnsibleHost host = AnsibleHost.forNode(tag, request.getAddress());
            if (request.getGroup() != null) {
                host.setGroup(request.getGroup());
            }
            if (request.getVars() != null) {
                request.getVars().forEach(host::setVar);
            }
            DiscoveryState state = request.getDiscoveryState() == null
                ? DiscoveryState.UNKNOWN
                : request.getDiscoveryState();

            Node node = new Node(name, request.getAddress(), state, host);
            clusterManager.registerNode(node);
            return ResponseEntity.ok(NodeResponse.from(node, assetStatusOf(name)));
        } catch (IllegalArgumentException e) {
            log.error("Invalid node '{}': {}", name, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.badRequest("illegal_argument_exception", e.getMessage()));
        } catch (Exception e) {
            log.error("Error registering node '{}': {}", name, e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    /**
     * Null when the inventory can't be read, the node record is still reported.
     */
    private AssetStatus assetStatusOf(String name) {
        try {
            return clusterManager.getAssetStatus(name);
        } catch (Exception e) {
            log.debug("No asset status for node {}: {}", name, e.getMessage());
            return null;
        }
    }
}
