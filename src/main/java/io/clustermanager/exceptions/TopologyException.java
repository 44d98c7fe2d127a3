package io.clustermanager.exceptions;

/**
 * Thrown when the requested host group cannot be satisfied by the current cluster topology.
 */
public class TopologyException extends ClusterManagerException {

    public TopologyException(String message) {
        super(message);
    }
}
