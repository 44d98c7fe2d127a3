package io.clustermanager.exceptions;

/**
 * Thrown when a node name does not exist in the node registry.
 */
public class NodeNotFoundException extends ValidationException {

    public NodeNotFoundException(String nodeName) {
        super(String.format("node with name %s doesn't exist", nodeName));
    }
}
