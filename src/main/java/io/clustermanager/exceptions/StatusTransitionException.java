package io.clustermanager.exceptions;

/**
 * Thrown when an asset status change is rejected, e.g. the node is not in the expected prior status.
 */
public class StatusTransitionException extends ClusterManagerException {

    public StatusTransitionException(String message) {
        super(message);
    }

    public StatusTransitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
