package io.clustermanager.exceptions;

/**
 * Base class for errors raised by cluster-mutating operations.
 */
public class ClusterManagerException extends Exception {

    public ClusterManagerException(String message) {
        super(message);
    }

    public ClusterManagerException(String message, Throwable cause) {
        super(message, cause);
    }
}
