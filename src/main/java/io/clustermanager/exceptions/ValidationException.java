package io.clustermanager.exceptions;

/**
 * Thrown when a request names an unknown host group or a node that cannot take part in it.
 */
public class ValidationException extends ClusterManagerException {

    public ValidationException(String message) {
        super(message);
    }
}
