package io.clustermanager.exceptions;

/**
 * Thrown when the configuration engine fails to configure or clean up a set of hosts.
 */
public class ConfigurationException extends ClusterManagerException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
