package io.clustermanager.configuration;

import java.util.List;

/**
 * External automation engine that applies provisioning steps to hosts.
 */
public interface ConfigurationEngine {

    /**
     * Configure the hosts for cluster membership.
     *
     * @param hosts the hosts with their group and variables
     * @param extraVars engine specific extra variables, passed through unchanged
     * @return handle to the running invocation
     */
    ConfigurationRun configure(List<? extends HostConfiguration> hosts, String extraVars);

    /**
     * Return the hosts to a clean state after a failed configuration.
     */
    ConfigurationRun cleanup(List<? extends HostConfiguration> hosts, String extraVars);
}
