package io.clustermanager.commission;

import io.clustermanager.configuration.ConfigurationEngine;
import io.clustermanager.configuration.ConfigurationRuns;
import io.clustermanager.configuration.HostConfiguration;
import io.clustermanager.exceptions.ConfigurationException;
import io.clustermanager.jobs.JobCancellation;
import io.clustermanager.jobs.JobRunner;
import lombok.extern.slf4j.Slf4j;

import java.io.Writer;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Job runner that configures a set of hosts and runs the cleanup on the same hosts if that fails.
 * The configuration failure is what the job reports, whatever the cleanup outcome.
 */
@Slf4j
public class ConfigureOrCleanupRunner implements JobRunner {

    private final ConfigurationEngine engine;
    private final List<? extends HostConfiguration> hosts;
    private final String extraVars;

    public ConfigureOrCleanupRunner(ConfigurationEngine engine, List<? extends HostConfiguration> hosts, String extraVars) {
        this.engine = engine;
        this.hosts = hosts;
        this.extraVars = extraVars;
    }

    @Override
    public void run(JobCancellation cancellation, Writer jobLogs) throws Exception {
        Exception cfgErr;
        try {
            ConfigurationRuns.logOutputAndAwait(engine.configure(hosts, extraVars), cancellation, jobLogs);
            return;
        } catch (Exception e) {
            cfgErr = e;
        }

        log.error("configuration failed, starting cleanup. Error: {}", cfgErr.getMessage());
        try {
            // a cancelled job stops the cleanup through the same cancellation
            ConfigurationRuns.logOutputAndAwait(engine.cleanup(hosts, extraVars), cancellation, jobLogs);
        } catch (Exception e) {
            log.error("cleanup failed. Error: {}", e.getMessage());
        }

        throw rootCause(cfgErr);
    }

    private static Exception rootCause(Exception cfgErr) {
        if (cfgErr instanceof ConfigurationException || cfgErr instanceof CancellationException) {
            return cfgErr;
        }
        return new ConfigurationException("configuration failed: " + cfgErr.getMessage(), cfgErr);
    }
}
