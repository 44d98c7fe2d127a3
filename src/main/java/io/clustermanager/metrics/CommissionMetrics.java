package io.clustermanager.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.clustermanager.enums.JobStatus;
import io.clustermanager.exceptions.ActiveJobException;
import io.clustermanager.exceptions.StatusTransitionException;
import io.clustermanager.exceptions.TopologyException;
import io.clustermanager.exceptions.ValidationException;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static io.clustermanager.metrics.MetricsConstants.*;

/**
 * Metrics of the commission workflow for one cluster.
 */
public class CommissionMetrics {

    private final MetricsProvider metricsProvider;
    private final String clusterName;
    private final AtomicDouble activeJob;

    public CommissionMetrics(MetricsProvider metricsProvider, String clusterName) {
        this.metricsProvider = metricsProvider;
        this.clusterName = clusterName;
        this.activeJob = metricsProvider.gauge(ACTIVE_JOB_METRIC_NAME, clusterTags());
    }

    public void recordAccepted(String hostGroup) {
        recordRequest(OUTCOME_ACCEPTED, hostGroup);
    }

    /**
     * Called right before the job is handed to the executor, so a job that finishes first still leaves 0.
     */
    public void recordJobStarted() {
        activeJob.set(1);
    }

    public void recordJobNotLaunched() {
        activeJob.set(0);
    }

    public void recordRejected(Exception error, String hostGroup) {
        recordRequest(outcomeOf(error), hostGroup);
    }

    public void recordJobFinished(JobStatus status, Duration duration) {
        Map<String, String> tags = clusterTags();
        tags.put(STATUS_TAG, status.name());
        metricsProvider.counter(COMMISSION_JOBS_COUNT_METRIC_NAME, tags).increment();
        metricsProvider.timer(COMMISSION_JOB_DURATION_METRIC_NAME, clusterTags()).record(duration);
        activeJob.set(0);
    }

    public double getActiveJob() {
        return activeJob.get();
    }

    static String outcomeOf(Exception error) {
        if (error instanceof ActiveJobException) {
            return OUTCOME_CONFLICT;
        } else if (error instanceof ValidationException) {
            return OUTCOME_VALIDATION_ERROR;
        } else if (error instanceof TopologyException) {
            return OUTCOME_TOPOLOGY_ERROR;
        } else if (error instanceof StatusTransitionException) {
            return OUTCOME_STATUS_TRANSITION_ERROR;
        }
        return OUTCOME_INTERNAL_ERROR;
    }

    private void recordRequest(String outcome, String hostGroup) {
        Map<String, String> tags = clusterTags();
        tags.put(OUTCOME_TAG, outcome);
        tags.put(HOST_GROUP_TAG, hostGroup == null ? "" : hostGroup);
        metricsProvider.counter(COMMISSION_REQUESTS_COUNT_METRIC_NAME, tags).increment();
    }

    private Map<String, String> clusterTags() {
        Map<String, String> tags = new HashMap<>();
        tags.put(CLUSTER_TAG, clusterName);
        return tags;
    }
}
