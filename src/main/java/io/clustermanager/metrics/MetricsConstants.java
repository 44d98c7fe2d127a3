package io.clustermanager.metrics;

/**
 * Constants for metrics names and tags used in the cluster manager.
 */
public class MetricsConstants {
    public final static String COMMISSION_REQUESTS_COUNT_METRIC_NAME = "commission_requests_count";
    public final static String COMMISSION_JOBS_COUNT_METRIC_NAME = "commission_jobs_count";
    public final static String COMMISSION_JOB_DURATION_METRIC_NAME = "commission_job_duration";
    public final static String ACTIVE_JOB_METRIC_NAME = "active_job";
    public final static String CLUSTER_TAG = "cluster";
    public final static String OUTCOME_TAG = "outcome";
    public final static String STATUS_TAG = "status";
    public final static String HOST_GROUP_TAG = "hostGroup";

    public final static String OUTCOME_ACCEPTED = "accepted";
    public final static String OUTCOME_CONFLICT = "conflict";
    public final static String OUTCOME_VALIDATION_ERROR = "validation_error";
    public final static String OUTCOME_TOPOLOGY_ERROR = "topology_error";
    public final static String OUTCOME_STATUS_TRANSITION_ERROR = "status_transition_error";
    public final static String OUTCOME_INTERNAL_ERROR = "internal_error";

    private MetricsConstants() {}
}
