package io.clustermanager.enums;

/**
 * Lifecycle status of a cluster-mutating job.
 */
public enum JobStatus {
    IDLE,
    ACTIVE,
    ERRORED,
    COMPLETED
}
