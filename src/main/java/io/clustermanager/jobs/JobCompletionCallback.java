package io.clustermanager.jobs;

import io.clustermanager.enums.JobStatus;

/**
 * Invoked once when a job finishes, with COMPLETED or ERRORED and the failure if any.
 */
@FunctionalInterface
public interface JobCompletionCallback {

    void onComplete(JobStatus status, Throwable error);
}
