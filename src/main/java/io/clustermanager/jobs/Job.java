package io.clustermanager.jobs;

import io.clustermanager.enums.JobStatus;
import io.clustermanager.models.JobInfo;
import lombok.Getter;

import java.io.StringWriter;
import java.time.Instant;

/**
 * The one cluster-mutating job held by the {@link ActiveJobGate}.
 */
@Getter
public class Job {

    private final String id;
    private final String description;
    private final JobRunner runner;
    private final JobCompletionCallback onComplete;
    private final Instant startTime;
    private final JobCancellation cancellation = new JobCancellation();
    // StringWriter is backed by a StringBuffer, so the runner thread and readers can share it
    private final StringWriter logs = new StringWriter();

    private volatile JobStatus status = JobStatus.ACTIVE;
    private volatile boolean launched;
    private volatile Instant endTime;
    private volatile Throwable error;

    Job(String id, String description, JobRunner runner, JobCompletionCallback onComplete, Instant startTime) {
        this.id = id;
        this.description = description;
        this.runner = runner;
        this.onComplete = onComplete;
        this.startTime = startTime;
    }

    void markLaunched() {
        this.launched = true;
    }

    void finish(JobStatus status, Throwable error, Instant endTime) {
        this.error = error;
        this.endTime = endTime;
        this.status = status;
    }

    public JobInfo toInfo() {
        Throwable failure = error;
        return JobInfo.builder()
            .id(id)
            .description(description)
            .status(status)
            .startTime(startTime)
            .endTime(endTime)
            .error(failure != null ? failure.getMessage() : null)
            .logs(logs.toString())
            .build();
    }
}
