package io.clustermanager.jobs;

import java.io.Writer;

/**
 * Body of a cluster-mutating job. Runs on the gate's background executor.
 */
@FunctionalInterface
public interface JobRunner {

    /**
     * @param cancellation signalled when the job is cancelled; long running work must honour it
     * @param jobLogs sink for output that is kept with the job
     * @throws Exception when the job fails; the job then ends as ERRORED
     */
    void run(JobCancellation cancellation, Writer jobLogs) throws Exception;
}
