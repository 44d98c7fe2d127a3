package io.clustermanager.jobs;

import io.clustermanager.enums.JobStatus;
import io.clustermanager.exceptions.ActiveJobException;
import io.clustermanager.models.JobInfo;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes cluster-mutating jobs: at most one job is active at a time.
 *
 * A caller first claims the gate with {@link #checkAndSetActiveJob}, does its synchronous
 * setup, and then either launches the job with {@link #runActiveJob()} or gives the gate
 * back with {@link #resetActiveJob()}. A launched job runs on the gate's executor; when it
 * finishes its completion callback is invoked once and the gate is released.
 */
@Slf4j
public class ActiveJobGate implements AutoCloseable {

    private static final long DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final Clock clock;
    private final Supplier<String> idSupplier;
    private final ExecutorService executor;
    private final long shutdownTimeoutSeconds;
    private final ReentrantLock lock = new ReentrantLock();

    private Job activeJob;
    private Job lastJob;

    public ActiveJobGate() {
        this(DEFAULT_SHUTDOWN_TIMEOUT_SECONDS);
    }

    public ActiveJobGate(long shutdownTimeoutSeconds) {
        this(Clock.systemUTC(), () -> UUID.randomUUID().toString(), newJobExecutor(), shutdownTimeoutSeconds);
    }

    public ActiveJobGate(Clock clock, Supplier<String> idSupplier, ExecutorService executor, long shutdownTimeoutSeconds) {
        this.clock = clock;
        this.idSupplier = idSupplier;
        this.executor = executor;
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
    }

    /**
     * Claim the gate for a new job.
     *
     * @param description human readable description, reported to callers that hit a conflict
     * @param runner the job body, executed later by {@link #runActiveJob()}
     * @param onComplete invoked once with the terminal status after the runner finishes
     * @throws ActiveJobException if another job holds the gate; nothing is changed in that case
     */
    public void checkAndSetActiveJob(String description, JobRunner runner, JobCompletionCallback onComplete)
            throws ActiveJobException {
        lock.lock();
        try {
            if (activeJob != null) {
                log.info("Rejecting job '{}': job {} ('{}') is active",
                    description, activeJob.getId(), activeJob.getDescription());
                throw new ActiveJobException(activeJob.getDescription());
            }
            activeJob = new Job(idSupplier.get(), description, runner, onComplete, clock.instant());
            log.info("Job {} ('{}') is now active", activeJob.getId(), description);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Launch the active job in the background.
     *
     * @return future completing with the terminal status, after the completion callback ran
     * @throws IllegalStateException if there is no active job or it was already launched
     */
    public CompletableFuture<JobStatus> runActiveJob() {
        Job job;
        lock.lock();
        try {
            if (activeJob == null) {
                throw new IllegalStateException("there is no active job to run");
            }
            if (activeJob.isLaunched()) {
                throw new IllegalStateException("active job " + activeJob.getId() + " is already running");
            }
            job = activeJob;
            job.markLaunched();
        } finally {
            lock.unlock();
        }

        log.info("Launching job {} ('{}')", job.getId(), job.getDescription());
        try {
            return CompletableFuture.supplyAsync(() -> execute(job), executor);
        } catch (RejectedExecutionException e) {
            log.error("Failed to launch job {}: {}", job.getId(), e.getMessage());
            job.finish(JobStatus.ERRORED, e, clock.instant());
            release(job);
            throw new IllegalStateException("job executor is not accepting jobs", e);
        }
    }

    /**
     * Give back a gate that was claimed but whose job was never launched.
     * No-op when no job is active. A launched job keeps the gate until it finishes.
     */
    public void resetActiveJob() {
        lock.lock();
        try {
            if (activeJob == null) {
                return;
            }
            if (activeJob.isLaunched()) {
                log.warn("Not resetting job {}: it is already running", activeJob.getId());
                return;
            }
            log.info("Resetting job {} ('{}')", activeJob.getId(), activeJob.getDescription());
            activeJob = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Signal the running job to stop.
     *
     * @return false if no job is running
     */
    public boolean cancelActiveJob() {
        lock.lock();
        try {
            if (activeJob == null || !activeJob.isLaunched()) {
                return false;
            }
            log.info("Cancelling job {} ('{}')", activeJob.getId(), activeJob.getDescription());
            activeJob.getCancellation().cancel();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Optional<JobInfo> getActiveJob() {
        lock.lock();
        try {
            return Optional.ofNullable(activeJob).map(Job::toInfo);
        } finally {
            lock.unlock();
        }
    }

    public Optional<JobInfo> getLastJob() {
        lock.lock();
        try {
            return Optional.ofNullable(lastJob).map(Job::toInfo);
        } finally {
            lock.unlock();
        }
    }

    /**
     * IDLE when the gate is free, otherwise the active job's status.
     */
    public JobStatus getStatus() {
        lock.lock();
        try {
            return activeJob == null ? JobStatus.IDLE : activeJob.getStatus();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        log.info("Shutting down job executor");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Job executor did not terminate within {}s, forcing shutdown", shutdownTimeoutSeconds);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private JobStatus execute(Job job) {
        Throwable error = null;
        try {
            job.getRunner().run(job.getCancellation(), job.getLogs());
        } catch (Throwable e) {
            // Errors included: the callback always runs and the gate is always released
            error = e;
        }

        JobStatus status = error == null ? JobStatus.COMPLETED : JobStatus.ERRORED;
        job.finish(status, error, clock.instant());
        if (error != null) {
            log.error("Job {} ('{}') failed: {}", job.getId(), job.getDescription(), error.getMessage());
        } else {
            log.info("Job {} ('{}') completed", job.getId(), job.getDescription());
        }

        try {
            job.getOnComplete().onComplete(status, error);
        } catch (RuntimeException e) {
            log.error("Completion callback of job {} failed: {}", job.getId(), e.getMessage(), e);
        } finally {
            release(job);
        }
        return status;
    }

    private void release(Job job) {
        lock.lock();
        try {
            lastJob = job;
            if (activeJob == job) {
                activeJob = null;
            }
        } finally {
            lock.unlock();
        }
    }

    private static ExecutorService newJobExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("active-job-runner");
            t.setDaemon(true);
            return t;
        });
    }
}
