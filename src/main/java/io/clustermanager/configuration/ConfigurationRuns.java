package io.clustermanager.configuration;

import io.clustermanager.jobs.JobCancellation;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Helpers for waiting on a {@link ConfigurationRun}.
 */
@Slf4j
public final class ConfigurationRuns {

    private static final long OUTPUT_DRAIN_TIMEOUT_SECONDS = 10;
    private static final long CANCEL_SETTLE_TIMEOUT_SECONDS = 10;

    private static final ExecutorService OUTPUT_COPIERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r);
        t.setName("configuration-output-" + t.getId());
        t.setDaemon(true);
        return t;
    });

    private ConfigurationRuns() {
        // Utility class
    }

    /**
     * Copy the run's output to the job log until the run finishes or the job is cancelled.
     *
     * @throws CancellationException if the job was cancelled before the run finished; the run is
     *         cancelled as well
     * @throws Exception the run's own failure
     */
    public static void logOutputAndAwait(ConfigurationRun run, JobCancellation cancellation, Writer jobLogs)
            throws Exception {
        CompletableFuture<Void> copier = CompletableFuture.runAsync(
            () -> copyOutput(run.getOutput(), jobLogs), OUTPUT_COPIERS);

        try {
            CompletableFuture.anyOf(run.getResult(), cancellation.asFuture()).get();
        } catch (ExecutionException | CancellationException e) {
            // the run failed; rethrown below once the output is drained
            log.debug("Configuration run failed: {}", e.getMessage());
        }

        if (!run.getResult().isDone() && cancellation.isCancelled()) {
            log.info("Cancelling configuration run");
            run.getCancel().run();
            awaitQuietly(run.getResult(), CANCEL_SETTLE_TIMEOUT_SECONDS);
            awaitQuietly(copier, OUTPUT_DRAIN_TIMEOUT_SECONDS);
            throw new CancellationException("configuration run was cancelled");
        }

        awaitQuietly(copier, OUTPUT_DRAIN_TIMEOUT_SECONDS);
        try {
            run.getResult().join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }
    }

    private static void copyOutput(InputStream output, Writer jobLogs) {
        if (output == null) {
            return;
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(output, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[engine] {}", line);
                jobLogs.write(line);
                jobLogs.write(System.lineSeparator());
            }
            jobLogs.flush();
        } catch (IOException e) {
            // the stream is closed when a run is cancelled
            log.debug("Stopped reading configuration output: {}", e.getMessage());
        }
    }

    private static void awaitQuietly(CompletableFuture<?> future, long timeoutSeconds) {
        try {
            future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | CancellationException e) {
            log.debug("Awaited future finished with: {}", e.getMessage());
        } catch (TimeoutException e) {
            log.warn("Timed out after {}s waiting for configuration run to settle", timeoutSeconds);
        }
    }

    private static Exception unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Exception) {
            return (Exception) cause;
        }
        return e;
    }
}
