package io.clustermanager.jobs;

import io.clustermanager.enums.JobStatus;
import io.clustermanager.exceptions.ActiveJobException;
import io.clustermanager.models.JobInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActiveJobGateTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private ExecutorService executor;
    private ActiveJobGate gate;
    private final AtomicInteger ids = new AtomicInteger();
    private final List<JobStatus> completions = new CopyOnWriteArrayList<>();
    private final List<Throwable> errors = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        gate = new ActiveJobGate(Clock.fixed(NOW, ZoneOffset.UTC), () -> "job-" + ids.incrementAndGet(), executor, 5);
    }

    @AfterEach
    void tearDown() {
        gate.close();
    }

    private JobCompletionCallback recordingCallback() {
        return (status, error) -> {
            completions.add(status);
            if (error != null) {
                errors.add(error);
            }
        };
    }

    @Test
    void testSecondJobIsRejectedWhileFirstIsActive() throws Exception {
        gate.checkAndSetActiveJob("first", (c, w) -> { }, recordingCallback());

        assertThatThrownBy(() -> gate.checkAndSetActiveJob("second", (c, w) -> { }, recordingCallback()))
            .isInstanceOf(ActiveJobException.class)
            .hasMessageContaining("there is already an active job")
            .hasMessageContaining("first");

        assertThat(gate.getActiveJob()).get().extracting(JobInfo::getDescription).isEqualTo("first");
        assertThat(gate.getStatus()).isEqualTo(JobStatus.ACTIVE);
    }

    @Test
    void testActiveJobCarriesIdAndStartTime() throws Exception {
        gate.checkAndSetActiveJob("first", (c, w) -> { }, recordingCallback());

        JobInfo info = gate.getActiveJob().orElseThrow();
        assertThat(info.getId()).isEqualTo("job-1");
        assertThat(info.getStartTime()).isEqualTo(NOW);
        assertThat(info.getStatus()).isEqualTo(JobStatus.ACTIVE);
        assertThat(info.getEndTime()).isNull();
    }

    @Test
    void testResetWithoutActiveJobIsNoOp() {
        gate.resetActiveJob();

        assertThat(gate.getActiveJob()).isEmpty();
        assertThat(gate.getStatus()).isEqualTo(JobStatus.IDLE);
    }

    @Test
    void testResetReleasesUnlaunchedJob() throws Exception {
        gate.checkAndSetActiveJob("first", (c, w) -> { }, recordingCallback());

        gate.resetActiveJob();

        assertThat(gate.getActiveJob()).isEmpty();
        gate.checkAndSetActiveJob("second", (c, w) -> { }, recordingCallback());
        assertThat(gate.getActiveJob()).get().extracting(JobInfo::getDescription).isEqualTo("second");
        assertThat(completions).isEmpty();
    }

    @Test
    void testRunWithoutActiveJobFails() {
        assertThatThrownBy(() -> gate.runActiveJob())
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testSuccessfulJobInvokesCallbackOnceAndReleasesGate() throws Exception {
        gate.checkAndSetActiveJob("first", (c, w) -> w.write("configured\n"), recordingCallback());

        JobStatus status = gate.runActiveJob().get(5, TimeUnit.SECONDS);

        assertThat(status).isEqualTo(JobStatus.COMPLETED);
        assertThat(completions).containsExactly(JobStatus.COMPLETED);
        assertThat(errors).isEmpty();
        assertThat(gate.getActiveJob()).isEmpty();

        JobInfo last = gate.getLastJob().orElseThrow();
        assertThat(last.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(last.getEndTime()).isEqualTo(NOW);
        assertThat(last.getLogs()).contains("configured");
        assertThat(last.getError()).isNull();
    }

    @Test
    void testFailingJobReportsErrorToCallback() throws Exception {
        IllegalStateException failure = new IllegalStateException("playbook failed");
        gate.checkAndSetActiveJob("first", (c, w) -> { throw failure; }, recordingCallback());

        JobStatus status = gate.runActiveJob().get(5, TimeUnit.SECONDS);

        assertThat(status).isEqualTo(JobStatus.ERRORED);
        assertThat(completions).containsExactly(JobStatus.ERRORED);
        assertThat(errors).containsExactly(failure);
        assertThat(gate.getLastJob()).get().extracting(JobInfo::getError).isEqualTo("playbook failed");
    }

    @Test
    void testRunnerThrowingErrorStillCompletesAndReleasesGate() throws Exception {
        gate.checkAndSetActiveJob("first", (c, w) -> { throw new AssertionError("boom"); }, recordingCallback());

        JobStatus status = gate.runActiveJob().get(5, TimeUnit.SECONDS);

        assertThat(status).isEqualTo(JobStatus.ERRORED);
        assertThat(completions).containsExactly(JobStatus.ERRORED);
        assertThat(errors).singleElement().isInstanceOf(AssertionError.class);
        assertThat(gate.getStatus()).isEqualTo(JobStatus.IDLE);
        assertThat(gate.getLastJob()).get().extracting(JobInfo::getError).isEqualTo("boom");
        gate.checkAndSetActiveJob("second", (c, w) -> { }, recordingCallback());
    }

    @Test
    void testThrowingCallbackStillReleasesGate() throws Exception {
        gate.checkAndSetActiveJob("first", (c, w) -> { }, (status, error) -> {
            throw new IllegalStateException("callback failed");
        });

        JobStatus status = gate.runActiveJob().get(5, TimeUnit.SECONDS);

        assertThat(status).isEqualTo(JobStatus.COMPLETED);
        assertThat(gate.getActiveJob()).isEmpty();
        gate.checkAndSetActiveJob("second", (c, w) -> { }, recordingCallback());
    }

    @Test
    void testRunningJobCannotBeLaunchedTwiceOrReset() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        gate.checkAndSetActiveJob("first", (c, w) -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
        }, recordingCallback());

        var completion = gate.runActiveJob();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> gate.runActiveJob()).isInstanceOf(IllegalStateException.class);
        gate.resetActiveJob();
        assertThat(gate.getActiveJob()).isPresent();
        assertThatThrownBy(() -> gate.checkAndSetActiveJob("second", (c, w) -> { }, recordingCallback()))
            .isInstanceOf(ActiveJobException.class);

        release.countDown();
        assertThat(completion.get(5, TimeUnit.SECONDS)).isEqualTo(JobStatus.COMPLETED);
        assertThat(completions).containsExactly(JobStatus.COMPLETED);
    }

    @Test
    void testCancelSignalsRunningJob() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        gate.checkAndSetActiveJob("first", (cancellation, w) -> {
            started.countDown();
            cancellation.asFuture().get(5, TimeUnit.SECONDS);
            throw new CancellationException("job was cancelled");
        }, recordingCallback());

        var completion = gate.runActiveJob();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(gate.cancelActiveJob()).isTrue();
        assertThat(completion.get(5, TimeUnit.SECONDS)).isEqualTo(JobStatus.ERRORED);
        assertThat(errors).singleElement().isInstanceOf(CancellationException.class);
    }

    @Test
    void testCancelWithoutRunningJobReturnsFalse() throws Exception {
        assertThat(gate.cancelActiveJob()).isFalse();

        gate.checkAndSetActiveJob("first", (c, w) -> { }, recordingCallback());
        assertThat(gate.cancelActiveJob()).isFalse();
    }

    @Test
    void testRejectedLaunchReleasesGate() throws Exception {
        executor.shutdownNow();
        gate.checkAndSetActiveJob("first", (c, w) -> { }, recordingCallback());

        assertThatThrownBy(() -> gate.runActiveJob()).isInstanceOf(IllegalStateException.class);

        assertThat(gate.getActiveJob()).isEmpty();
        assertThat(gate.getLastJob()).get().extracting(JobInfo::getStatus).isEqualTo(JobStatus.ERRORED);
        assertThat(completions).isEmpty();
    }
}
