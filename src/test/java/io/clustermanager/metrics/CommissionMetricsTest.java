package io.clustermanager.metrics;

import io.clustermanager.enums.JobStatus;
import io.clustermanager.exceptions.ActiveJobException;
import io.clustermanager.exceptions.ClusterManagerException;
import io.clustermanager.exceptions.NodeNotFoundException;
import io.clustermanager.exceptions.StatusTransitionException;
import io.clustermanager.exceptions.TopologyException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static io.clustermanager.metrics.MetricsConstants.*;
import static org.assertj.core.api.Assertions.assertThat;

class CommissionMetricsTest {

    private SimpleMeterRegistry registry;
    private CommissionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new CommissionMetrics(new MetricsProvider(registry, "test-manager"), "test-cluster");
    }

    @Test
    void testAcceptedRequestIsCounted() {
        metrics.recordAccepted("service-worker");

        assertThat(registry.get(COMMISSION_REQUESTS_COUNT_METRIC_NAME)
            .tag(OUTCOME_TAG, OUTCOME_ACCEPTED)
            .tag(HOST_GROUP_TAG, "service-worker")
            .tag(CLUSTER_TAG, "test-cluster")
            .counter().count()).isEqualTo(1.0);
        assertThat(registry.get(ACTIVE_JOB_METRIC_NAME).gauge().value()).isEqualTo(0.0);
    }

    @Test
    void testStartedJobRaisesActiveJobGauge() {
        metrics.recordJobStarted();
        assertThat(registry.get(ACTIVE_JOB_METRIC_NAME).gauge().value()).isEqualTo(1.0);

        metrics.recordJobNotLaunched();
        assertThat(registry.get(ACTIVE_JOB_METRIC_NAME).gauge().value()).isEqualTo(0.0);
    }

    @Test
    void testFinishedJobIsCountedAndTimed() {
        metrics.recordJobStarted();
        metrics.recordAccepted("service-master");
        metrics.recordJobFinished(JobStatus.ERRORED, Duration.ofSeconds(3));

        assertThat(registry.get(COMMISSION_JOBS_COUNT_METRIC_NAME).tag(STATUS_TAG, "ERRORED").counter().count())
            .isEqualTo(1.0);
        assertThat(registry.get(COMMISSION_JOB_DURATION_METRIC_NAME).timer().count()).isEqualTo(1);
        assertThat(metrics.getActiveJob()).isEqualTo(0.0);
    }

    @Test
    void testRejectedRequestIsCountedByOutcome() {
        metrics.recordRejected(new ActiveJobException("commissionEvent: [n1]"), "service-worker");
        metrics.recordRejected(new TopologyException("no master"), null);

        assertThat(registry.get(COMMISSION_REQUESTS_COUNT_METRIC_NAME).tag(OUTCOME_TAG, OUTCOME_CONFLICT)
            .counter().count()).isEqualTo(1.0);
        assertThat(registry.get(COMMISSION_REQUESTS_COUNT_METRIC_NAME).tag(OUTCOME_TAG, OUTCOME_TOPOLOGY_ERROR)
            .tag(HOST_GROUP_TAG, "").counter().count()).isEqualTo(1.0);
    }

    @Test
    void testOutcomeOfEachFailure() {
        assertThat(CommissionMetrics.outcomeOf(new NodeNotFoundException("n1"))).isEqualTo(OUTCOME_VALIDATION_ERROR);
        assertThat(CommissionMetrics.outcomeOf(new StatusTransitionException("busy")))
            .isEqualTo(OUTCOME_STATUS_TRANSITION_ERROR);
        assertThat(CommissionMetrics.outcomeOf(new ClusterManagerException("boom"))).isEqualTo(OUTCOME_INTERNAL_ERROR);
        assertThat(CommissionMetrics.outcomeOf(new IllegalStateException("boom"))).isEqualTo(OUTCOME_INTERNAL_ERROR);
    }
}
