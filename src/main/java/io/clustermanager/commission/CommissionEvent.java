package io.clustermanager.commission;

import io.clustermanager.configuration.HostConfiguration;
import io.clustermanager.enums.AssetStatus;
import io.clustermanager.enums.HostGroup;
import io.clustermanager.enums.JobStatus;
import io.clustermanager.exceptions.ClusterManagerException;
import io.clustermanager.exceptions.ValidationException;
import io.clustermanager.inventory.AssetStatusTracker;
import io.clustermanager.jobs.ActiveJobGate;
import io.clustermanager.models.AssetTransitionResult;
import io.clustermanager.models.JobInfo;
import io.clustermanager.models.Node;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static io.clustermanager.config.Constants.ANSIBLE_ETCD_MASTER_ADDR_HOST_VAR;
import static io.clustermanager.config.Constants.ANSIBLE_ETCD_MASTER_NAME_HOST_VAR;

/**
 * Commissions a set of nodes into a host group.
 *
 * {@link #process()} does the synchronous part of the workflow while holding the active job gate:
 * validation, topology assignment and the PROVISIONING transition. The configuration itself runs
 * as the gate's background job; its outcome commits the nodes to COMMISSIONED or rolls them back
 * to UNALLOCATED.
 */
@Slf4j
public class CommissionEvent {

    private final CommissionContext context;
    private final List<String> nodeNames;
    private final String extraVars;
    private final String hostGroup;

    private volatile CommissionState state = CommissionState.CREATED;
    private volatile List<HostConfiguration> hosts = Collections.emptyList();
    private volatile Map<String, Node> eventNodes = Collections.emptyMap();
    private volatile CompletableFuture<JobStatus> completion;
    private volatile String jobId;

    public CommissionEvent(CommissionContext context, Collection<String> nodeNames, String extraVars, String hostGroup) {
        this.context = context;
        this.nodeNames = nodeNames == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(nodeNames)));
        this.extraVars = extraVars;
        this.hostGroup = hostGroup;
    }

    /**
     * Start the commission. Returns once the configuration job is launched.
     *
     * @throws io.clustermanager.exceptions.ActiveJobException if another job is active
     * @throws ValidationException if the host group or the nodes are invalid
     * @throws io.clustermanager.exceptions.TopologyException if a worker is requested without a master
     * @throws io.clustermanager.exceptions.StatusTransitionException if any node is not UNALLOCATED
     * @throws ClusterManagerException if the job couldn't be launched
     */
    public void process() throws ClusterManagerException {
        ActiveJobGate gate = context.getJobGate();
        // hosts are filled in before the job is launched, the runner reads them lazily
        gate.checkAndSetActiveJob(toString(),
            (cancellation, jobLogs) -> new ConfigureOrCleanupRunner(context.getConfigurationEngine(), hosts, extraVars)
                .run(cancellation, jobLogs),
            this::onJobComplete);
        jobId = gate.getActiveJob().map(JobInfo::getId).orElse(null);

        try {
            state = CommissionState.VALIDATING;
            HostGroup group = HostGroup.fromString(hostGroup);
            if (group == null) {
                throw new ValidationException(String.format("invalid or empty host-group specified: \"%s\"",
                    hostGroup == null ? "" : hostGroup));
            }
            eventNodes = context.getNodeValidator().validateForEvent(nodeNames);

            state = CommissionState.PREPARING_INVENTORY;
            hosts = Collections.unmodifiableList(context.getTopologyAssigner().assign(eventNodes, group));

            state = CommissionState.SETTING_PROVISIONING;
            context.getStatusTracker().setAssetsStatusAtomic(nodeNames,
                AssetStatus.UNALLOCATED, AssetStatus.PROVISIONING, AssetStatus.UNALLOCATED);
        } catch (ClusterManagerException | RuntimeException e) {
            reject(e);
            throw e;
        }

        state = CommissionState.RUNNING;
        context.getMetrics().recordJobStarted();
        try {
            completion = gate.runActiveJob();
        } catch (IllegalStateException e) {
            // the gate already released itself, only the assets need to go back
            state = CommissionState.REJECTED;
            context.getMetrics().recordJobNotLaunched();
            AssetStatusTracker.logFailures(context.getStatusTracker().setAssetsStatusBestEffort(
                nodeNames, AssetStatus.PROVISIONING, AssetStatus.UNALLOCATED));
            throw new ClusterManagerException("failed to launch the commission job: " + e.getMessage(), e);
        }
        log.info("{} launched for host group {}", this, hostGroup);
    }

    public CommissionState getState() {
        return state;
    }

    public List<String> getNodeNames() {
        return nodeNames;
    }

    public List<HostConfiguration> getHosts() {
        return hosts;
    }

    public String getJobId() {
        return jobId;
    }

    public String getHostGroup() {
        return hostGroup;
    }

    /**
     * Completes with the job's terminal status after the assets were committed or rolled back.
     * Null until {@link #process()} launched the job.
     */
    public CompletableFuture<JobStatus> getCompletion() {
        return completion;
    }

    @Override
    public String toString() {
        return "commissionEvent: " + nodeNames;
    }

    private void reject(Exception e) {
        log.info("{} rejected in state {}: {}", this, state, e.getMessage());
        state = CommissionState.REJECTED;
        context.getJobGate().resetActiveJob();
    }

    /**
     * Copy the configured group and master variables onto the registry's nodes that were committed.
     */
    private void recordMembership(List<AssetTransitionResult> results) {
        // hosts were built in event node order
        Map<String, HostConfiguration> configured = new HashMap<>();
        int i = 0;
        for (String name : eventNodes.keySet()) {
            configured.put(name, hosts.get(i++));
        }
        for (AssetTransitionResult result : results) {
            Node node = eventNodes.get(result.getNodeName());
            HostConfiguration host = configured.get(result.getNodeName());
            if (!result.isSucceeded() || node == null || node.getHostConfig() == null || host == null) {
                continue;
            }
            HostConfiguration registered = node.getHostConfig();
            registered.setGroup(host.getGroup());
            registered.setVar(ANSIBLE_ETCD_MASTER_ADDR_HOST_VAR, host.getVars().get(ANSIBLE_ETCD_MASTER_ADDR_HOST_VAR));
            registered.setVar(ANSIBLE_ETCD_MASTER_NAME_HOST_VAR, host.getVars().get(ANSIBLE_ETCD_MASTER_NAME_HOST_VAR));
        }
    }

    private void onJobComplete(JobStatus status, Throwable error) {
        AssetStatusTracker tracker = context.getStatusTracker();
        if (status == JobStatus.ERRORED) {
            state = CommissionState.ROLLING_BACK;
            log.error("{} failed, setting assets back to {}. Error: {}", this, AssetStatus.UNALLOCATED,
                error == null ? "unknown" : error.getMessage());
            AssetStatusTracker.logFailures(tracker.setAssetsStatusBestEffort(
                nodeNames, AssetStatus.PROVISIONING, AssetStatus.UNALLOCATED));
        } else {
            state = CommissionState.COMMITTING;
            log.info("{} completed, setting assets to {}", this, AssetStatus.COMMISSIONED);
            List<AssetTransitionResult> results = tracker.setAssetsStatusBestEffort(
                nodeNames, AssetStatus.PROVISIONING, AssetStatus.COMMISSIONED);
            AssetStatusTracker.logFailures(results);
            recordMembership(results);
        }
        state = CommissionState.DONE;

        context.getJobGate().getActiveJob().ifPresent(job ->
            context.getMetrics().recordJobFinished(status, Duration.between(job.getStartTime(),
                job.getEndTime() == null ? Instant.now() : job.getEndTime())));
    }
}
