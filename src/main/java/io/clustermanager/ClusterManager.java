package io.clustermanager;

import io.clustermanager.commission.CommissionContext;
import io.clustermanager.commission.CommissionEvent;
import io.clustermanager.enums.AssetStatus;
import io.clustermanager.exceptions.ClusterManagerException;
import io.clustermanager.inventory.AssetInventory;
import io.clustermanager.jobs.ActiveJobGate;
import io.clustermanager.models.JobInfo;
import io.clustermanager.models.Node;
import io.clustermanager.registry.NodeRegistry;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for cluster operations: node registration, commissioning and job control.
 */
public class ClusterManager implements AutoCloseable {

    private final CommissionContext context;
    private final NodeRegistry registry;
    private final AssetInventory inventory;
    private final String defaultExtraVars;

    public ClusterManager(CommissionContext context, NodeRegistry registry, AssetInventory inventory,
                          String defaultExtraVars) {
        this.context = context;
        this.registry = registry;
        this.inventory = inventory;
        this.defaultExtraVars = defaultExtraVars;
    }

    /**
     * Commission {@code nodeNames} into {@code hostGroup}. Returns once the configuration job is launched.
     *
     * @param extraVars extra variables for the playbooks, the configured default when blank
     * @return the launched event, to follow its state and completion
     */
    public CommissionEvent commission(List<String> nodeNames, String extraVars, String hostGroup)
            throws ClusterManagerException {
        String vars = extraVars == null || extraVars.isBlank() ? defaultExtraVars : extraVars;
        CommissionEvent event = new CommissionEvent(context, nodeNames, vars, hostGroup);
        try {
            event.process();
        } catch (ClusterManagerException | RuntimeException e) {
            context.getMetrics().recordRejected(e, hostGroup);
            throw e;
        }
        context.getMetrics().recordAccepted(hostGroup);
        return event;
    }

    /**
     * Add or update a node and make sure it has an asset record. New assets start UNALLOCATED.
     */
    public void registerNode(Node node) throws Exception {
        registry.upsertNode(node);
        inventory.addAsset(node.getName());
    }

    public List<Node> getNodes() {
        return registry.getNodes();
    }

    public Optional<Node> getNode(String name) {
        return registry.getNode(name);
    }

    public AssetStatus getAssetStatus(String name) throws Exception {
        return inventory.getAssetStatus(name);
    }

    public Optional<JobInfo> getActiveJob() {
        return context.getJobGate().getActiveJob();
    }

    public Optional<JobInfo> getLastJob() {
        return context.getJobGate().getLastJob();
    }

    public boolean cancelActiveJob() {
        return context.getJobGate().cancelActiveJob();
    }

    @Override
    public void close() {
        ActiveJobGate gate = context.getJobGate();
        gate.cancelActiveJob();
        gate.close();
    }
}
