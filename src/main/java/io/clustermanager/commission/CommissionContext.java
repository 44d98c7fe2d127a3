package io.clustermanager.commission;

import io.clustermanager.configuration.ConfigurationEngine;
import io.clustermanager.inventory.AssetStatusTracker;
import io.clustermanager.jobs.ActiveJobGate;
import io.clustermanager.metrics.CommissionMetrics;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Shared collaborators of commission events. One instance per manager.
 */
@Getter
@AllArgsConstructor
public class CommissionContext {

    private final ActiveJobGate jobGate;
    private final NodeValidator nodeValidator;
    private final TopologyAssigner topologyAssigner;
    private final AssetStatusTracker statusTracker;
    private final ConfigurationEngine configurationEngine;
    private final CommissionMetrics metrics;
}
