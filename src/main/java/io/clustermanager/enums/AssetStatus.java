package io.clustermanager.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Allocation state of a node's asset record in the inventory.
 *
 * <ul>
 *   <li><strong>UNALLOCATED</strong> - Node is known but not part of the cluster; eligible for commissioning</li>
 *   <li><strong>PROVISIONING</strong> - A commission job is configuring the node</li>
 *   <li><strong>COMMISSIONED</strong> - Node is an active cluster member</li>
 *   <li><strong>ERRORED</strong> - Node was marked broken outside of the commission workflow</li>
 * </ul>
 */
public enum AssetStatus {
    UNALLOCATED,
    PROVISIONING,
    COMMISSIONED,
    ERRORED;

    /**
     * Whether moving from this status to {@code target} is a legal asset transition.
     * Only UNALLOCATED -> PROVISIONING, PROVISIONING -> COMMISSIONED and
     * PROVISIONING -> UNALLOCATED are allowed.
     */
    public boolean canTransitionTo(AssetStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<AssetStatus> allowedTargets() {
        switch (this) {
            case UNALLOCATED:
                return EnumSet.of(PROVISIONING);
            case PROVISIONING:
                return EnumSet.of(COMMISSIONED, UNALLOCATED);
            default:
                return EnumSet.noneOf(AssetStatus.class);
        }
    }
}
