package io.clustermanager.inventory;

import io.clustermanager.enums.AssetStatus;

import java.util.Map;

/**
 * Persistence backend for node asset records (in-memory, etcd, ...).
 * Implementations reject transitions that {@link AssetStatus#canTransitionTo} does not allow.
 */
public interface AssetInventory {

    /**
     * Create an UNALLOCATED asset record for the node if none exists.
     *
     * @return true if a record was created
     */
    boolean addAsset(String name) throws Exception;

    /**
     * Current status of a node's asset
     *
     * @throws io.clustermanager.exceptions.StatusTransitionException if the asset doesn't exist
     */
    AssetStatus getAssetStatus(String name) throws Exception;

    /**
     * All asset records by node name
     */
    Map<String, AssetStatus> getAllAssetStatuses() throws Exception;

    /**
     * Move a node's asset from {@code expected} to {@code target}.
     *
     * @throws io.clustermanager.exceptions.StatusTransitionException if the asset is not in
     *         {@code expected} status or the transition is not legal
     */
    void transition(String name, AssetStatus expected, AssetStatus target) throws Exception;

    default void setAssetUnallocated(String name) throws Exception {
        transition(name, AssetStatus.PROVISIONING, AssetStatus.UNALLOCATED);
    }

    default void setAssetProvisioning(String name) throws Exception {
        transition(name, AssetStatus.UNALLOCATED, AssetStatus.PROVISIONING);
    }

    default void setAssetCommissioned(String name) throws Exception {
        transition(name, AssetStatus.PROVISIONING, AssetStatus.COMMISSIONED);
    }
}
