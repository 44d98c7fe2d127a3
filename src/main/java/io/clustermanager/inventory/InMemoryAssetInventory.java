package io.clustermanager.inventory;

import io.clustermanager.enums.AssetStatus;
import io.clustermanager.exceptions.StatusTransitionException;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Asset inventory kept in process memory. State is lost on restart.
 */
@Slf4j
public class InMemoryAssetInventory implements AssetInventory {

    private final Map<String, AssetStatus> assets = new LinkedHashMap<>();

    @Override
    public synchronized boolean addAsset(String name) {
        if (assets.containsKey(name)) {
            return false;
        }
        assets.put(name, AssetStatus.UNALLOCATED);
        log.info("Added asset {} as {}", name, AssetStatus.UNALLOCATED);
        return true;
    }

    @Override
    public synchronized AssetStatus getAssetStatus(String name) throws StatusTransitionException {
        AssetStatus status = assets.get(name);
        if (status == null) {
            throw new StatusTransitionException(String.format("asset %s doesn't exist", name));
        }
        return status;
    }

    @Override
    public synchronized Map<String, AssetStatus> getAllAssetStatuses() {
        return new LinkedHashMap<>(assets);
    }

    @Override
    public synchronized void transition(String name, AssetStatus expected, AssetStatus target)
            throws StatusTransitionException {
        AssetStatus current = getAssetStatus(name);
        if (current != expected) {
            throw new StatusTransitionException(String.format(
                "asset %s is in status %s, expected %s", name, current, expected));
        }
        if (!current.canTransitionTo(target)) {
            throw new StatusTransitionException(String.format(
                "asset %s can't move from %s to %s", name, current, target));
        }
        assets.put(name, target);
        log.debug("Asset {} moved from {} to {}", name, current, target);
    }
}
