package io.clustermanager.inventory;

import io.clustermanager.enums.AssetStatus;
import io.clustermanager.exceptions.StatusTransitionException;
import io.clustermanager.models.AssetTransitionResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Status changes over sets of nodes, on top of an {@link AssetInventory}.
 *
 * Writes from the commission workflow go through here, never to the inventory directly.
 */
@Slf4j
public class AssetStatusTracker {

    private final AssetInventory inventory;

    public AssetStatusTracker(AssetInventory inventory) {
        this.inventory = inventory;
    }

    /**
     * Move every node from {@code expected} to {@code target}, or none of them.
     *
     * All nodes are checked before anything is written. If a write still fails, the nodes
     * already moved are put back to {@code rollbackTarget}.
     *
     * @throws StatusTransitionException if any node is not in {@code expected} status or a write fails
     */
    public void setAssetsStatusAtomic(Collection<String> names, AssetStatus expected, AssetStatus target,
                                      AssetStatus rollbackTarget) throws StatusTransitionException {
        log.info("Setting assets {} to {} (expected: {})", names, target, expected);

        for (String name : names) {
            AssetStatus current;
            try {
                current = inventory.getAssetStatus(name);
            } catch (StatusTransitionException e) {
                throw e;
            } catch (Exception e) {
                throw new StatusTransitionException(
                    String.format("failed to read status of asset %s: %s", name, e.getMessage()), e);
            }
            if (current != expected) {
                throw new StatusTransitionException(String.format(
                    "asset %s is in status %s, expected %s; no asset was changed", name, current, expected));
            }
        }

        List<String> applied = new ArrayList<>();
        for (String name : names) {
            try {
                inventory.transition(name, expected, target);
                applied.add(name);
            } catch (Exception e) {
                log.error("Failed to set asset {} to {}: {}. Rolling back {} asset(s) to {}",
                    name, target, e.getMessage(), applied.size(), rollbackTarget);
                logFailures(setAssetsStatusBestEffort(applied, target, rollbackTarget));
                throw new StatusTransitionException(
                    String.format("failed to set asset %s to %s: %s", name, target, e.getMessage()), e);
            }
        }
    }

    /**
     * Move each node from {@code expected} to {@code target} independently. A failure on
     * one node doesn't stop the others.
     *
     * @return one result per node, in input order
     */
    public List<AssetTransitionResult> setAssetsStatusBestEffort(Collection<String> names, AssetStatus expected,
                                                                 AssetStatus target) {
        List<AssetTransitionResult> results = new ArrayList<>();
        for (String name : names) {
            try {
                inventory.transition(name, expected, target);
                results.add(AssetTransitionResult.success(name, target));
            } catch (Exception e) {
                log.debug("Failed to set asset {} to {}: {}", name, target, e.getMessage());
                results.add(AssetTransitionResult.failure(name, target, e.getMessage()));
            }
        }
        return results;
    }

    /**
     * Log the failed entries of a best-effort batch.
     *
     * @return number of failed entries
     */
    public static int logFailures(List<AssetTransitionResult> results) {
        int failed = 0;
        for (AssetTransitionResult result : results) {
            if (!result.isSucceeded()) {
                failed++;
                log.error("Asset {} was not set to {}: {}", result.getNodeName(), result.getTarget(), result.getError());
            }
        }
        return failed;
    }
}
