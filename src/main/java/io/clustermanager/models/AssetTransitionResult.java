package io.clustermanager.models;

import io.clustermanager.enums.AssetStatus;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Outcome of a status change for a single node in a best-effort batch.
 */
@Data
@AllArgsConstructor
public class AssetTransitionResult {
    private final String nodeName;
    private final AssetStatus target;
    private final boolean succeeded;
    private final String error;

    public static AssetTransitionResult success(String nodeName, AssetStatus target) {
        return new AssetTransitionResult(nodeName, target, true, null);
    }

    public static AssetTransitionResult failure(String nodeName, AssetStatus target, String error) {
        return new AssetTransitionResult(nodeName, target, false, error);
    }
}
