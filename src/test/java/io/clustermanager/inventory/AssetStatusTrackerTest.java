package io.clustermanager.inventory;

import io.clustermanager.enums.AssetStatus;
import io.clustermanager.exceptions.StatusTransitionException;
import io.clustermanager.models.AssetTransitionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class AssetStatusTrackerTest {

    private InMemoryAssetInventory inventory;
    private AssetStatusTracker tracker;

    @BeforeEach
    void setUp() throws Exception {
        inventory = new InMemoryAssetInventory();
        inventory.addAsset("n1");
        inventory.addAsset("n2");
        inventory.addAsset("n3");
        tracker = new AssetStatusTracker(inventory);
    }

    @Test
    void testAtomicMovesAllNodes() throws Exception {
        tracker.setAssetsStatusAtomic(List.of("n1", "n2"),
            AssetStatus.UNALLOCATED, AssetStatus.PROVISIONING, AssetStatus.UNALLOCATED);

        assertThat(inventory.getAssetStatus("n1")).isEqualTo(AssetStatus.PROVISIONING);
        assertThat(inventory.getAssetStatus("n2")).isEqualTo(AssetStatus.PROVISIONING);
        assertThat(inventory.getAssetStatus("n3")).isEqualTo(AssetStatus.UNALLOCATED);
    }

    @Test
    void testAtomicChangesNothingWhenOneNodeIsNotInExpectedStatus() throws Exception {
        inventory.setAssetProvisioning("n2");
        inventory.setAssetCommissioned("n2");

        assertThatThrownBy(() -> tracker.setAssetsStatusAtomic(List.of("n1", "n2"),
                AssetStatus.UNALLOCATED, AssetStatus.PROVISIONING, AssetStatus.UNALLOCATED))
            .isInstanceOf(StatusTransitionException.class)
            .hasMessageContaining("asset n2 is in status COMMISSIONED");

        assertThat(inventory.getAssetStatus("n1")).isEqualTo(AssetStatus.UNALLOCATED);
        assertThat(inventory.getAssetStatus("n2")).isEqualTo(AssetStatus.COMMISSIONED);
    }

    @Test
    void testAtomicRollsBackAppliedNodesWhenAWriteFails() throws Exception {
        InMemoryAssetInventory failing = spy(inventory);
        doCallRealMethod().when(failing).transition(eq("n1"), eq(AssetStatus.UNALLOCATED), eq(AssetStatus.PROVISIONING));
        doThrow(new StatusTransitionException("store unavailable"))
            .when(failing).transition(eq("n2"), eq(AssetStatus.UNALLOCATED), eq(AssetStatus.PROVISIONING));
        AssetStatusTracker failingTracker = new AssetStatusTracker(failing);

        assertThatThrownBy(() -> failingTracker.setAssetsStatusAtomic(List.of("n1", "n2"),
                AssetStatus.UNALLOCATED, AssetStatus.PROVISIONING, AssetStatus.UNALLOCATED))
            .isInstanceOf(StatusTransitionException.class)
            .hasMessageContaining("store unavailable");

        assertThat(failing.getAssetStatus("n1")).isEqualTo(AssetStatus.UNALLOCATED);
        assertThat(failing.getAssetStatus("n2")).isEqualTo(AssetStatus.UNALLOCATED);
    }

    @Test
    void testAtomicFailsForUnknownNode() {
        assertThatThrownBy(() -> tracker.setAssetsStatusAtomic(List.of("n1", "missing"),
                AssetStatus.UNALLOCATED, AssetStatus.PROVISIONING, AssetStatus.UNALLOCATED))
            .isInstanceOf(StatusTransitionException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void testBestEffortContinuesPastFailures() throws Exception {
        inventory.setAssetProvisioning("n1");
        inventory.setAssetProvisioning("n3");

        List<AssetTransitionResult> results = tracker.setAssetsStatusBestEffort(List.of("n1", "n2", "n3"),
            AssetStatus.PROVISIONING, AssetStatus.COMMISSIONED);

        assertThat(results).extracting(AssetTransitionResult::getNodeName).containsExactly("n1", "n2", "n3");
        assertThat(results).extracting(AssetTransitionResult::isSucceeded).containsExactly(true, false, true);
        assertThat(AssetStatusTracker.logFailures(results)).isEqualTo(1);
        assertThat(inventory.getAssetStatus("n1")).isEqualTo(AssetStatus.COMMISSIONED);
        assertThat(inventory.getAssetStatus("n2")).isEqualTo(AssetStatus.UNALLOCATED);
        assertThat(inventory.getAssetStatus("n3")).isEqualTo(AssetStatus.COMMISSIONED);
    }
}
