package io.clustermanager.inventory;

import io.clustermanager.enums.AssetStatus;
import io.clustermanager.exceptions.StatusTransitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryAssetInventoryTest {

    private InMemoryAssetInventory inventory;

    @BeforeEach
    void setUp() {
        inventory = new InMemoryAssetInventory();
    }

    @Test
    void testAddAssetStartsUnallocated() throws Exception {
        assertThat(inventory.addAsset("n1")).isTrue();
        assertThat(inventory.addAsset("n1")).isFalse();

        assertThat(inventory.getAssetStatus("n1")).isEqualTo(AssetStatus.UNALLOCATED);
    }

    @Test
    void testLifecycleTransitions() throws Exception {
        inventory.addAsset("n1");

        inventory.setAssetProvisioning("n1");
        assertThat(inventory.getAssetStatus("n1")).isEqualTo(AssetStatus.PROVISIONING);
        inventory.setAssetCommissioned("n1");
        assertThat(inventory.getAssetStatus("n1")).isEqualTo(AssetStatus.COMMISSIONED);
    }

    @Test
    void testRollbackFromProvisioning() throws Exception {
        inventory.addAsset("n1");
        inventory.setAssetProvisioning("n1");

        inventory.setAssetUnallocated("n1");

        assertThat(inventory.getAssetStatus("n1")).isEqualTo(AssetStatus.UNALLOCATED);
    }

    @Test
    void testUnexpectedCurrentStatusIsRejected() throws Exception {
        inventory.addAsset("n1");

        assertThatThrownBy(() -> inventory.setAssetCommissioned("n1"))
            .isInstanceOf(StatusTransitionException.class)
            .hasMessageContaining("expected PROVISIONING");
        assertThat(inventory.getAssetStatus("n1")).isEqualTo(AssetStatus.UNALLOCATED);
    }

    @Test
    void testIllegalTransitionIsRejected() throws Exception {
        inventory.addAsset("n1");
        inventory.setAssetProvisioning("n1");
        inventory.setAssetCommissioned("n1");

        assertThatThrownBy(() -> inventory.transition("n1", AssetStatus.COMMISSIONED, AssetStatus.UNALLOCATED))
            .isInstanceOf(StatusTransitionException.class)
            .hasMessageContaining("can't move from COMMISSIONED to UNALLOCATED");
    }

    @Test
    void testUnknownAsset() {
        assertThatThrownBy(() -> inventory.getAssetStatus("missing"))
            .isInstanceOf(StatusTransitionException.class)
            .hasMessageContaining("asset missing doesn't exist");
    }

    @Test
    void testGetAllAssetStatusesKeepsInsertionOrder() throws Exception {
        inventory.addAsset("n2");
        inventory.addAsset("n1");
        inventory.setAssetProvisioning("n1");

        assertThat(inventory.getAllAssetStatuses())
            .containsExactly(
                org.assertj.core.api.Assertions.entry("n2", AssetStatus.UNALLOCATED),
                org.assertj.core.api.Assertions.entry("n1", AssetStatus.PROVISIONING));
    }
}
