package io.clustermanager.registry;

import io.clustermanager.configuration.AnsibleHost;
import io.clustermanager.enums.AssetStatus;
import io.clustermanager.enums.DiscoveryState;
import io.clustermanager.exceptions.NodeNotFoundException;
import io.clustermanager.inventory.AssetInventory;
import io.clustermanager.models.Node;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NodeRegistryTest {

    @Mock
    private AssetInventory inventory;

    private NodeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new NodeRegistry(inventory);
    }

    private static Node node(String name, DiscoveryState state, String group) {
        AnsibleHost host = AnsibleHost.forNode(name, "10.0.0." + name.length());
        host.setGroup(group);
        return new Node(name, host.getAddress(), state, host);
    }

    @Test
    void testNodesKeepRegistrationOrder() {
        registry.upsertNode(node("b", DiscoveryState.DISCOVERED, ""));
        registry.upsertNode(node("a", DiscoveryState.DISCOVERED, ""));
        registry.upsertNode(node("b", DiscoveryState.DISAPPEARED, ""));

        assertThat(registry.getNodes()).extracting(Node::getName).containsExactly("b", "a");
        assertThat(registry.getNode("b")).get().extracting(Node::getDiscoveryState).isEqualTo(DiscoveryState.DISAPPEARED);
    }

    @Test
    void testUpsertRequiresName() {
        assertThatThrownBy(() -> registry.upsertNode(new Node(" ", "10.0.0.1", DiscoveryState.DISCOVERED, null)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testRemoveNode() {
        registry.upsertNode(node("a", DiscoveryState.DISCOVERED, ""));

        assertThat(registry.removeNode("a")).isTrue();
        assertThat(registry.removeNode("a")).isFalse();
        assertThat(registry.getNode("a")).isEmpty();
    }

    @Test
    void testFindNodeThrowsForUnknownNode() {
        assertThatThrownBy(() -> registry.findNode("missing"))
            .isInstanceOf(NodeNotFoundException.class)
            .hasMessage("node with name missing doesn't exist");
    }

    @Test
    void testDiscoveredAndAllocated() throws Exception {
        registry.upsertNode(node("m1", DiscoveryState.DISCOVERED, "service-master"));
        when(inventory.getAssetStatus("m1")).thenReturn(AssetStatus.COMMISSIONED);

        assertThat(registry.isDiscoveredAndAllocated("m1")).isTrue();

        when(inventory.getAssetStatus("m1")).thenReturn(AssetStatus.PROVISIONING);
        assertThat(registry.isDiscoveredAndAllocated("m1")).isFalse();
    }

    @Test
    void testNotDiscoveredNodeIsNotAllocated() throws Exception {
        registry.upsertNode(node("m1", DiscoveryState.DISAPPEARED, "service-master"));

        assertThat(registry.isDiscoveredAndAllocated("m1")).isFalse();
        verify(inventory, never()).getAssetStatus("m1");
    }

    @Test
    void testIsMasterNode() throws Exception {
        registry.upsertNode(node("m1", DiscoveryState.DISCOVERED, "service-master"));
        registry.upsertNode(node("w1", DiscoveryState.DISCOVERED, "service-worker"));
        registry.upsertNode(new Node("bare", "10.0.0.9", DiscoveryState.DISCOVERED, null));

        assertThat(registry.isMasterNode("m1")).isTrue();
        assertThat(registry.isMasterNode("w1")).isFalse();
        assertThatThrownBy(() -> registry.isMasterNode("bare"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("configuration info for node bare");
    }
}
