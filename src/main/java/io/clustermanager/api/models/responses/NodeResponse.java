package io.clustermanager.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.clustermanager.configuration.HostConfiguration;
import io.clustermanager.enums.AssetStatus;
import io.clustermanager.enums.DiscoveryState;
import io.clustermanager.models.Node;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Node as reported by the info endpoints: registry record plus asset status.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NodeResponse {
    private String name;
    private String address;
    private DiscoveryState discoveryState;
    private String tag;
    private String group;
    private Map<String, String> vars;
    private AssetStatus assetStatus;

    public static NodeResponse from(Node node, AssetStatus assetStatus) {
        NodeResponseBuilder builder = NodeResponse.builder()
            .name(node.getName())
            .address(node.getMgmtAddress())
            .discoveryState(node.getDiscoveryState())
            .assetStatus(assetStatus);
        HostConfiguration host = node.getHostConfig();
        if (host != null) {
            builder.tag(host.getTag()).group(host.getGroup()).vars(host.getVars());
        }
        return builder.build();
    }
}
