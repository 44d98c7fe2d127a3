package io.clustermanager;

import io.clustermanager.commission.CommissionContext;
import io.clustermanager.commission.NodeValidator;
import io.clustermanager.commission.TopologyAssigner;
import io.clustermanager.config.ClusterManagerConfig;
import io.clustermanager.configuration.AnsibleConfigurationEngine;
import io.clustermanager.configuration.ConfigurationEngine;
import io.clustermanager.inventory.AssetInventory;
import io.clustermanager.inventory.AssetStatusTracker;
import io.clustermanager.inventory.InMemoryAssetInventory;
import io.clustermanager.jobs.ActiveJobGate;
import io.clustermanager.metrics.CommissionMetrics;
import io.clustermanager.metrics.MetricsProvider;
import io.clustermanager.registry.NodeRegistry;
import io.clustermanager.store.EtcdAssetInventory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Primary;

/**
 * Main Spring Boot application class for the Cluster Manager.
 *
 * Wires the commission workflow: node registry, asset inventory (in memory or etcd),
 * the active job gate and the Ansible configuration engine, behind the REST handlers.
 */
@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = "io.clustermanager")
public class ClusterManagerApplication {

    public static void main(String[] args) {
        log.info("Starting Cluster Manager Application with REST APIs");

        try {
            SpringApplication.run(ClusterManagerApplication.class, args);
            log.info("Cluster Manager with REST APIs started successfully");

        } catch (Exception e) {
            log.error("Failed to start Cluster Manager: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public ClusterManagerConfig config() {
        ClusterManagerConfig config = new ClusterManagerConfig();
        log.info("Loaded configuration");
        return config;
    }

    /**
     * AssetInventory bean, backend chosen by inventory.backend
     */
    @Bean
    public AssetInventory assetInventory(ClusterManagerConfig config) {
        if (!config.isEtcdInventory()) {
            log.info("Initializing in-memory AssetInventory");
            return new InMemoryAssetInventory();
        }
        log.info("Initializing etcd AssetInventory for cluster {}", config.getClusterName());
        try {
            return new EtcdAssetInventory(config.getEtcdEndpoints(), config.getClusterName());
        } catch (Exception e) {
            log.error("Failed to initialize AssetInventory: {}", e.getMessage(), e);
            throw new RuntimeException("AssetInventory initialization failed", e);
        }
    }

    @Bean
    public NodeRegistry nodeRegistry(AssetInventory assetInventory) {
        log.info("Initializing NodeRegistry");
        return new NodeRegistry(assetInventory);
    }

    @Bean
    public AssetStatusTracker assetStatusTracker(AssetInventory assetInventory) {
        return new AssetStatusTracker(assetInventory);
    }

    @Bean
    public ConfigurationEngine configurationEngine(ClusterManagerConfig config) {
        log.info("Initializing AnsibleConfigurationEngine with playbooks at {}", config.getAnsiblePlaybookLocation());
        return new AnsibleConfigurationEngine(config);
    }

    /**
     * ActiveJobGate bean, closed through the ClusterManager on shutdown
     */
    @Bean(destroyMethod = "")
    public ActiveJobGate activeJobGate(ClusterManagerConfig config) {
        return new ActiveJobGate(config.getJobShutdownTimeoutSeconds());
    }

    @Bean
    public CommissionMetrics commissionMetrics(MetricsProvider metricsProvider, ClusterManagerConfig config) {
        return new CommissionMetrics(metricsProvider, config.getClusterName());
    }

    /**
     * CommissionContext bean - shared collaborators of every commission event.
     */
    @Bean
    public CommissionContext commissionContext(ActiveJobGate activeJobGate, NodeRegistry nodeRegistry,
                                               AssetStatusTracker assetStatusTracker,
                                               ConfigurationEngine configurationEngine,
                                               CommissionMetrics commissionMetrics) {
        log.info("Initializing CommissionContext");
        return new CommissionContext(
            activeJobGate,
            new NodeValidator(nodeRegistry),
            new TopologyAssigner(nodeRegistry),
            assetStatusTracker,
            configurationEngine,
            commissionMetrics
        );
    }

    @Bean
    public ClusterManager clusterManager(CommissionContext commissionContext, NodeRegistry nodeRegistry,
                                         AssetInventory assetInventory, ClusterManagerConfig config) {
        log.info("Initializing ClusterManager for cluster {}", config.getClusterName());
        return new ClusterManager(commissionContext, nodeRegistry, assetInventory, config.getAnsibleExtraVars());
    }
}
