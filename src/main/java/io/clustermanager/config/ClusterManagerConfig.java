package io.clustermanager.config;

import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import static io.clustermanager.config.Constants.*;

/**
 * Configuration for the cluster manager.
 * Loads configuration from application.yml with fallbacks to constants.
 */
@Slf4j
@Getter
public class ClusterManagerConfig {

    private final String managerId;
    private final String clusterName;
    private final String inventoryBackend;
    private final String[] etcdEndpoints;
    private final String ansiblePlaybookLocation;
    private final String ansibleConfigurePlaybook;
    private final String ansibleCleanupPlaybook;
    private final String ansibleUser;
    private final String ansiblePrivateKeyFile;
    private final String ansibleExtraVars;
    private final long jobShutdownTimeoutSeconds;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "CLUSTER_MANAGER_CONFIG_FILE";

    public ClusterManagerConfig() {
        this(System.getenv(EXTERNAL_CONFIG_ENV_VAR), DEFAULT_CONFIG_FILE_CLASSPATH);
    }

    ClusterManagerConfig(String externalConfigPath, String classpathResource) {
        ConfigModel config = loadYamlConfig(externalConfigPath, classpathResource);

        Manager manager = config.getManager() != null ? config.getManager() : new Manager();
        Inventory inventory = config.getInventory() != null ? config.getInventory() : new Inventory();
        Ansible ansible = config.getAnsible() != null ? config.getAnsible() : new Ansible();
        Job job = config.getJob() != null ? config.getJob() : new Job();

        this.managerId = valueOrDefault(manager.getId(), DEFAULT_MANAGER_ID);
        this.clusterName = valueOrDefault(manager.getCluster(), DEFAULT_CLUSTER_NAME);
        this.inventoryBackend = parseInventoryBackend(inventory.getBackend());
        this.etcdEndpoints = parseEndpoints(config);
        this.ansiblePlaybookLocation = valueOrDefault(ansible.getPlaybook_location(), DEFAULT_ANSIBLE_PLAYBOOK_LOCATION);
        this.ansibleConfigurePlaybook = valueOrDefault(ansible.getConfigure_playbook(), DEFAULT_ANSIBLE_CONFIGURE_PLAYBOOK);
        this.ansibleCleanupPlaybook = valueOrDefault(ansible.getCleanup_playbook(), DEFAULT_ANSIBLE_CLEANUP_PLAYBOOK);
        this.ansibleUser = valueOrDefault(ansible.getUser(), DEFAULT_ANSIBLE_USER);
        this.ansiblePrivateKeyFile = valueOrDefault(ansible.getPrivate_key_file(), DEFAULT_ANSIBLE_PRIVATE_KEY_FILE);
        this.ansibleExtraVars = valueOrDefault(ansible.getExtra_vars(), DEFAULT_ANSIBLE_EXTRA_VARS);
        this.jobShutdownTimeoutSeconds = job.getShutdown_timeout_seconds() != null && job.getShutdown_timeout_seconds() > 0
            ? job.getShutdown_timeout_seconds()
            : DEFAULT_JOB_SHUTDOWN_TIMEOUT_SECONDS;

        log.info("Loaded cluster manager config - id: {}, cluster: {}, inventory: {}, etcd endpoints: {}, playbooks: {}",
                managerId, clusterName, inventoryBackend, String.join(", ", etcdEndpoints), ansiblePlaybookLocation);
    }

    public boolean isEtcdInventory() {
        return INVENTORY_BACKEND_ETCD.equals(inventoryBackend);
    }

    private ConfigModel loadYamlConfig(String externalConfigPath, String classpathResource) {
        Constructor constructor = new Constructor(ConfigModel.class, new LoaderOptions());
        // Keys that only Spring Boot reads (server, management, ...) are not part of the model
        constructor.getPropertyUtils().setSkipMissingProperties(true);
        Yaml yaml = new Yaml(constructor);
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check for an external config file path
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", classpathResource);
            inputStream = getClass().getClassLoader().getResourceAsStream(classpathResource);
            loadedFrom = "classpath (" + classpathResource + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", classpathResource);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
        try (InputStream in = inputStream) {
            ConfigModel config = yaml.load(in);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        }
    }

    private String parseInventoryBackend(String backend) {
        if (backend == null || backend.isBlank()) {
            return INVENTORY_BACKEND_MEMORY;
        }
        String normalized = backend.trim().toLowerCase();
        if (!INVENTORY_BACKEND_MEMORY.equals(normalized) && !INVENTORY_BACKEND_ETCD.equals(normalized)) {
            log.warn("Unknown inventory backend '{}', using '{}'", backend, INVENTORY_BACKEND_MEMORY);
            return INVENTORY_BACKEND_MEMORY;
        }
        return normalized;
    }

    private String[] parseEndpoints(ConfigModel config) {
        if (config.getEtcd() != null && config.getEtcd().getEndpoints() != null) {
            List<String> endpoints = config.getEtcd().getEndpoints();
            if (!endpoints.isEmpty()) {
                return endpoints.toArray(new String[0]);
            }
        }
        return new String[]{DEFAULT_ETCD_ENDPOINT};
    }

    private static String valueOrDefault(String value, String defaultValue) {
        return value != null && !value.isBlank() ? value : defaultValue;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Manager manager;
        private Inventory inventory;
        private Etcd etcd;
        private Ansible ansible;
        private Job job;
    }

    @Data
    public static class Manager {
        private String id;
        private String cluster;
    }

    @Data
    public static class Inventory {
        private String backend;
    }

    @Data
    public static class Etcd {
        private List<String> endpoints;
    }

    @Data
    public static class Ansible {
        private String playbook_location;
        private String configure_playbook;
        private String cleanup_playbook;
        private String user;
        private String private_key_file;
        private String extra_vars;
    }

    @Data
    public static class Job {
        private Long shutdown_timeout_seconds;
    }
}
