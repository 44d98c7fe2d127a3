package io.clustermanager.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_MANAGER_ID = "cluster-manager";
    public static final String DEFAULT_CLUSTER_NAME = "default";
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final long DEFAULT_JOB_SHUTDOWN_TIMEOUT_SECONDS = 30L;

    // Inventory backends
    public static final String INVENTORY_BACKEND_MEMORY = "memory";
    public static final String INVENTORY_BACKEND_ETCD = "etcd";

    // Ansible defaults
    public static final String DEFAULT_ANSIBLE_PLAYBOOK_LOCATION = "/etc/cluster-manager/ansible";
    public static final String DEFAULT_ANSIBLE_CONFIGURE_PLAYBOOK = "site.yml";
    public static final String DEFAULT_ANSIBLE_CLEANUP_PLAYBOOK = "cleanup.yml";
    public static final String DEFAULT_ANSIBLE_USER = "cluster-admin";
    public static final String DEFAULT_ANSIBLE_PRIVATE_KEY_FILE = "/etc/cluster-manager/id_rsa";
    public static final String DEFAULT_ANSIBLE_EXTRA_VARS = "{}";
    public static final String ANSIBLE_PLAYBOOK_COMMAND = "ansible-playbook";

    // Ansible host variables
    public static final String ANSIBLE_ETCD_MASTER_ADDR_HOST_VAR = "etcd_master_addr";
    public static final String ANSIBLE_ETCD_MASTER_NAME_HOST_VAR = "etcd_master_name";
    public static final String ANSIBLE_NODE_NAME_HOST_VAR = "node_name";
    public static final String ANSIBLE_NODE_ADDR_HOST_VAR = "node_addr";

    // etcd path segments
    public static final String PATH_DELIMITER = "/";
    public static final String PATH_ASSETS = "assets";
}
