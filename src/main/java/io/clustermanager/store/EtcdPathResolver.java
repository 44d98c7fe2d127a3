package io.clustermanager.store;

import java.nio.file.Paths;

import static io.clustermanager.config.Constants.PATH_ASSETS;
import static io.clustermanager.config.Constants.PATH_DELIMITER;

/**
 * etcd key layout of the cluster manager.
 * Stateless singleton.
 */
public class EtcdPathResolver {

    private static final EtcdPathResolver INSTANCE = new EtcdPathResolver();

    private EtcdPathResolver() {
    }

    public static EtcdPathResolver getInstance() {
        return INSTANCE;
    }

    /**
     * Get prefix for all assets
     * Pattern: /<cluster-name>/assets
     */
    public String getAssetsPrefix(String clusterName) {
        return Paths.get(PATH_DELIMITER, clusterName, PATH_ASSETS).toString();
    }

    /**
     * Get path for the asset record of a node
     * Pattern: /<cluster-name>/assets/<node-name>
     */
    public String getAssetPath(String clusterName, String nodeName) {
        return Paths.get(getAssetsPrefix(clusterName), nodeName).toString();
    }
}
