package io.clustermanager.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.clustermanager.enums.AssetStatus;
import io.clustermanager.exceptions.StatusTransitionException;
import io.clustermanager.inventory.AssetInventory;
import io.clustermanager.models.AssetRecord;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * etcd-based asset inventory. Each asset is a JSON {@link AssetRecord} under
 * /<cluster-name>/assets/<node-name>; status changes are compare-and-swap transactions
 * on the key's mod revision.
 */
@Slf4j
public class EtcdAssetInventory implements AssetInventory, AutoCloseable {

    private static final long ETCD_OPERATION_TIMEOUT_SECONDS = 5;

    private final String clusterName;
    private final Client etcdClient;
    private final KV kvClient;
    private final EtcdPathResolver pathResolver;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public EtcdAssetInventory(String[] etcdEndpoints, String clusterName) {
        this(Client.builder().endpoints(etcdEndpoints).build(), clusterName);
        log.info("EtcdAssetInventory initialized with endpoints: {} for cluster: {}",
            String.join(",", etcdEndpoints), clusterName);
    }

    private EtcdAssetInventory(Client etcdClient, String clusterName) {
        this(etcdClient, etcdClient.getKVClient(), clusterName, Clock.systemUTC());
    }

    /**
     * Test constructor with injected dependencies
     */
    EtcdAssetInventory(Client etcdClient, KV kvClient, String clusterName, Clock clock) {
        this.clusterName = clusterName;
        this.etcdClient = etcdClient;
        this.kvClient = kvClient;
        this.clock = clock;
        this.pathResolver = EtcdPathResolver.getInstance();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public boolean addAsset(String name) throws Exception {
        ByteSequence key = key(name);
        ByteSequence value = value(new AssetRecord(name, AssetStatus.UNALLOCATED, clock.instant()));

        // create only if the key doesn't exist yet
        TxnResponse txnResponse = kvClient.txn()
            .If(new Cmp(key, Cmp.Op.EQUAL, CmpTarget.version(0)))
            .Then(Op.put(key, value, PutOption.DEFAULT))
            .commit()
            .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);

        if (txnResponse.isSucceeded()) {
            log.info("Added asset {} as {}", name, AssetStatus.UNALLOCATED);
        }
        return txnResponse.isSucceeded();
    }

    @Override
    public AssetStatus getAssetStatus(String name) throws Exception {
        KeyValue kv = getAsset(name);
        return readRecord(kv).getStatus();
    }

    @Override
    public Map<String, AssetStatus> getAllAssetStatuses() throws Exception {
        String prefix = pathResolver.getAssetsPrefix(clusterName);
        GetOption option = GetOption.newBuilder().withPrefix(ByteSequence.from(prefix, UTF_8)).build();
        GetResponse response = kvClient.get(ByteSequence.from(prefix, UTF_8), option)
            .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);

        Map<String, AssetStatus> statuses = new LinkedHashMap<>();
        for (KeyValue kv : response.getKvs()) {
            try {
                AssetRecord record = readRecord(kv);
                statuses.put(record.getName(), record.getStatus());
            } catch (Exception e) {
                log.warn("Failed to parse asset record at {}: {}", kv.getKey().toString(UTF_8), e.getMessage());
            }
        }
        return statuses;
    }

    @Override
    public void transition(String name, AssetStatus expected, AssetStatus target) throws Exception {
        KeyValue kv = getAsset(name);
        AssetRecord current = readRecord(kv);
        if (current.getStatus() != expected) {
            throw new StatusTransitionException(String.format(
                "asset %s is in status %s, expected %s", name, current.getStatus(), expected));
        }
        if (!current.getStatus().canTransitionTo(target)) {
            throw new StatusTransitionException(String.format(
                "asset %s can't move from %s to %s", name, current.getStatus(), target));
        }

        ByteSequence key = key(name);
        ByteSequence value = value(new AssetRecord(name, target, clock.instant()));

        // Use Compare-And-Swap (CAS) on mod_revision so a concurrent writer can't be overwritten
        TxnResponse txnResponse = kvClient.txn()
            .If(new Cmp(key, Cmp.Op.EQUAL, CmpTarget.modRevision(kv.getModRevision())))
            .Then(Op.put(key, value, PutOption.DEFAULT))
            .commit()
            .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);

        if (!txnResponse.isSucceeded()) {
            throw new StatusTransitionException(String.format(
                "asset %s was modified concurrently while moving to %s", name, target));
        }
        log.debug("Asset {} moved from {} to {}", name, expected, target);
    }

    @Override
    public void close() {
        if (etcdClient != null) {
            etcdClient.close();
            log.info("etcd client closed");
        }
    }

    private KeyValue getAsset(String name) throws Exception {
        GetResponse response = kvClient.get(key(name)).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (response.getCount() == 0) {
            throw new StatusTransitionException(String.format("asset %s doesn't exist", name));
        }
        return response.getKvs().get(0);
    }

    private AssetRecord readRecord(KeyValue kv) throws Exception {
        return objectMapper.readValue(kv.getValue().toString(UTF_8), AssetRecord.class);
    }

    private ByteSequence key(String name) {
        return ByteSequence.from(pathResolver.getAssetPath(clusterName, name), UTF_8);
    }

    private ByteSequence value(AssetRecord record) throws Exception {
        return ByteSequence.from(objectMapper.writeValueAsString(record), UTF_8);
    }
}
