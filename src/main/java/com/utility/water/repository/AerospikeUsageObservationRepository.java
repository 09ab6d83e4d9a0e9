package com.utility.water.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.utility.water.config.AerospikeConfig;
import com.utility.water.model.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Series table in an Aerospike set: one record per timestamp (epoch millis as the
 * user key), bins {@code ts} and {@code usage}. A record without a usage bin is a
 * missing value.
 */
@Repository
@ConditionalOnProperty(name = "water.store.type", havingValue = "aerospike")
public class AerospikeUsageObservationRepository implements UsageObservationRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeUsageObservationRepository.class);

    static final String BIN_TS = "ts";
    static final String BIN_USAGE = "usage";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ScanPolicy scanPolicy;

    public AerospikeUsageObservationRepository(AerospikeClient client,
                                               @Qualifier("aerospikeNamespace") String namespace,
                                               @Qualifier("usageWritePolicy") WritePolicy writePolicy,
                                               @Qualifier("usageScanPolicy") ScanPolicy scanPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.scanPolicy = scanPolicy;
    }

    @Override
    public List<Observation> findAll() {
        List<Observation> results = new ArrayList<>();
        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_WATER_USAGE,
                (key, record) -> {
                    Observation obs = mapRecord(record);
                    synchronized (results) {
                        results.add(obs);
                    }
                });
        // Keys are unique per timestamp, so only ordering is needed here
        results.sort(Comparator.comparing(Observation::getTimestamp));
        log.info("Scanned {} usage records from {}.{}", results.size(), namespace, AerospikeConfig.SET_WATER_USAGE);
        return results;
    }

    @Override
    public void saveAll(List<Observation> snapshot) {
        for (Observation obs : snapshot) {
            long epochMillis = obs.getTimestamp().toEpochMilli();
            Key key = new Key(namespace, AerospikeConfig.SET_WATER_USAGE, epochMillis);
            if (obs.isMissing()) {
                client.put(writePolicy, key, new Bin(BIN_TS, epochMillis), Bin.asNull(BIN_USAGE));
            } else {
                client.put(writePolicy, key, new Bin(BIN_TS, epochMillis), new Bin(BIN_USAGE, obs.getUsage()));
            }
        }
    }

    private Observation mapRecord(Record record) {
        Object usage = record.getValue(BIN_USAGE);
        return Observation.builder()
                .timestamp(Instant.ofEpochMilli(record.getLong(BIN_TS)))
                .usage(usage instanceof Number ? ((Number) usage).doubleValue() : Double.NaN)
                .build();
    }
}
