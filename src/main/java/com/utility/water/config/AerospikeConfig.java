package com.utility.water.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "water.store.type", havingValue = "aerospike")
public class AerospikeConfig {

    public static final String SET_WATER_USAGE = "water_usage";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:water}")
    private String namespace;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.timeout = 5000;
        clientPolicy.writePolicyDefault.totalTimeout = 3000;
        clientPolicy.writePolicyDefault.socketTimeout = 1000;
        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy usageWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        // Snapshot writes are idempotent upserts keyed by timestamp
        policy.sendKey = true;
        return policy;
    }

    @Bean
    public ScanPolicy usageScanPolicy() {
        ScanPolicy policy = new ScanPolicy();
        policy.maxRecords = 0;
        policy.concurrentNodes = true;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
