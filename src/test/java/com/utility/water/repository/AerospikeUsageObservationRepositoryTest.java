package com.utility.water.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.utility.water.config.AerospikeConfig;
import com.utility.water.model.Observation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.utility.water.testutil.TestDataFactory.observation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AerospikeUsageObservationRepositoryTest {

    private static final String NAMESPACE = "water";

    @Mock
    private AerospikeClient client;

    private final WritePolicy writePolicy = new WritePolicy();
    private final ScanPolicy scanPolicy = new ScanPolicy();

    private AerospikeUsageObservationRepository repository;

    @BeforeEach
    void setUp() {
        repository = new AerospikeUsageObservationRepository(client, NAMESPACE, writePolicy, scanPolicy);
    }

    @Test
    void findAll_mapsRecordsAndSortsByTimestamp() {
        long later = Instant.parse("2026-10-17T02:00:00Z").toEpochMilli();
        long earlier = Instant.parse("2026-10-17T01:00:00Z").toEpochMilli();
        doAnswer(invocation -> {
            ScanCallback callback = invocation.getArgument(3);
            callback.scanCallback(key(later), record(later, 3.0));
            callback.scanCallback(key(earlier), record(earlier, null));
            return null;
        }).when(client).scanAll(eq(scanPolicy), eq(NAMESPACE), eq(AerospikeConfig.SET_WATER_USAGE), any(ScanCallback.class));

        List<Observation> rows = repository.findAll();

        assertThat(rows).extracting(Observation::getTimestamp)
                .containsExactly(Instant.ofEpochMilli(earlier), Instant.ofEpochMilli(later));
        assertThat(rows.get(0).isMissing()).isTrue();
        assertThat(rows.get(1).getUsage()).isEqualTo(3.0);
    }

    @Test
    void saveAll_putsOneRecordPerTimestamp() {
        repository.saveAll(List.of(
                observation("2026-10-17T01:00:00Z", 4.5),
                observation("2026-10-17T02:00:00Z", Double.NaN)));

        ArgumentCaptor<Key> keys = ArgumentCaptor.forClass(Key.class);
        verify(client, times(2)).put(eq(writePolicy), keys.capture(), any(Bin.class), any(Bin.class));

        assertThat(keys.getAllValues()).extracting(k -> k.userKey.toLong()).containsExactly(
                Instant.parse("2026-10-17T01:00:00Z").toEpochMilli(),
                Instant.parse("2026-10-17T02:00:00Z").toEpochMilli());
        assertThat(keys.getAllValues()).allSatisfy(k -> {
            assertThat(k.namespace).isEqualTo(NAMESPACE);
            assertThat(k.setName).isEqualTo(AerospikeConfig.SET_WATER_USAGE);
        });
    }

    private static Key key(long epochMillis) {
        return new Key(NAMESPACE, AerospikeConfig.SET_WATER_USAGE, epochMillis);
    }

    private static Record record(long epochMillis, Double usage) {
        Map<String, Object> bins = new HashMap<>();
        bins.put(AerospikeUsageObservationRepository.BIN_TS, epochMillis);
        if (usage != null) {
            bins.put(AerospikeUsageObservationRepository.BIN_USAGE, usage);
        }
        return new Record(bins, 1, 0);
    }
}
