package com.ryuqq.registry.adapter.inmemory.metadata;

import com.ryuqq.registry.core.model.Model;
import com.ryuqq.registry.core.spi.MetadataTransaction;
import com.ryuqq.registry.core.spi.NewModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryMetadataStore 전용 동작 테스트 (계약 외).
 *
 * @author Registry Team
 * @since 1.0.0
 */
class InMemoryMetadataStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private InMemoryMetadataStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryMetadataStore();
    }

    private static NewModel newModel(String name) {
        return new NewModel(name, name, "d", "dev", Map.of(), T0, 1);
    }

    @Test
    void transactionHandle_UnusableAfterCommit() {
        // Given
        MetadataTransaction leaked = store.inTransaction(tx -> tx);

        // When & Then
        assertThatThrownBy(leaked::listModels)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("no longer active");
    }

    @Test
    void uncommittedWrites_VisibleInsideSameTransaction() {
        int seen = store.inTransaction(tx -> {
            tx.insertModel(newModel("a"));
            tx.insertModel(newModel("b"));
            return tx.listModels().size();
        });

        assertThat(seen).isEqualTo(2);
        assertThat(store.modelCount()).isEqualTo(2);
    }

    @Test
    void rolledBackInsert_DoesNotConsumeCommittedIdSequence() {
        // Given
        assertThatThrownBy(() -> store.inTransaction(tx -> {
            tx.insertModel(newModel("discarded"));
            throw new IllegalStateException("abort");
        })).isInstanceOf(IllegalStateException.class);

        // When
        Model committed = store.inTransaction(tx -> tx.insertModel(newModel("kept")));

        // Then
        assertThat(committed.id().getValue()).isEqualTo(1L);
    }

    @Test
    void clear_RemovesEverything() {
        store.inTransaction(tx -> tx.insertModel(newModel("a")));

        store.clear();

        assertThat(store.modelCount()).isZero();
        assertThat(store.versionCount()).isZero();
        assertThat(store.aliasCount()).isZero();
    }

    @Test
    void concurrentTransactions_Serialized() throws Exception {
        // Given
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Model>> futures = Collections.synchronizedList(new ArrayList<>());

        // When: 같은 이름을 동시에 등록
        for (int i = 0; i < threads; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return store.inTransaction(tx -> tx.findModelByName("contended")
                    .orElseGet(() -> tx.insertModel(newModel("contended"))));
            }));
        }
        start.countDown();
        List<Model> results = new ArrayList<>();
        for (Future<Model> future : futures) {
            results.add(future.get(5, TimeUnit.SECONDS));
        }
        executor.shutdown();

        // Then: read-then-write가 원자적이므로 행은 하나
        assertThat(store.modelCount()).isEqualTo(1);
        assertThat(results).extracting(Model::id).containsOnly(results.get(0).id());
    }
}
