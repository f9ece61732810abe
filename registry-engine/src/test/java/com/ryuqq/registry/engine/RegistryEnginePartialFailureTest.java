package com.ryuqq.registry.engine;

import com.ryuqq.registry.adapter.inmemory.artifact.InMemoryArtifactStore;
import com.ryuqq.registry.adapter.inmemory.metadata.InMemoryMetadataStore;
import com.ryuqq.registry.core.model.ArtifactKey;
import com.ryuqq.registry.core.model.ArtifactState;
import com.ryuqq.registry.core.model.ModelDetails;
import com.ryuqq.registry.core.model.ModelId;
import com.ryuqq.registry.core.outcome.ErrorKind;
import com.ryuqq.registry.core.outcome.RegistryException;
import com.ryuqq.registry.core.spi.ArtifactStorageException;
import com.ryuqq.registry.testkit.fault.FaultInjectingArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.ryuqq.registry.engine.RegistryFixtures.CLOCK;
import static com.ryuqq.registry.engine.RegistryFixtures.modelCommand;
import static com.ryuqq.registry.engine.RegistryFixtures.upload;
import static com.ryuqq.registry.engine.RegistryFixtures.versionCommand;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RegistryEngine 부분 실패 테스트.
 *
 * <p>메타데이터 커밋 후 Artifact Store가 실패하는 경우를 검증합니다:</p>
 * <ul>
 *   <li>save 실패 → STORAGE_FAILURE, Version은 PENDING으로 남음</li>
 *   <li>delete 실패 → 모든 삭제 시도 후 STORAGE_FAILURE, 메타데이터 삭제는 유지</li>
 *   <li>resolve 실패 → STORAGE_FAILURE</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
class RegistryEnginePartialFailureTest {

    private InMemoryMetadataStore metadataStore;
    private InMemoryArtifactStore backing;
    private FaultInjectingArtifactStore artifactStore;
    private RegistryEngine engine;

    @BeforeEach
    void setUp() {
        metadataStore = new InMemoryMetadataStore();
        backing = new InMemoryArtifactStore();
        artifactStore = new FaultInjectingArtifactStore(backing);
        engine = new RegistryEngine(metadataStore, artifactStore, CLOCK);
    }

    @Test
    void registerModel_SaveThrows_StorageFailureAndVersionPending() {
        // given
        artifactStore.failSaves();

        // when
        assertThatThrownBy(() -> engine.registerModel(modelCommand("test2", "superhero"), upload("weights")))
            .isInstanceOf(RegistryException.class)
            .hasMessageContaining("artifact missing")
            .hasCauseInstanceOf(ArtifactStorageException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.STORAGE_FAILURE);

        // then: 메타데이터는 커밋된 상태 유지
        ModelDetails details = engine.listModels().get(0);
        assertThat(details.model().name()).isEqualTo("test2");
        assertThat(details.versions()).hasSize(1);
        assertThat(details.versions().get(0).version().artifactState()).isEqualTo(ArtifactState.PENDING);
        assertThat(details.versions().get(0).alias()).isPresent();
        assertThat(backing.size()).isZero();
    }

    @Test
    void registerVersion_SaveRejected_StorageFailureAndCounterAdvanced() {
        // given
        ModelId id = engine.registerModel(modelCommand("test2"), upload("v1")).modelId();
        artifactStore.rejectSaves();

        // when
        assertThatThrownBy(() -> engine.registerVersion(id, versionCommand(), upload("v2")))
            .isInstanceOf(RegistryException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.STORAGE_FAILURE);

        // then
        assertThat(engine.getModel(id).model().latestVersionNumber()).isEqualTo(2);
        assertThat(engine.getVersion(id, 2).version().artifactState()).isEqualTo(ArtifactState.PENDING);
        assertThat(engine.downloadVersion(id, 2).isResolved()).isFalse();
    }

    @Test
    void registerModel_FailedArtifact_RecoverableByDeletion() {
        // given
        artifactStore.failSaves();
        assertThatThrownBy(() -> engine.registerModel(modelCommand("test2"), upload("weights")))
            .isInstanceOf(RegistryException.class);
        artifactStore.reset();
        ModelId id = engine.listModels().get(0).model().id();

        // when
        engine.deleteModel(id);
        ModelId again = engine.registerModel(modelCommand("test2"), upload("weights")).modelId();

        // then
        assertThat(engine.getVersion(again, 1).version().artifactState()).isEqualTo(ArtifactState.STORED);
    }

    @Test
    void deleteModel_OneArtifactFails_OthersDeletedThenStorageFailure() {
        // given
        ModelId id = engine.registerModel(modelCommand("test2"), upload("v1")).modelId();
        engine.registerVersion(id, versionCommand(), upload("v2"));
        engine.registerVersion(id, versionCommand(), upload("v3"));
        artifactStore.failDeletesWhen(key -> key.versionNumber() == 2);

        // when
        assertThatThrownBy(() -> engine.deleteModel(id))
            .isInstanceOf(RegistryException.class)
            .hasMessageContaining("1 artifact(s) could not be removed")
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.STORAGE_FAILURE);

        // then: 메타데이터 삭제는 유지, 나머지 artifact는 삭제됨
        assertThat(artifactStore.deleteAttempts()).isEqualTo(3);
        assertThat(metadataStore.modelCount()).isZero();
        assertThat(backing.exists(ArtifactKey.of("test2", 1, "file_test.png"))).isFalse();
        assertThat(backing.exists(ArtifactKey.of("test2", 2, "file_test.png"))).isTrue();
        assertThat(backing.exists(ArtifactKey.of("test2", 3, "file_test.png"))).isFalse();
    }

    @Test
    void deleteVersion_DeleteThrows_StorageFailureAfterRowRemoved() {
        // given
        ModelId id = engine.registerModel(modelCommand("test2", "superhero"), upload("v1")).modelId();
        artifactStore.failDeletes();

        // when
        assertThatThrownBy(() -> engine.deleteVersion(id, 1))
            .isInstanceOf(RegistryException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.STORAGE_FAILURE);

        // then
        assertThat(metadataStore.versionCount()).isZero();
        assertThat(metadataStore.aliasCount()).isZero();
        assertThat(backing.size()).isEqualTo(1);
    }

    @Test
    void downloadVersion_ResolveThrows_StorageFailure() {
        ModelId id = engine.registerModel(modelCommand("test2"), upload("v1")).modelId();
        artifactStore.failResolves();

        assertThatThrownBy(() -> engine.downloadVersion(id, 1))
            .isInstanceOf(RegistryException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.STORAGE_FAILURE);
        assertThat(engine.getVersion(id, 1).version().artifactState()).isEqualTo(ArtifactState.STORED);
    }

    @Test
    void conflicts_NeverTouchArtifactStore() {
        // given
        engine.registerModel(modelCommand("test2", "prod"), upload("v1"));
        int attempts = artifactStore.saveAttempts();

        // when
        assertThatThrownBy(() -> engine.registerModel(modelCommand("test2"), upload("x")))
            .isInstanceOf(RegistryException.class);
        assertThatThrownBy(() -> engine.registerModel(modelCommand("other", "prod"), upload("x")))
            .isInstanceOf(RegistryException.class);

        // then
        assertThat(artifactStore.saveAttempts()).isEqualTo(attempts);
    }
}
