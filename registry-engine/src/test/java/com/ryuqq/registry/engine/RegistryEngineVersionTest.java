package com.ryuqq.registry.engine;

import com.ryuqq.registry.adapter.inmemory.artifact.InMemoryArtifactStore;
import com.ryuqq.registry.adapter.inmemory.metadata.InMemoryMetadataStore;
import com.ryuqq.registry.application.registry.DeletionReport;
import com.ryuqq.registry.application.registry.VersionRegistration;
import com.ryuqq.registry.core.model.ArtifactKey;
import com.ryuqq.registry.core.model.ArtifactState;
import com.ryuqq.registry.core.model.ModelId;
import com.ryuqq.registry.core.model.VersionDetails;
import com.ryuqq.registry.core.model.VersionId;
import com.ryuqq.registry.core.outcome.ArtifactResolution;
import com.ryuqq.registry.core.outcome.ErrorKind;
import com.ryuqq.registry.core.outcome.Missing;
import com.ryuqq.registry.core.outcome.RegistryException;
import com.ryuqq.registry.core.outcome.Resolved;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static com.ryuqq.registry.engine.RegistryFixtures.CLOCK;
import static com.ryuqq.registry.engine.RegistryFixtures.modelCommand;
import static com.ryuqq.registry.engine.RegistryFixtures.upload;
import static com.ryuqq.registry.engine.RegistryFixtures.versionCommand;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RegistryEngine Version 연산 테스트.
 *
 * <ul>
 *   <li>version 번호 = 1 + 이전 등록 수 (삭제와 무관)</li>
 *   <li>Alias 전역 고유성, 쓰기 전 검사</li>
 *   <li>삭제 시 Alias cascade, 카운터 유지</li>
 *   <li>다운로드: Resolved / Missing, read-repair</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
class RegistryEngineVersionTest {

    private InMemoryMetadataStore metadataStore;
    private InMemoryArtifactStore artifactStore;
    private RegistryEngine engine;
    private ModelId modelId;

    @BeforeEach
    void setUp() {
        metadataStore = new InMemoryMetadataStore();
        artifactStore = new InMemoryArtifactStore();
        engine = new RegistryEngine(metadataStore, artifactStore, CLOCK);
        modelId = engine.registerModel(modelCommand("test2", "superhero"), upload("v1")).modelId();
    }

    // ============================================================
    // 1. 등록
    // ============================================================

    @Test
    void registerVersion_AssignsNextNumberAndBumpsCounter() {
        // when
        VersionRegistration registration = engine.registerVersion(modelId, versionCommand(), upload("v2"));

        // then
        assertThat(registration.versionNumber()).isEqualTo(2);
        assertThat(registration.message()).isEqualTo("Model " + modelId.getValue() + " version 2 uploaded successfully");
        assertThat(engine.getModel(modelId).model().latestVersionNumber()).isEqualTo(2);

        VersionDetails v2 = engine.getVersion(modelId, 2);
        assertThat(v2.version().id()).isEqualTo(registration.versionId());
        assertThat(v2.version().artifactState()).isEqualTo(ArtifactState.STORED);
        assertThat(v2.version().description()).isEqualTo("Retrained");
        assertThat(artifactStore.exists(ArtifactKey.of("test2", 2, "file_test.png"))).isTrue();
    }

    @Test
    void registerVersion_NumbersNeverReusedAfterDeletion() {
        // given: 1 (setUp), 2, 3 → delete 3, 2
        engine.registerVersion(modelId, versionCommand(), upload("v2"));
        engine.registerVersion(modelId, versionCommand(), upload("v3"));
        engine.deleteVersion(modelId, 3);
        engine.deleteVersion(modelId, 2);

        // when
        VersionRegistration next = engine.registerVersion(modelId, versionCommand(), upload("v4"));

        // then
        assertThat(next.versionNumber()).isEqualTo(4);
        assertThat(engine.getModel(modelId).versions())
            .extracting(details -> details.version().versionNumber())
            .containsExactly(1, 4);
    }

    @Test
    void registerVersion_ProdAliasScenario_SecondUseConflicts() {
        // given
        engine.registerVersion(modelId, versionCommand("prod"), upload("v2"));
        VersionId prodTarget = engine.getVersion(modelId, 2).version().id();

        // when & then: 다른 Model에서도 같은 Alias는 사용할 수 없음
        ModelId other = engine.registerModel(modelCommand("other"), upload("o1")).modelId();
        assertThatThrownBy(() -> engine.registerVersion(other, versionCommand("prod"), upload("o2")))
            .isInstanceOf(RegistryException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.CONFLICT);
        assertThatThrownBy(() -> engine.registerVersion(modelId, versionCommand("prod"), upload("v3")))
            .isInstanceOf(RegistryException.class)
            .hasMessageContaining("Alias 'prod' already exists");

        // then: 기존 Alias는 원래 Version을 계속 가리킴
        assertThat(engine.getVersion(modelId, 2).alias())
            .hasValueSatisfying(alias -> assertThat(alias.versionId()).isEqualTo(prodTarget));
        assertThat(engine.getVersion(other, 1).alias()).isEmpty();
        assertThat(metadataStore.aliasCount()).isEqualTo(2);
    }

    @Test
    void registerVersion_AliasConflict_NoVersionCreatedAndCounterUnchanged() {
        // when
        assertThatThrownBy(() -> engine.registerVersion(modelId, versionCommand("superhero"), upload("v2")))
            .isInstanceOf(RegistryException.class);

        // then
        assertThat(metadataStore.versionCount()).isEqualTo(1);
        assertThat(engine.getModel(modelId).model().latestVersionNumber()).isEqualTo(1);
        assertThat(artifactStore.size()).isEqualTo(1);

        // 다음 등록은 여전히 2번
        assertThat(engine.registerVersion(modelId, versionCommand(), upload("v2")).versionNumber()).isEqualTo(2);
    }

    @Test
    void registerVersion_AliasFreedByVersionDeletion_CanBeReused() {
        // given
        engine.deleteVersion(modelId, 1);

        // when
        VersionRegistration registration = engine.registerVersion(modelId, versionCommand("superhero"), upload("v2"));

        // then
        assertThat(engine.getVersion(modelId, registration.versionNumber()).alias())
            .hasValueSatisfying(alias -> assertThat(alias.name()).isEqualTo("superhero"));
    }

    @Test
    void registerVersion_UnknownModel_NotFound() {
        assertThatThrownBy(() -> engine.registerVersion(ModelId.of(99), versionCommand(), upload("x")))
            .isInstanceOf(RegistryException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(artifactStore.size()).isEqualTo(1);
    }

    // ============================================================
    // 2. 조회 / 삭제
    // ============================================================

    @Test
    void getVersion_Unknown_NotFound() {
        assertThatThrownBy(() -> engine.getVersion(modelId, 5))
            .isInstanceOf(RegistryException.class)
            .hasMessage("Version 5 of model " + modelId.getValue() + " not found");
    }

    @Test
    void deleteVersion_RemovesVersionAliasAndArtifact() {
        // when
        DeletionReport report = engine.deleteVersion(modelId, 1);

        // then
        assertThat(report.versionsDeleted()).isEqualTo(1);
        assertThat(report.artifactsDeleted()).isEqualTo(1);
        assertThat(metadataStore.aliasCount()).isZero();
        assertThat(artifactStore.size()).isZero();
        assertThatThrownBy(() -> engine.getVersion(modelId, 1))
            .isInstanceOf(RegistryException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(engine.getModel(modelId).model().latestVersionNumber()).isEqualTo(1);
    }

    @Test
    void deleteVersion_Twice_SecondNotFound() {
        engine.deleteVersion(modelId, 1);

        assertThatThrownBy(() -> engine.deleteVersion(modelId, 1))
            .isInstanceOf(RegistryException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    void deleteVersion_ArtifactAlreadyAbsent_Succeeds() {
        artifactStore.clear();

        DeletionReport report = engine.deleteVersion(modelId, 1);

        assertThat(report.artifactsDeleted()).isZero();
        assertThat(metadataStore.versionCount()).isZero();
    }

    // ============================================================
    // 3. 다운로드
    // ============================================================

    @Test
    void downloadVersion_Resolved_ByteIdentical() {
        // when
        ArtifactResolution resolution = engine.downloadVersion(modelId, 1);

        // then
        assertThat(resolution).isInstanceOf(Resolved.class);
        Resolved resolved = (Resolved) resolution;
        assertThat(resolved.fileName()).isEqualTo("file_test.png");
        assertThat(resolved.modelName()).isEqualTo("test2");
        assertThat(resolved.location().toString()).isEqualTo("memory:/test2/1/file_test.png");
        assertThat(artifactStore.read(ArtifactKey.of("test2", 1, "file_test.png")))
            .hasValueSatisfying(bytes -> assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("v1"));
    }

    @Test
    void downloadVersion_ArtifactGone_MissingAndMarked() {
        // given
        artifactStore.clear();

        // when
        ArtifactResolution resolution = engine.downloadVersion(modelId, 1);

        // then
        assertThat(resolution).isInstanceOf(Missing.class);
        assertThat(((Missing) resolution).key()).isEqualTo(ArtifactKey.of("test2", 1, "file_test.png"));
        assertThat(resolution.isResolved()).isFalse();
        assertThat(engine.getVersion(modelId, 1).version().artifactState()).isEqualTo(ArtifactState.MISSING);
    }

    @Test
    void downloadVersion_ArtifactRestored_RepairedToStored() {
        // given
        byte[] saved = artifactStore.read(ArtifactKey.of("test2", 1, "file_test.png")).orElseThrow();
        artifactStore.clear();
        engine.downloadVersion(modelId, 1);
        artifactStore.save(ArtifactKey.of("test2", 1, "file_test.png"), new ByteArrayInputStream(saved));

        // when
        ArtifactResolution resolution = engine.downloadVersion(modelId, 1);

        // then
        assertThat(resolution.isResolved()).isTrue();
        assertThat(engine.getVersion(modelId, 1).version().artifactState()).isEqualTo(ArtifactState.STORED);
    }

    @Test
    void downloadVersion_UnknownVersion_NotFound() {
        assertThatThrownBy(() -> engine.downloadVersion(modelId, 2))
            .isInstanceOf(RegistryException.class)
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.NOT_FOUND);
    }
}
