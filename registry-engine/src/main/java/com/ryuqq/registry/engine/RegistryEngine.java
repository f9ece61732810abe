package com.ryuqq.registry.engine;

import com.ryuqq.registry.application.registry.ArtifactUpload;
import com.ryuqq.registry.application.registry.DeletionReport;
import com.ryuqq.registry.application.registry.ModelPatch;
import com.ryuqq.registry.application.registry.ModelRegistration;
import com.ryuqq.registry.application.registry.ModelRegistry;
import com.ryuqq.registry.application.registry.RegisterModelCommand;
import com.ryuqq.registry.application.registry.RegisterVersionCommand;
import com.ryuqq.registry.application.registry.VersionRegistration;
import com.ryuqq.registry.core.model.ArtifactKey;
import com.ryuqq.registry.core.model.ArtifactState;
import com.ryuqq.registry.core.model.Model;
import com.ryuqq.registry.core.model.ModelDetails;
import com.ryuqq.registry.core.model.ModelId;
import com.ryuqq.registry.core.model.ModelVersion;
import com.ryuqq.registry.core.model.VersionDetails;
import com.ryuqq.registry.core.model.VersionId;
import com.ryuqq.registry.core.naming.NameNormalizer;
import com.ryuqq.registry.core.outcome.ArtifactResolution;
import com.ryuqq.registry.core.outcome.Missing;
import com.ryuqq.registry.core.outcome.RegistryException;
import com.ryuqq.registry.core.outcome.Resolved;
import com.ryuqq.registry.core.spi.ArtifactStore;
import com.ryuqq.registry.core.spi.MetadataStore;
import com.ryuqq.registry.core.spi.MetadataTransaction;
import com.ryuqq.registry.core.spi.NewModel;
import com.ryuqq.registry.core.spi.NewVersion;
import com.ryuqq.registry.core.spi.UniqueConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 레지스트리 일관성 엔진.
 *
 * <p>Metadata Store와 Artifact Store는 트랜잭션을 공유하지 않으므로, 엔진이 두 저장소 사이의
 * 쓰기 순서를 정하고 중간 상태를 {@link ArtifactState}로 추적합니다.</p>
 *
 * <p><strong>쓰기 순서 (등록):</strong></p>
 * <pre>
 * 1. 검증 및 중복 검사 (이름, Alias) → 실패 시 부작용 없음
 * 2. 트랜잭션: Model/Version(PENDING)/Alias 생성 → COMMIT
 * 3. Artifact Store save
 *    → 실패: STORAGE_FAILURE, Version은 PENDING으로 남음 (ArtifactReconciler가 정리)
 * 4. 트랜잭션: Version (PENDING 또는 MISSING) → STORED
 *    → Version 행이 사라졌으면: 저장한 artifact 삭제 후 STORAGE_FAILURE
 * </pre>
 *
 * <p><strong>쓰기 순서 (삭제):</strong></p>
 * <pre>
 * 1. 트랜잭션: 행 삭제 (cascade) → COMMIT
 * 2. 실제 존재하던 Version마다 artifact 삭제 (없으면 no-op)
 * 3. 삭제 실패가 있으면 모두 시도한 뒤 STORAGE_FAILURE
 * </pre>
 *
 * <p><strong>예외 변환:</strong></p>
 * <ul>
 *   <li>{@link UniqueConstraintViolationException} → CONFLICT</li>
 *   <li>Artifact Store 예외 또는 save 실패 응답 → STORAGE_FAILURE</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class RegistryEngine implements ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(RegistryEngine.class);
    private static final int FIRST_VERSION_NUMBER = 1;
    private static final Set<ArtifactState> UNCONFIRMED = EnumSet.of(ArtifactState.PENDING, ArtifactState.MISSING);

    private final MetadataStore metadataStore;
    private final ArtifactStore artifactStore;
    private final Clock clock;

    /**
     * 생성자 (시스템 UTC 시계 사용).
     *
     * @param metadataStore Metadata Store
     * @param artifactStore Artifact Store
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RegistryEngine(MetadataStore metadataStore, ArtifactStore artifactStore) {
        this(metadataStore, artifactStore, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param metadataStore Metadata Store
     * @param artifactStore Artifact Store
     * @param clock 타임스탬프 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RegistryEngine(MetadataStore metadataStore, ArtifactStore artifactStore, Clock clock) {
        if (metadataStore == null) {
            throw new IllegalArgumentException("metadataStore cannot be null");
        }
        if (artifactStore == null) {
            throw new IllegalArgumentException("artifactStore cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.metadataStore = metadataStore;
        this.artifactStore = artifactStore;
        this.clock = clock;
    }

    // ========================================
    // Model operations
    // ========================================

    @Override
    public List<ModelDetails> listModels() {
        return transact(tx -> tx.listModels().stream()
            .map(model -> loadDetails(tx, model))
            .collect(Collectors.toList()));
    }

    @Override
    public int countModels() {
        return transact(tx -> tx.listModels().size());
    }

    @Override
    public ModelDetails getModel(ModelId modelId) {
        requireArgument(modelId, "modelId");
        return transact(tx -> loadDetails(tx, requireModel(tx, modelId)));
    }

    @Override
    public ModelRegistration registerModel(RegisterModelCommand command, ArtifactUpload artifact) {
        requireArgument(command, "command");
        requireArgument(artifact, "artifact");

        String storageKey = pathSegment(NameNormalizer.normalize(command.name()), "model name");
        String fileName = pathSegment(NameNormalizer.normalize(artifact.originalFileName()), "file name");

        VersionContext created = transact(tx -> {
            // 1. 중복 검사 (쓰기 전)
            ensureNameAvailable(tx, command.name(), storageKey, null);
            command.versionAlias().ifPresent(alias -> ensureAliasAvailable(tx, alias));

            // 2. Model, Version 1 (PENDING), Alias 생성
            Instant now = clock.instant();
            Model model = tx.insertModel(new NewModel(
                command.name(),
                storageKey,
                command.description(),
                command.createdBy(),
                command.tags(),
                now,
                FIRST_VERSION_NUMBER
            ));
            ModelVersion version = tx.insertVersion(new NewVersion(
                model.id(),
                FIRST_VERSION_NUMBER,
                command.versionDescription(),
                command.createdBy(),
                command.versionTags(),
                command.versionMetrics(),
                command.versionParameters(),
                fileName,
                ArtifactState.PENDING,
                now
            ));
            command.versionAlias().ifPresent(alias -> tx.insertAlias(alias, version.id()));
            return new VersionContext(model, version);
        });

        // 3. artifact 저장 (트랜잭션 밖)
        storeArtifact(created, artifact);

        log.info("Model registered: {} '{}' (storage key '{}')", created.model().id(), created.model().name(), storageKey);
        return new ModelRegistration(created.model().id(), created.model().name());
    }

    @Override
    public Model updateModel(ModelId modelId, ModelPatch patch) {
        requireArgument(modelId, "modelId");
        requireArgument(patch, "patch");

        Model updated = transact(tx -> {
            Model model = requireModel(tx, modelId);
            String name = patch.name().orElse(model.name());
            if (!name.equals(model.name())) {
                ensureNameAvailable(tx, name, NameNormalizer.normalize(name), model.id());
            }
            return tx.updateModel(model.withMetadata(
                name,
                patch.description().orElse(model.description()),
                patch.createdBy().orElse(model.createdBy()),
                patch.tags().orElse(model.tags()),
                clock.instant()
            ));
        });

        log.info("Model updated: {} '{}'", updated.id(), updated.name());
        return updated;
    }

    @Override
    public DeletionReport deleteModel(ModelId modelId) {
        requireArgument(modelId, "modelId");

        // 1. 행 삭제 (cascade) 후 커밋
        Removed removed = transact(tx -> {
            Model model = requireModel(tx, modelId);
            List<ModelVersion> versions = tx.findVersions(modelId);
            tx.deleteModel(modelId);
            return new Removed(model, versions);
        });

        // 2. 실제 존재하던 Version 번호로 artifact 삭제
        int artifactsDeleted = 0;
        List<ArtifactKey> failedKeys = new ArrayList<>();
        RuntimeException firstFailure = null;
        for (ModelVersion version : removed.versions()) {
            ArtifactKey key = removed.model().artifactKey(version.versionNumber(), version.fileName());
            try {
                if (artifactStore.delete(key)) {
                    artifactsDeleted++;
                } else {
                    log.warn("Artifact {} was already absent while deleting {}", key, modelId);
                }
            } catch (RuntimeException e) {
                log.error("Failed to delete artifact {} while deleting {}", key, modelId, e);
                failedKeys.add(key);
                if (firstFailure == null) {
                    firstFailure = e;
                } else {
                    firstFailure.addSuppressed(e);
                }
            }
        }

        // 3. 실패 보고
        if (!failedKeys.isEmpty()) {
            throw RegistryException.storage(
                "Model " + modelId.getValue() + " deleted but " + failedKeys.size()
                    + " artifact(s) could not be removed: " + failedKeys,
                firstFailure
            );
        }

        log.info("Model deleted: {} ({} versions, {} artifacts)", modelId, removed.versions().size(), artifactsDeleted);
        return new DeletionReport(modelId, removed.versions().size(), artifactsDeleted);
    }

    // ========================================
    // Version operations
    // ========================================

    @Override
    public VersionRegistration registerVersion(ModelId modelId, RegisterVersionCommand command, ArtifactUpload artifact) {
        requireArgument(modelId, "modelId");
        requireArgument(command, "command");
        requireArgument(artifact, "artifact");

        String fileName = pathSegment(NameNormalizer.normalize(artifact.originalFileName()), "file name");

        VersionContext created = transact(tx -> {
            // 1. 존재 및 Alias 중복 검사 (쓰기 전)
            Model model = requireModel(tx, modelId);
            command.alias().ifPresent(alias -> ensureAliasAvailable(tx, alias));

            // 2. Version (PENDING), Alias 생성, 카운터 증가
            Instant now = clock.instant();
            int next = model.nextVersionNumber();
            ModelVersion version = tx.insertVersion(new NewVersion(
                model.id(),
                next,
                command.description(),
                command.createdBy(),
                command.tags(),
                command.metrics(),
                command.parameters(),
                fileName,
                ArtifactState.PENDING,
                now
            ));
            command.alias().ifPresent(alias -> tx.insertAlias(alias, version.id()));
            Model bumped = tx.updateModel(model.withLatestVersion(next, now));
            return new VersionContext(bumped, version);
        });

        // 3. artifact 저장 (트랜잭션 밖)
        storeArtifact(created, artifact);

        ModelVersion version = created.version();
        log.info("Version registered: {} v{} ({})", modelId, version.versionNumber(), version.id());
        return new VersionRegistration(modelId, version.versionNumber(), version.id());
    }

    @Override
    public VersionDetails getVersion(ModelId modelId, int versionNumber) {
        requireArgument(modelId, "modelId");
        return transact(tx -> {
            ModelVersion version = requireVersion(tx, modelId, versionNumber);
            return new VersionDetails(version, tx.findAliasByVersion(version.id()).orElse(null));
        });
    }

    @Override
    public DeletionReport deleteVersion(ModelId modelId, int versionNumber) {
        requireArgument(modelId, "modelId");

        // 1. 행 삭제 (Alias cascade) 후 커밋
        VersionContext removed = transact(tx -> {
            ModelVersion version = requireVersion(tx, modelId, versionNumber);
            Model model = requireModel(tx, modelId);
            tx.deleteVersion(version.id());
            return new VersionContext(model, version);
        });

        // 2. 상위 Model의 storage key로 artifact 삭제
        ArtifactKey key = removed.artifactKey();
        boolean deleted;
        try {
            deleted = artifactStore.delete(key);
        } catch (RuntimeException e) {
            log.error("Failed to delete artifact {} after deleting {} v{}", key, modelId, versionNumber, e);
            throw RegistryException.storage(
                "Version " + versionNumber + " of model " + modelId.getValue()
                    + " deleted but its artifact could not be removed",
                e
            );
        }
        if (!deleted) {
            log.warn("Artifact {} was already absent while deleting {} v{}", key, modelId, versionNumber);
        }

        log.info("Version deleted: {} v{}", modelId, versionNumber);
        return new DeletionReport(modelId, 1, deleted ? 1 : 0);
    }

    @Override
    public ArtifactResolution downloadVersion(ModelId modelId, int versionNumber) {
        requireArgument(modelId, "modelId");

        VersionContext found = transact(tx -> {
            ModelVersion version = requireVersion(tx, modelId, versionNumber);
            return new VersionContext(requireModel(tx, modelId), version);
        });

        ArtifactKey key = found.artifactKey();
        Optional<URI> location;
        try {
            location = artifactStore.resolve(key);
        } catch (RuntimeException e) {
            log.error("Failed to resolve artifact {} for {} v{}", key, modelId, versionNumber, e);
            throw RegistryException.storage("Artifact for version " + versionNumber + " of model "
                + modelId.getValue() + " could not be resolved", e);
        }

        // read-repair: 관측 결과를 artifactState에 반영
        ModelVersion version = found.version();
        if (location.isPresent()) {
            repair(version.id(), UNCONFIRMED, ArtifactState.STORED);
            return new Resolved(location.get(), version.fileName(), found.model().name());
        }

        log.warn("Version {} v{} has metadata but no artifact at {}", modelId, versionNumber, key);
        repair(version.id(), EnumSet.of(ArtifactState.STORED), ArtifactState.MISSING);
        return new Missing(key, version.fileName(), found.model().name());
    }

    // ========================================
    // internals
    // ========================================

    private <T> T transact(Function<MetadataTransaction, T> work) {
        try {
            return metadataStore.inTransaction(work);
        } catch (UniqueConstraintViolationException e) {
            throw RegistryException.conflict(e.getMessage(), e);
        }
    }

    private void storeArtifact(VersionContext created, ArtifactUpload artifact) {
        ArtifactKey key = created.artifactKey();
        VersionId versionId = created.version().id();

        boolean saved;
        try {
            saved = artifactStore.save(key, artifact.openStream());
        } catch (RuntimeException e) {
            log.error("Artifact save failed for {}; {} left {}", key, versionId, ArtifactState.PENDING, e);
            throw RegistryException.storage("Artifact for " + created.model().name() + " version "
                + created.version().versionNumber() + " could not be stored (artifact missing)", e);
        }
        if (!saved) {
            log.error("Artifact store rejected {}; {} left {}", key, versionId, ArtifactState.PENDING);
            throw RegistryException.storage("Artifact for " + created.model().name() + " version "
                + created.version().versionNumber() + " was not stored (artifact missing)", null);
        }

        // save 도중 Reconciler가 MISSING으로 표시하거나 Version 행을 삭제했을 수 있음
        boolean rowExists;
        try {
            rowExists = metadataStore.inTransaction(tx -> {
                if (tx.findVersionById(versionId).isEmpty()) {
                    return false;
                }
                ArtifactStateTransitions.transition(tx, versionId, UNCONFIRMED, ArtifactState.STORED, clock.instant());
                return true;
            });
        } catch (RuntimeException e) {
            log.warn("Artifact {} stored but {} could not be marked {}; left for reconciliation",
                key, versionId, ArtifactState.STORED, e);
            return;
        }
        if (!rowExists) {
            discardOrphan(key, versionId);
            throw RegistryException.storage("Version " + created.version().versionNumber() + " of model "
                + created.model().name() + " was removed while its artifact was being stored", null);
        }
    }

    private void discardOrphan(ArtifactKey key, VersionId versionId) {
        log.warn("{} was removed while {} was being stored; deleting the artifact", versionId, key);
        try {
            artifactStore.delete(key);
        } catch (RuntimeException e) {
            log.error("Failed to delete orphaned artifact {}", key, e);
        }
    }

    private void repair(VersionId versionId, Set<ArtifactState> from, ArtifactState to) {
        try {
            boolean changed = metadataStore.inTransaction(tx ->
                ArtifactStateTransitions.transition(tx, versionId, from, to, clock.instant()));
            if (changed) {
                log.info("Read-repair: {} marked {}", versionId, to);
            }
        } catch (RuntimeException e) {
            log.warn("Read-repair of {} to {} failed", versionId, to, e);
        }
    }

    private ModelDetails loadDetails(MetadataTransaction tx, Model model) {
        List<VersionDetails> versions = tx.findVersions(model.id()).stream()
            .map(version -> new VersionDetails(version, tx.findAliasByVersion(version.id()).orElse(null)))
            .collect(Collectors.toList());
        return new ModelDetails(model, versions);
    }

    private static Model requireModel(MetadataTransaction tx, ModelId modelId) {
        return tx.findModel(modelId)
            .orElseThrow(() -> RegistryException.notFound("Model " + modelId.getValue() + " not found"));
    }

    private static ModelVersion requireVersion(MetadataTransaction tx, ModelId modelId, int versionNumber) {
        return tx.findVersion(modelId, versionNumber)
            .orElseThrow(() -> RegistryException.notFound(
                "Version " + versionNumber + " of model " + modelId.getValue() + " not found"));
    }

    private static void ensureNameAvailable(MetadataTransaction tx, String name, String storageKey, ModelId self) {
        Optional<Model> sameName = tx.findModelByName(name).filter(model -> !model.id().equals(self));
        if (sameName.isPresent()) {
            throw RegistryException.conflict("Model '" + name + "' already exists (model "
                + sameName.get().id().getValue() + "); register a new version instead");
        }

        // 이름 변경된 Model은 storageKey와 현재 이름의 정규형이 다를 수 있으므로 둘 다 비교
        Optional<Model> sameKey = tx.findModelByStorageKey(storageKey)
            .filter(model -> !model.id().equals(self))
            .or(() -> tx.listModels().stream()
                .filter(model -> !model.id().equals(self))
                .filter(model -> NameNormalizer.normalize(model.name()).equals(storageKey))
                .findFirst());
        if (sameKey.isPresent()) {
            throw RegistryException.conflict("Model name '" + name + "' collides with existing model '"
                + sameKey.get().name() + "' (normalized '" + storageKey + "')");
        }
    }

    private static void ensureAliasAvailable(MetadataTransaction tx, String alias) {
        if (tx.findAlias(alias).isPresent()) {
            throw RegistryException.conflict("Alias '" + alias + "' already exists");
        }
    }

    private static String pathSegment(String normalized, String field) {
        if (normalized.contains("/") || normalized.contains("\\")
            || normalized.equals(".") || normalized.equals("..")) {
            throw RegistryException.validation(field + " cannot be used as a storage path segment: '" + normalized + "'");
        }
        return normalized;
    }

    private static void requireArgument(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }

    private record VersionContext(Model model, ModelVersion version) {

        ArtifactKey artifactKey() {
            return model.artifactKey(version.versionNumber(), version.fileName());
        }
    }

    private record Removed(Model model, List<ModelVersion> versions) {
    }
}
