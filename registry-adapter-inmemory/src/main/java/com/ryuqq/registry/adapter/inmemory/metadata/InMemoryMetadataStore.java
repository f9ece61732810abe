package com.ryuqq.registry.adapter.inmemory.metadata;

import com.ryuqq.registry.core.model.Alias;
import com.ryuqq.registry.core.model.ArtifactState;
import com.ryuqq.registry.core.model.Model;
import com.ryuqq.registry.core.model.ModelId;
import com.ryuqq.registry.core.model.ModelVersion;
import com.ryuqq.registry.core.model.VersionId;
import com.ryuqq.registry.core.spi.MetadataStore;
import com.ryuqq.registry.core.spi.MetadataTransaction;
import com.ryuqq.registry.core.spi.NewModel;
import com.ryuqq.registry.core.spi.NewVersion;
import com.ryuqq.registry.core.spi.UniqueConstraintViolationException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link MetadataStore} SPI for testing and reference purposes.
 *
 * <p>Each transaction works on a private copy of the three tables. The copy replaces the
 * committed tables when the unit of work returns and is discarded when it throws, so a
 * failed unit of work leaves no trace.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>models:</strong> TreeMap&lt;Long, Model&gt; - Model rows ordered by id</li>
 *   <li><strong>versions:</strong> TreeMap&lt;Long, ModelVersion&gt; - Version rows ordered by id</li>
 *   <li><strong>aliases:</strong> TreeMap&lt;Long, Alias&gt; - Alias rows ordered by id</li>
 * </ul>
 *
 * <p><strong>Concurrency:</strong></p>
 * <ul>
 *   <li>Transactions are serialized on a single monitor</li>
 *   <li>Nested transactions on the same thread are rejected with {@link IllegalStateException}</li>
 *   <li>A {@link MetadataTransaction} handle is unusable once its unit of work has finished</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Full table copy per transaction (O(N))</li>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class InMemoryMetadataStore implements MetadataStore {

    private final Object monitor = new Object();
    private final ThreadLocal<Boolean> active = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private Tables committed = new Tables();

    @Override
    public <T> T inTransaction(Function<MetadataTransaction, T> work) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        if (active.get()) {
            throw new IllegalStateException("Nested transactions are not supported");
        }

        synchronized (monitor) {
            active.set(Boolean.TRUE);
            Tables working = committed.copy();
            Transaction tx = new Transaction(working);
            try {
                T result = work.apply(tx);
                committed = working;
                return result;
            } finally {
                tx.closed = true;
                active.set(Boolean.FALSE);
            }
        }
    }

    /**
     * 모든 데이터 초기화 (테스트용).
     */
    public void clear() {
        synchronized (monitor) {
            committed = new Tables();
        }
    }

    /**
     * 저장된 Model 수 (테스트용).
     *
     * @return committed model rows
     */
    public int modelCount() {
        synchronized (monitor) {
            return committed.models.size();
        }
    }

    /**
     * 저장된 Version 수 (테스트용).
     *
     * @return committed version rows across all models
     */
    public int versionCount() {
        synchronized (monitor) {
            return committed.versions.size();
        }
    }

    /**
     * 저장된 Alias 수 (테스트용).
     *
     * @return committed alias rows
     */
    public int aliasCount() {
        synchronized (monitor) {
            return committed.aliases.size();
        }
    }

    private static final class Tables {
        private final TreeMap<Long, Model> models;
        private final TreeMap<Long, ModelVersion> versions;
        private final TreeMap<Long, Alias> aliases;
        private long modelSequence;
        private long versionSequence;
        private long aliasSequence;

        private Tables() {
            this.models = new TreeMap<>();
            this.versions = new TreeMap<>();
            this.aliases = new TreeMap<>();
        }

        private Tables(Tables source) {
            this.models = new TreeMap<>(source.models);
            this.versions = new TreeMap<>(source.versions);
            this.aliases = new TreeMap<>(source.aliases);
            this.modelSequence = source.modelSequence;
            this.versionSequence = source.versionSequence;
            this.aliasSequence = source.aliasSequence;
        }

        private Tables copy() {
            return new Tables(this);
        }
    }

    private static final class Transaction implements MetadataTransaction {

        private final Tables tables;
        private volatile boolean closed;

        private Transaction(Tables tables) {
            this.tables = tables;
        }

        // ---- Model ----

        @Override
        public List<Model> listModels() {
            ensureOpen();
            return new ArrayList<>(tables.models.values());
        }

        @Override
        public Optional<Model> findModel(ModelId modelId) {
            ensureOpen();
            requireArgument(modelId, "modelId");
            return Optional.ofNullable(tables.models.get(modelId.getValue()));
        }

        @Override
        public Optional<Model> findModelByName(String name) {
            ensureOpen();
            requireArgument(name, "name");
            return tables.models.values().stream()
                .filter(model -> model.name().equals(name))
                .findFirst();
        }

        @Override
        public Optional<Model> findModelByStorageKey(String storageKey) {
            ensureOpen();
            requireArgument(storageKey, "storageKey");
            return tables.models.values().stream()
                .filter(model -> model.storageKey().equals(storageKey))
                .findFirst();
        }

        @Override
        public Model insertModel(NewModel model) {
            ensureOpen();
            requireArgument(model, "model");
            checkModelUniqueness(model.name(), model.storageKey(), null);

            long id = ++tables.modelSequence;
            Model stored = new Model(
                ModelId.of(id),
                model.name(),
                model.storageKey(),
                model.description(),
                model.createdBy(),
                model.tags(),
                model.createdAt(),
                model.createdAt(),
                model.latestVersionNumber()
            );
            tables.models.put(id, stored);
            return stored;
        }

        @Override
        public Model updateModel(Model model) {
            ensureOpen();
            requireArgument(model, "model");
            long id = model.id().getValue();
            if (!tables.models.containsKey(id)) {
                throw new IllegalStateException("Model not found: " + model.id());
            }
            checkModelUniqueness(model.name(), model.storageKey(), model.id());
            tables.models.put(id, model);
            return model;
        }

        @Override
        public boolean deleteModel(ModelId modelId) {
            ensureOpen();
            requireArgument(modelId, "modelId");
            if (tables.models.remove(modelId.getValue()) == null) {
                return false;
            }
            List<ModelVersion> owned = versionsOf(modelId);
            for (ModelVersion version : owned) {
                removeVersion(version.id());
            }
            return true;
        }

        // ---- Version ----

        @Override
        public List<ModelVersion> findVersions(ModelId modelId) {
            ensureOpen();
            requireArgument(modelId, "modelId");
            return versionsOf(modelId);
        }

        @Override
        public Optional<ModelVersion> findVersion(ModelId modelId, int versionNumber) {
            ensureOpen();
            requireArgument(modelId, "modelId");
            return tables.versions.values().stream()
                .filter(version -> version.modelId().equals(modelId))
                .filter(version -> version.versionNumber() == versionNumber)
                .findFirst();
        }

        @Override
        public Optional<ModelVersion> findVersionById(VersionId versionId) {
            ensureOpen();
            requireArgument(versionId, "versionId");
            return Optional.ofNullable(tables.versions.get(versionId.getValue()));
        }

        @Override
        public ModelVersion insertVersion(NewVersion version) {
            ensureOpen();
            requireArgument(version, "version");
            if (!tables.models.containsKey(version.modelId().getValue())) {
                throw new IllegalStateException("Model not found: " + version.modelId());
            }
            if (findVersion(version.modelId(), version.versionNumber()).isPresent()) {
                throw new UniqueConstraintViolationException("version_number",
                    "Version " + version.versionNumber() + " already exists for " + version.modelId());
            }

            long id = ++tables.versionSequence;
            ModelVersion stored = new ModelVersion(
                VersionId.of(id),
                version.modelId(),
                version.versionNumber(),
                version.description(),
                version.createdBy(),
                version.tags(),
                version.metrics(),
                version.parameters(),
                version.fileName(),
                version.artifactState(),
                version.createdAt(),
                version.createdAt()
            );
            tables.versions.put(id, stored);
            return stored;
        }

        @Override
        public ModelVersion updateVersion(ModelVersion version) {
            ensureOpen();
            requireArgument(version, "version");
            ModelVersion current = tables.versions.get(version.id().getValue());
            if (current == null) {
                throw new IllegalStateException("Version not found: " + version.id());
            }
            if (!current.modelId().equals(version.modelId()) || current.versionNumber() != version.versionNumber()) {
                throw new IllegalStateException("Version identity cannot change: " + version.id());
            }
            tables.versions.put(version.id().getValue(), version);
            return version;
        }

        @Override
        public boolean deleteVersion(VersionId versionId) {
            ensureOpen();
            requireArgument(versionId, "versionId");
            return removeVersion(versionId);
        }

        @Override
        public List<ModelVersion> findVersionsByArtifactState(ArtifactState state, int limit) {
            ensureOpen();
            requireArgument(state, "state");
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be positive, but was: " + limit);
            }
            return tables.versions.values().stream()
                .filter(version -> version.artifactState() == state)
                .sorted(Comparator.comparing(ModelVersion::createdAt)
                    .thenComparing(version -> version.id().getValue()))
                .limit(limit)
                .collect(Collectors.toList());
        }

        // ---- Alias ----

        @Override
        public Optional<Alias> findAlias(String name) {
            ensureOpen();
            requireArgument(name, "name");
            return tables.aliases.values().stream()
                .filter(alias -> alias.name().equals(name))
                .findFirst();
        }

        @Override
        public Optional<Alias> findAliasByVersion(VersionId versionId) {
            ensureOpen();
            requireArgument(versionId, "versionId");
            return tables.aliases.values().stream()
                .filter(alias -> alias.versionId().equals(versionId))
                .findFirst();
        }

        @Override
        public Alias insertAlias(String name, VersionId versionId) {
            ensureOpen();
            requireArgument(name, "name");
            requireArgument(versionId, "versionId");
            if (!tables.versions.containsKey(versionId.getValue())) {
                throw new IllegalStateException("Version not found: " + versionId);
            }
            if (findAlias(name).isPresent()) {
                throw new UniqueConstraintViolationException("alias_name", "Alias '" + name + "' already exists");
            }
            if (findAliasByVersion(versionId).isPresent()) {
                throw new UniqueConstraintViolationException("alias_version", versionId + " already has an alias");
            }

            long id = ++tables.aliasSequence;
            Alias stored = new Alias(id, name, versionId);
            tables.aliases.put(id, stored);
            return stored;
        }

        // ---- internals ----

        private List<ModelVersion> versionsOf(ModelId modelId) {
            return tables.versions.values().stream()
                .filter(version -> version.modelId().equals(modelId))
                .sorted(Comparator.comparingInt(ModelVersion::versionNumber))
                .collect(Collectors.toList());
        }

        private boolean removeVersion(VersionId versionId) {
            if (tables.versions.remove(versionId.getValue()) == null) {
                return false;
            }
            tables.aliases.values().removeIf(alias -> alias.versionId().equals(versionId));
            return true;
        }

        private void checkModelUniqueness(String name, String storageKey, ModelId self) {
            for (Model existing : tables.models.values()) {
                if (existing.id().equals(self)) {
                    continue;
                }
                if (existing.name().equals(name)) {
                    throw new UniqueConstraintViolationException("model_name", "Model '" + name + "' already exists");
                }
                if (existing.storageKey().equals(storageKey)) {
                    throw new UniqueConstraintViolationException("model_storage_key",
                        "Storage key '" + storageKey + "' already used by " + existing.id());
                }
            }
        }

        private void ensureOpen() {
            if (closed) {
                throw new IllegalStateException("Transaction is no longer active");
            }
        }

        private static void requireArgument(Object value, String name) {
            if (value == null) {
                throw new IllegalArgumentException(name + " cannot be null");
            }
        }
    }
}
