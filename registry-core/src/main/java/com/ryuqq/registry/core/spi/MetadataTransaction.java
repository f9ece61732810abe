package com.ryuqq.registry.core.spi;

import com.ryuqq.registry.core.model.Alias;
import com.ryuqq.registry.core.model.ArtifactState;
import com.ryuqq.registry.core.model.Model;
import com.ryuqq.registry.core.model.ModelId;
import com.ryuqq.registry.core.model.ModelVersion;
import com.ryuqq.registry.core.model.VersionId;

import java.util.List;
import java.util.Optional;

/**
 * Create/read/update/delete primitives available inside a {@link MetadataStore} transaction.
 *
 * <p>Instances are only valid while the unit of work that received them is running.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public interface MetadataTransaction {

    // ---- Model ----

    List<Model> listModels();

    Optional<Model> findModel(ModelId modelId);

    Optional<Model> findModelByName(String name);

    Optional<Model> findModelByStorageKey(String storageKey);

    /**
     * Inserts a model row.
     *
     * @param model the row to insert
     * @return the stored row with its assigned id
     * @throws UniqueConstraintViolationException if the name or storage key is taken
     */
    Model insertModel(NewModel model);

    /**
     * Replaces a model row by id.
     *
     * @param model the new row content
     * @return the stored row
     * @throws IllegalStateException if the model does not exist
     * @throws UniqueConstraintViolationException if the new name is taken by another model
     */
    Model updateModel(Model model);

    /**
     * Deletes a model and cascades to its versions and their aliases.
     *
     * @param modelId the model id
     * @return true if the model existed
     */
    boolean deleteModel(ModelId modelId);

    // ---- Version ----

    /**
     * Lists the versions that currently exist for a model, ordered by version number.
     *
     * @param modelId the model id
     * @return versions (empty if none or the model does not exist)
     */
    List<ModelVersion> findVersions(ModelId modelId);

    Optional<ModelVersion> findVersion(ModelId modelId, int versionNumber);

    Optional<ModelVersion> findVersionById(VersionId versionId);

    /**
     * Inserts a version row.
     *
     * @param version the row to insert
     * @return the stored row with its assigned id
     * @throws IllegalStateException if the owning model does not exist
     * @throws UniqueConstraintViolationException if (modelId, versionNumber) is taken
     */
    ModelVersion insertVersion(NewVersion version);

    /**
     * Replaces a version row by id.
     *
     * @param version the new row content
     * @return the stored row
     * @throws IllegalStateException if the version does not exist
     */
    ModelVersion updateVersion(ModelVersion version);

    /**
     * Deletes a version and cascades to its alias.
     *
     * @param versionId the version id
     * @return true if the version existed
     */
    boolean deleteVersion(VersionId versionId);

    /**
     * Scans versions in the given artifact state, oldest first.
     *
     * @param state the artifact state to match
     * @param limit maximum number of rows
     * @return matching versions
     * @throws IllegalArgumentException if state is null or limit is not positive
     */
    List<ModelVersion> findVersionsByArtifactState(ArtifactState state, int limit);

    // ---- Alias ----

    Optional<Alias> findAlias(String name);

    Optional<Alias> findAliasByVersion(VersionId versionId);

    /**
     * Inserts an alias row.
     *
     * @param name globally unique alias name
     * @param versionId target version
     * @return the stored alias
     * @throws IllegalStateException if the target version does not exist
     * @throws UniqueConstraintViolationException if the name is taken or the version already has an alias
     */
    Alias insertAlias(String name, VersionId versionId);
}
