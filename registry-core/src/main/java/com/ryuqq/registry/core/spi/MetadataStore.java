package com.ryuqq.registry.core.spi;

import java.util.function.Function;

/**
 * Relational Metadata Storage SPI for Model, Version and Alias rows.
 *
 * <p>All access goes through a unit of work bound to one transaction. The engine opens
 * one transaction per operation for its relational changes and commits them before
 * touching the {@link ArtifactStore}.</p>
 *
 * <p><strong>Transaction Boundary:</strong></p>
 * <pre>
 * BEGIN TRANSACTION;
 *   -- work(tx): reads, inserts, updates, deletes
 * COMMIT;            -- work returned normally
 * ROLLBACK;          -- work threw; the exception is rethrown unchanged
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomicity: either every change made by {@code work} is visible afterwards, or none</li>
 *   <li>Uniqueness: enforce model name, model storage key, alias name, alias per version and
 *       (modelId, versionNumber), throwing {@link UniqueConstraintViolationException}</li>
 *   <li>Cascade: deleting a model deletes its versions; deleting a version deletes its alias</li>
 *   <li>Thread-safe: concurrent transactions must not observe each other's uncommitted changes</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Model model = metadataStore.inTransaction(tx -&gt; tx.findModel(modelId)
 *     .orElseThrow(() -&gt; RegistryException.notFound("Model " + modelId + " not found")));
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public interface MetadataStore {

    /**
     * Runs a unit of work in a single transaction.
     *
     * @param work the unit of work
     * @param <T> result type
     * @return the value returned by {@code work}
     * @throws IllegalArgumentException if work is null
     * @throws IllegalStateException if called from inside another transaction of the same store
     */
    <T> T inTransaction(Function<MetadataTransaction, T> work);
}
