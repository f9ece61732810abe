/**
 * Core domain model package.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.model.ModelId} - Model identifier</li>
 *   <li>{@link com.ryuqq.registry.core.model.VersionId} - Version identifier</li>
 *   <li>{@link com.ryuqq.registry.core.model.ArtifactKey} - (model key, version number, file name) artifact address</li>
 * </ul>
 *
 * <h2>Rows</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.model.Model} - named artifact lineage with its version counter</li>
 *   <li>{@link com.ryuqq.registry.core.model.ModelVersion} - one artifact generation</li>
 *   <li>{@link com.ryuqq.registry.core.model.Alias} - globally unique pointer to one version</li>
 * </ul>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Model name and storage key are unique across all models</li>
 *   <li>Alias name is unique across the whole registry</li>
 *   <li>(modelId, versionNumber) is unique; version numbers never repeat within a model</li>
 *   <li>Versions cascade with their model, aliases with their version</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.model;
