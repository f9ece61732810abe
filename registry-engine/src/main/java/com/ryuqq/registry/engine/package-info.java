/**
 * Registry consistency engine.
 *
 * <p>{@link com.ryuqq.registry.engine.RegistryEngine} implements
 * {@link com.ryuqq.registry.application.registry.ModelRegistry} over a
 * {@link com.ryuqq.registry.core.spi.MetadataStore} and an
 * {@link com.ryuqq.registry.core.spi.ArtifactStore}. The two stores share no transaction:
 * metadata is committed first and the artifact write follows, with the version's
 * {@link com.ryuqq.registry.core.model.ArtifactState} recording whether the bytes arrived.</p>
 *
 * <p>{@link com.ryuqq.registry.engine.ArtifactReconciler} is the periodic pass that settles
 * versions left {@code PENDING}.</p>
 *
 * <h2>Wiring Example</h2>
 *
 * <pre>{@code
 * MetadataStore metadata = new InMemoryMetadataStore();
 * ArtifactStore artifacts = ArtifactStoreFactory.create(StorageSettings.fromEnvironment(System.getenv()));
 *
 * ModelRegistry registry = new RegistryEngine(metadata, artifacts);
 * ArtifactReconciler reconciler = new ArtifactReconciler(metadata, artifacts, new ReconcilerConfig());
 * }</pre>
 *
 * @since 1.0.0
 */
package com.ryuqq.registry.engine;
