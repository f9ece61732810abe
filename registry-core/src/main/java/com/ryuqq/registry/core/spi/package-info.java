/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the two external collaborators of the registry engine.
 * They share no transaction; the engine alone coordinates them.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.spi.MetadataStore} - transactional Model/Version/Alias rows</li>
 *   <li>{@link com.ryuqq.registry.core.spi.ArtifactStore} - artifact bytes keyed by (model key, version, file name)</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (registry-adapter-inmemory, registry-adapter-localfs) provide implementations.
 * registry-testkit ships abstract contract tests every implementation should pass.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.spi;
