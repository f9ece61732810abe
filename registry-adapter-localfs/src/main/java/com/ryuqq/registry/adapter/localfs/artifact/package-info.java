/**
 * Reference local filesystem Artifact Store.
 *
 * <p>Layout: {@code <basePath>/<modelKey>/<versionNumber>/<fileName>}, with keys already
 * normalized by the registry engine. Paths that would escape the base directory are rejected.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.registry.adapter.localfs.artifact;
