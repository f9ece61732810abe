package com.ryuqq.registry.core.spi;

import com.ryuqq.registry.core.model.ArtifactKey;

import java.io.InputStream;
import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Artifact Storage SPI for raw model bytes.
 *
 * <p>This interface abstracts the backend holding binary payloads, addressed by
 * {@link ArtifactKey} (model key, version number, file name). Exactly one backend
 * is active per registry.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Persisting artifact bytes for a version</li>
 *   <li>Deleting artifacts (absent artifacts are not an error)</li>
 *   <li>Resolving artifact locations for download</li>
 *   <li>Existence checks and per-version listing for reconciliation</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>No transactions: every call may fail independently of the Metadata Store</li>
 *   <li>I/O failures are reported with {@link ArtifactStorageException}, never swallowed</li>
 *   <li>Keys are already normalized by the caller; implementations must not rewrite them</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public interface ArtifactStore {

    /**
     * Stores artifact bytes under the given key, replacing any existing artifact.
     *
     * @param key the artifact address
     * @param content the artifact bytes (read to the end, not closed)
     * @return true if the artifact was stored
     * @throws IllegalArgumentException if key or content is null
     * @throws ArtifactStorageException if the backend fails
     */
    boolean save(ArtifactKey key, InputStream content);

    /**
     * Deletes the artifact under the given key.
     *
     * @param key the artifact address
     * @return true if an artifact was present and removed, false if none existed
     * @throws IllegalArgumentException if key is null
     * @throws ArtifactStorageException if the backend fails
     */
    boolean delete(ArtifactKey key);

    /**
     * Resolves the location of the artifact for download.
     *
     * @param key the artifact address
     * @return the artifact location, or empty if the artifact does not exist
     * @throws IllegalArgumentException if key is null
     * @throws ArtifactStorageException if the backend fails
     */
    Optional<URI> resolve(ArtifactKey key);

    /**
     * Reads the artifact bytes.
     *
     * @param key the artifact address
     * @return the bytes, or empty if the artifact does not exist
     * @throws IllegalArgumentException if key is null
     * @throws ArtifactStorageException if the backend fails
     */
    Optional<byte[]> read(ArtifactKey key);

    /**
     * Checks whether an artifact exists.
     *
     * @param key the artifact address
     * @return true if the artifact exists
     * @throws IllegalArgumentException if key is null
     */
    boolean exists(ArtifactKey key);

    /**
     * Lists file names stored for one version of a model.
     *
     * @param modelKey the normalized model name
     * @param versionNumber the version number
     * @return file names (empty if nothing was ever stored for this version)
     * @throws IllegalArgumentException if modelKey is blank or versionNumber is not positive
     */
    List<String> listFiles(String modelKey, int versionNumber);
}
