package com.ryuqq.registry.core.spi;

import com.ryuqq.registry.core.model.ArtifactKey;

/**
 * Raised by {@link ArtifactStore} implementations when the backend cannot complete an operation.
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class ArtifactStorageException extends RuntimeException {

    private final ArtifactKey key;

    public ArtifactStorageException(ArtifactKey key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public ArtifactStorageException(ArtifactKey key, String message) {
        this(key, message, null);
    }

    /**
     * Returns the artifact address involved, if the failure concerned a single artifact.
     *
     * @return the key, or null for listing failures
     */
    public ArtifactKey key() {
        return key;
    }
}
