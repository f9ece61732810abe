package com.ryuqq.registry.core.spi;

import com.ryuqq.registry.core.model.ArtifactState;
import com.ryuqq.registry.core.model.ModelId;

import java.time.Instant;
import java.util.Map;

/**
 * Version row to insert; the store assigns the id.
 *
 * @param modelId owning model
 * @param versionNumber number unique within the model
 * @param description description
 * @param createdBy creator
 * @param tags tags
 * @param metrics numeric metrics
 * @param parameters parameters
 * @param fileName normalized artifact file name
 * @param artifactState initial artifact state
 * @param createdAt creation time (also used as updatedAt)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record NewVersion(
    ModelId modelId,
    int versionNumber,
    String description,
    String createdBy,
    Map<String, Object> tags,
    Map<String, Double> metrics,
    Map<String, Object> parameters,
    String fileName,
    ArtifactState artifactState,
    Instant createdAt
) {

    public NewVersion {
        if (modelId == null) {
            throw new IllegalArgumentException("modelId cannot be null");
        }
        if (versionNumber <= 0) {
            throw new IllegalArgumentException("versionNumber must be positive, but was: " + versionNumber);
        }
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("fileName cannot be null or blank");
        }
        if (artifactState == null) {
            throw new IllegalArgumentException("artifactState cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
    }
}
