package com.ryuqq.registry.core.spi;

import java.time.Instant;
import java.util.Map;

/**
 * Model row to insert; the store assigns the id.
 *
 * @param name display name
 * @param storageKey normalized name
 * @param description description
 * @param createdBy creator
 * @param tags free-form tags
 * @param createdAt creation time (also used as updatedAt)
 * @param latestVersionNumber initial counter value
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record NewModel(
    String name,
    String storageKey,
    String description,
    String createdBy,
    Map<String, Object> tags,
    Instant createdAt,
    int latestVersionNumber
) {

    public NewModel {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (storageKey == null || storageKey.isBlank()) {
            throw new IllegalArgumentException("storageKey cannot be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
    }
}
