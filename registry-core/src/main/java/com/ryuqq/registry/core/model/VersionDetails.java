package com.ryuqq.registry.core.model;

import java.util.Optional;

/**
 * Alias가 함께 로드된 Version.
 *
 * @param version Version 행
 * @param aliasOrNull 연결된 Alias (없으면 null)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record VersionDetails(
    ModelVersion version,
    Alias aliasOrNull
) {

    public VersionDetails {
        if (version == null) {
            throw new IllegalArgumentException("version cannot be null");
        }
        if (aliasOrNull != null && !aliasOrNull.versionId().equals(version.id())) {
            throw new IllegalArgumentException(
                "alias " + aliasOrNull.name() + " does not point at " + version.id());
        }
    }

    /**
     * 연결된 Alias 조회.
     *
     * @return Alias (없으면 empty)
     */
    public Optional<Alias> alias() {
        return Optional.ofNullable(aliasOrNull);
    }
}
