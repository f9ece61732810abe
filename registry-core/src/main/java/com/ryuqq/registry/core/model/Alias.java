package com.ryuqq.registry.core.model;

/**
 * 하나의 Version을 가리키는 사람이 읽을 수 있는 이름.
 *
 * <p>Alias 이름은 Model 단위가 아니라 레지스트리 전체에서 고유합니다.
 * 대상 Version이 삭제되면 함께 삭제됩니다.</p>
 *
 * @param id Alias ID
 * @param name 전역 고유 이름 (예: prod, superhero)
 * @param versionId 대상 Version ID
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record Alias(
    long id,
    String name,
    VersionId versionId
) {

    public Alias {
        if (id <= 0) {
            throw new IllegalArgumentException("id must be positive, but was: " + id);
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (versionId == null) {
            throw new IllegalArgumentException("versionId cannot be null");
        }
    }
}
