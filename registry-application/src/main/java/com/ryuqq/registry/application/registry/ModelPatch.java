package com.ryuqq.registry.application.registry;

import java.util.Map;
import java.util.Optional;

/**
 * Model 메타데이터 부분 수정.
 *
 * <p>null인 필드는 "변경하지 않음"을 의미합니다 (전체 교체가 아닌 patch 의미론).
 * 전달된 문자열은 비어있을 수 없습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ModelPatch patch = ModelPatch.empty().withDescription("retrained on v2 data");
 * registry.updateModel(modelId, patch);
 * </pre>
 *
 * @param nameOrNull 새 표시용 이름
 * @param descriptionOrNull 새 설명
 * @param createdByOrNull 새 생성자
 * @param tagsOrNull 새 태그 (전달 시 기존 태그 전체 교체)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record ModelPatch(
    String nameOrNull,
    String descriptionOrNull,
    String createdByOrNull,
    Map<String, Object> tagsOrNull
) {

    public ModelPatch {
        CommandValidation.requireNullOrNonBlank(nameOrNull, "name");
        CommandValidation.requireNullOrNonBlank(descriptionOrNull, "description");
        CommandValidation.requireNullOrNonBlank(createdByOrNull, "createdBy");
        tagsOrNull = tagsOrNull == null ? null : CommandValidation.copyOrEmpty(tagsOrNull, "tags");
    }

    public static ModelPatch empty() {
        return new ModelPatch(null, null, null, null);
    }

    public ModelPatch withName(String name) {
        return new ModelPatch(name, descriptionOrNull, createdByOrNull, tagsOrNull);
    }

    public ModelPatch withDescription(String description) {
        return new ModelPatch(nameOrNull, description, createdByOrNull, tagsOrNull);
    }

    public ModelPatch withCreatedBy(String createdBy) {
        return new ModelPatch(nameOrNull, descriptionOrNull, createdBy, tagsOrNull);
    }

    public ModelPatch withTags(Map<String, Object> tags) {
        return new ModelPatch(nameOrNull, descriptionOrNull, createdByOrNull, tags);
    }

    public Optional<String> name() {
        return Optional.ofNullable(nameOrNull);
    }

    public Optional<String> description() {
        return Optional.ofNullable(descriptionOrNull);
    }

    public Optional<String> createdBy() {
        return Optional.ofNullable(createdByOrNull);
    }

    public Optional<Map<String, Object>> tags() {
        return Optional.ofNullable(tagsOrNull);
    }

    /**
     * 변경할 필드가 없는지 확인.
     *
     * @return 모든 필드가 null이면 true
     */
    public boolean isEmpty() {
        return nameOrNull == null && descriptionOrNull == null && createdByOrNull == null && tagsOrNull == null;
    }
}
