package com.ryuqq.registry.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Model에 속한 하나의 artifact 세대.
 *
 * <p>version 번호는 Model 안에서 고유하며 단조 증가하지만 연속적이지는 않습니다
 * (중간 Version이 삭제될 수 있음).</p>
 *
 * @param id Version ID
 * @param modelId 소속 Model ID
 * @param versionNumber Model 내 version 번호
 * @param description 설명
 * @param createdBy 생성자
 * @param tags 태그
 * @param metrics 수치 지표 (예: accuracy)
 * @param parameters 학습 파라미터
 * @param fileName 정규화된 artifact 파일 이름
 * @param artifactState Artifact Store와의 일관성 상태
 * @param createdAt 생성 시각
 * @param updatedAt 최종 수정 시각
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record ModelVersion(
    VersionId id,
    ModelId modelId,
    int versionNumber,
    String description,
    String createdBy,
    Map<String, Object> tags,
    Map<String, Double> metrics,
    Map<String, Object> parameters,
    String fileName,
    ArtifactState artifactState,
    Instant createdAt,
    Instant updatedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 versionNumber가 양수가 아닌 경우
     */
    public ModelVersion {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
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
        if (createdAt == null || updatedAt == null) {
            throw new IllegalArgumentException("timestamps cannot be null");
        }
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * artifact 상태를 변경한 인스턴스 생성.
     *
     * @param state 새 상태
     * @param at 수정 시각
     * @return 갱신된 ModelVersion
     */
    public ModelVersion withArtifactState(ArtifactState state, Instant at) {
        return new ModelVersion(id, modelId, versionNumber, description, createdBy, tags, metrics,
            parameters, fileName, state, createdAt, at);
    }
}
