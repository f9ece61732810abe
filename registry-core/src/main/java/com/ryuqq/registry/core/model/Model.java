package com.ryuqq.registry.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 등록된 Model 행.
 *
 * <p>이름이 붙은 artifact 계보(lineage)를 나타내며, 소속 Version들의 소유자입니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>name:</strong> 표시용 이름 (입력 그대로 저장)</li>
 *   <li><strong>storageKey:</strong> 생성 시점의 정규화된 이름. Artifact Store 경로에 사용되며 이름 변경 후에도 유지됨</li>
 *   <li><strong>latestVersionNumber:</strong> 지금까지 생성된 Version 수를 세는 단조 증가 카운터.
 *       외래 키가 아니며 현재 살아있는 Version 수와도 다름</li>
 * </ul>
 *
 * @param id Model ID
 * @param name 표시용 이름
 * @param storageKey 정규화된 저장소 키
 * @param description 설명
 * @param createdBy 생성자
 * @param tags 자유 형식 태그
 * @param createdAt 생성 시각
 * @param updatedAt 최종 수정 시각
 * @param latestVersionNumber 마지막으로 할당된 version 번호
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record Model(
    ModelId id,
    String name,
    String storageKey,
    String description,
    String createdBy,
    Map<String, Object> tags,
    Instant createdAt,
    Instant updatedAt,
    int latestVersionNumber
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 카운터가 음수인 경우
     */
    public Model {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (storageKey == null || storageKey.isBlank()) {
            throw new IllegalArgumentException("storageKey cannot be null or blank");
        }
        if (createdAt == null || updatedAt == null) {
            throw new IllegalArgumentException("timestamps cannot be null");
        }
        if (latestVersionNumber < 0) {
            throw new IllegalArgumentException("latestVersionNumber cannot be negative, but was: " + latestVersionNumber);
        }
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    /**
     * 다음에 할당될 version 번호.
     *
     * @return latestVersionNumber + 1
     */
    public int nextVersionNumber() {
        return latestVersionNumber + 1;
    }

    /**
     * 새 Version 생성을 반영한 인스턴스 생성.
     *
     * @param versionNumber 새로 할당된 version 번호
     * @param at 수정 시각
     * @return 카운터와 updatedAt이 갱신된 Model
     */
    public Model withLatestVersion(int versionNumber, Instant at) {
        return new Model(id, name, storageKey, description, createdBy, tags, createdAt, at, versionNumber);
    }

    /**
     * 메타데이터 필드를 교체한 인스턴스 생성.
     *
     * @param name 표시용 이름
     * @param description 설명
     * @param createdBy 생성자
     * @param tags 태그
     * @param at 수정 시각
     * @return 갱신된 Model (storageKey와 카운터는 유지)
     */
    public Model withMetadata(String name, String description, String createdBy, Map<String, Object> tags, Instant at) {
        return new Model(id, name, storageKey, description, createdBy, tags, createdAt, at, latestVersionNumber);
    }

    /**
     * 특정 version의 artifact 주소 생성.
     *
     * @param versionNumber version 번호
     * @param fileName 정규화된 파일 이름
     * @return ArtifactKey
     */
    public ArtifactKey artifactKey(int versionNumber, String fileName) {
        return ArtifactKey.of(storageKey, versionNumber, fileName);
    }
}
