package com.ryuqq.registry.core.outcome;

import com.ryuqq.registry.core.model.ArtifactKey;

/**
 * 메타데이터는 존재하지만 artifact가 없는 다운로드 결과.
 *
 * <p>누락된 레코드가 아니라 무결성 공백입니다. artifact 저장이 메타데이터 커밋 이후
 * 실패했거나, 저장소에서 외부적으로 삭제된 경우 발생합니다.</p>
 *
 * @param key 조회한 artifact 주소
 * @param fileName 정규화된 파일 이름
 * @param modelName Model 표시용 이름
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record Missing(
    ArtifactKey key,
    String fileName,
    String modelName
) implements ArtifactResolution {

    public Missing {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("fileName cannot be null or blank");
        }
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("modelName cannot be null or blank");
        }
    }
}
