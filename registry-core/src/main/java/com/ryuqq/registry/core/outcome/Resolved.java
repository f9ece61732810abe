package com.ryuqq.registry.core.outcome;

import java.net.URI;

/**
 * artifact 위치가 확인된 다운로드 결과.
 *
 * @param location Artifact Store가 반환한 위치 (로컬 구현은 file: URI)
 * @param fileName 정규화된 파일 이름
 * @param modelName Model 표시용 이름
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record Resolved(
    URI location,
    String fileName,
    String modelName
) implements ArtifactResolution {

    public Resolved {
        if (location == null) {
            throw new IllegalArgumentException("location cannot be null");
        }
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("fileName cannot be null or blank");
        }
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("modelName cannot be null or blank");
        }
    }
}
