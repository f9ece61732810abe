package com.ryuqq.registry.adapter.localfs.artifact;

import java.nio.file.Path;

/**
 * LocalArtifactStore 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>basePath: artifact 루트 디렉토리 (기본 ./models)</li>
 *   <li>pruneEmptyDirectories: 삭제 후 빈 version/model 디렉토리 제거 여부 (기본 true)</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 * @param basePath artifact 루트 디렉토리
 * @param pruneEmptyDirectories 빈 디렉토리 정리 여부
 */
public record LocalArtifactStoreConfig(Path basePath, boolean pruneEmptyDirectories) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: basePath=./models, pruneEmptyDirectories=true</p>
     */
    public LocalArtifactStoreConfig() {
        this(Path.of("models"), true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException basePath가 null인 경우
     */
    public LocalArtifactStoreConfig {
        if (basePath == null) {
            throw new IllegalArgumentException("basePath cannot be null");
        }
    }

    public LocalArtifactStoreConfig withBasePath(Path basePath) {
        return new LocalArtifactStoreConfig(basePath, this.pruneEmptyDirectories);
    }

    public LocalArtifactStoreConfig withPruneEmptyDirectories(boolean pruneEmptyDirectories) {
        return new LocalArtifactStoreConfig(this.basePath, pruneEmptyDirectories);
    }
}
