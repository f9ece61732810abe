package com.ryuqq.registry.core.outcome;

/**
 * Version artifact 다운로드 결과.
 *
 * <p>Version 메타데이터가 존재할 때만 생성됩니다. 메타데이터가 없으면
 * {@link ErrorKind#NOT_FOUND}로 실패하며, 이 타입과는 구분됩니다.</p>
 * <ul>
 *   <li>{@link Resolved}: artifact 위치 확인됨</li>
 *   <li>{@link Missing}: 메타데이터는 있으나 artifact가 없음 (무결성 공백)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ArtifactResolution resolution = registry.downloadVersion(modelId, 1);
 * if (resolution instanceof Resolved resolved) {
 *     // resolved.location(), resolved.fileName()
 * } else {
 *     // artifact 재업로드 또는 Version 삭제 필요
 * }
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public sealed interface ArtifactResolution permits Resolved, Missing {

    /**
     * artifact 파일 이름.
     *
     * @return 정규화된 파일 이름
     */
    String fileName();

    /**
     * Model 표시용 이름.
     *
     * @return Model 이름
     */
    String modelName();

    /**
     * artifact가 확인되었는지 여부.
     *
     * @return Resolved인 경우 true
     */
    default boolean isResolved() {
        return this instanceof Resolved;
    }
}
