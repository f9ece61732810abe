package com.ryuqq.registry.core.model;

/**
 * Artifact Store 내 artifact의 주소.
 *
 * <p>(정규화된 model 이름, version 번호, 정규화된 파일 이름)의 조합으로
 * 하나의 artifact를 가리킵니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ArtifactKey key = ArtifactKey.of("resnet_50", 1, "weights.skops");
 * // 로컬 구현: &lt;base&gt;/resnet_50/1/weights.skops
 * </pre>
 *
 * @param modelKey 정규화된 model 이름
 * @param versionNumber version 번호 (1 이상)
 * @param fileName 정규화된 파일 이름
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record ArtifactKey(
    String modelKey,
    int versionNumber,
    String fileName
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null, 빈 문자열이거나 versionNumber가 양수가 아닌 경우
     */
    public ArtifactKey {
        if (modelKey == null || modelKey.isBlank()) {
            throw new IllegalArgumentException("modelKey cannot be null or blank");
        }
        if (versionNumber <= 0) {
            throw new IllegalArgumentException("versionNumber must be positive, but was: " + versionNumber);
        }
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("fileName cannot be null or blank");
        }
    }

    /**
     * ArtifactKey 생성.
     *
     * @param modelKey 정규화된 model 이름
     * @param versionNumber version 번호
     * @param fileName 정규화된 파일 이름
     * @return ArtifactKey 인스턴스
     */
    public static ArtifactKey of(String modelKey, int versionNumber, String fileName) {
        return new ArtifactKey(modelKey, versionNumber, fileName);
    }
}
