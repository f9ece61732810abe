package com.ryuqq.registry.core.naming;

import java.util.Locale;

/**
 * 표시용 이름을 저장소 키로 변환하는 정규화 함수.
 *
 * <p>소문자로 변환한 뒤 모든 공백(' ')을 언더스코어('_')로 치환합니다.
 * Model 이름과 artifact 파일 이름이 저장소 경로 세그먼트가 되기 전에 사용됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * NameNormalizer.normalize("Resnet 50");     // "resnet_50"
 * NameNormalizer.normalize("file test.png"); // "file_test.png"
 * </pre>
 *
 * <p>소문자 변환은 {@link Locale#ROOT} 기준이므로 실행 환경의 기본 로케일과 무관하게 결정적입니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class NameNormalizer {

    // Utility class - prevent instantiation
    private NameNormalizer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 이름 정규화.
     *
     * @param name 표시용 이름
     * @return 정규화된 키
     * @throws IllegalArgumentException name이 null인 경우
     */
    public static String normalize(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        return name.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
