package com.ryuqq.registry.adapter.localfs.settings;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Artifact Store 선택 설정.
 *
 * <p>환경 변수에서 읽습니다:</p>
 * <ul>
 *   <li>{@value #METHOD_VARIABLE}: 저장 방식 (현재 {@code local}만 지원)</li>
 *   <li>{@value #PATH_VARIABLE}: 로컬 저장소 루트 디렉토리</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * StorageSettings settings = StorageSettings.fromEnvironment(System.getenv());
 * ArtifactStore store = ArtifactStoreFactory.create(settings);
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 * @param method 저장 방식 (소문자)
 * @param path 저장소 루트 디렉토리
 */
public record StorageSettings(String method, Path path) {

    public static final String METHOD_VARIABLE = "MODEL_STORAGE_METHOD";
    public static final String PATH_VARIABLE = "MODEL_STORAGE_PATH";

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException method가 비어있거나 path가 null인 경우
     */
    public StorageSettings {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method cannot be null or blank");
        }
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        method = method.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * 환경 변수 맵에서 설정 생성.
     *
     * @param environment 환경 변수 (예: {@code System.getenv()})
     * @return StorageSettings
     * @throws IllegalArgumentException 필수 변수가 없거나 비어있는 경우
     */
    public static StorageSettings fromEnvironment(Map<String, String> environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        String method = required(environment, METHOD_VARIABLE);
        String path = required(environment, PATH_VARIABLE);
        return new StorageSettings(method, Path.of(path.trim()));
    }

    private static String required(Map<String, String> environment, String name) {
        String value = environment.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must be set");
        }
        return value;
    }
}
