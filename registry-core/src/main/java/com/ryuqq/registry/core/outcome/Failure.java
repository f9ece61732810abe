package com.ryuqq.registry.core.outcome;

/**
 * 전송 계층 중립적인 실패 표현.
 *
 * <p>{@link RegistryException#failure()}로 얻으며, 외부 API 계층이
 * 응답 본문과 상태 코드를 구성하는 데 사용합니다.</p>
 *
 * @param kind 실패 유형
 * @param message 사람이 읽을 수 있는 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record Failure(
    ErrorKind kind,
    String message,
    String cause
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind가 null이거나 message가 null 또는 빈 문자열인 경우
     */
    public Failure {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    /**
     * 오류 코드 조회.
     *
     * @return kind의 오류 코드
     */
    public String errorCode() {
        return kind.errorCode();
    }
}
