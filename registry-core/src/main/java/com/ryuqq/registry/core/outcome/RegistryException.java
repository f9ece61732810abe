package com.ryuqq.registry.core.outcome;

/**
 * 레지스트리 연산의 구조화된 실패.
 *
 * <p>모든 공개 연산은 성공 결과를 반환하거나 이 예외를 던집니다.
 * {@link #kind()}로 실패 유형을 구분합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try {
 *     registry.getModel(modelId);
 * } catch (RegistryException e) {
 *     Failure failure = e.failure();
 *     // failure.kind() == ErrorKind.NOT_FOUND → 404
 * }
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class RegistryException extends RuntimeException {

    private final ErrorKind kind;

    /**
     * 생성자.
     *
     * @param kind 실패 유형
     * @param message 메시지
     * @throws IllegalArgumentException kind가 null인 경우
     */
    public RegistryException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param kind 실패 유형
     * @param message 메시지
     * @param cause 원인 (null 가능)
     * @throws IllegalArgumentException kind가 null인 경우
     */
    public RegistryException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    public static RegistryException notFound(String message) {
        return new RegistryException(ErrorKind.NOT_FOUND, message);
    }

    public static RegistryException conflict(String message) {
        return new RegistryException(ErrorKind.CONFLICT, message);
    }

    public static RegistryException conflict(String message, Throwable cause) {
        return new RegistryException(ErrorKind.CONFLICT, message, cause);
    }

    public static RegistryException validation(String message) {
        return new RegistryException(ErrorKind.VALIDATION_FAILURE, message);
    }

    public static RegistryException storage(String message, Throwable cause) {
        return new RegistryException(ErrorKind.STORAGE_FAILURE, message, cause);
    }

    /**
     * 실패 유형 조회.
     *
     * @return 실패 유형
     */
    public ErrorKind kind() {
        return kind;
    }

    /**
     * 전송 계층 중립적인 실패 표현으로 변환.
     *
     * @return Failure
     */
    public Failure failure() {
        Throwable cause = getCause();
        return new Failure(kind, getMessage(), cause == null ? null : cause.getMessage());
    }
}
