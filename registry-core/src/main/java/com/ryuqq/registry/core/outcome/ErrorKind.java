package com.ryuqq.registry.core.outcome;

/**
 * 레지스트리 실패 유형.
 *
 * <p>외부 API 계층은 이 유형을 프로토콜 상태 코드로 변환합니다
 * (예: NOT_FOUND → 404, CONFLICT → 409, VALIDATION_FAILURE → 422, STORAGE_FAILURE → 500).</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * 참조한 Model 또는 Version이 존재하지 않음.
     */
    NOT_FOUND("REG-404"),

    /**
     * Model 이름, Alias 이름 또는 version 번호 중복.
     */
    CONFLICT("REG-409"),

    /**
     * 필수 메타데이터 누락 또는 형식 오류.
     */
    VALIDATION_FAILURE("REG-422"),

    /**
     * Artifact Store가 save/delete/download를 완료하지 못함.
     */
    STORAGE_FAILURE("REG-500");

    private final String errorCode;

    ErrorKind(String errorCode) {
        this.errorCode = errorCode;
    }

    /**
     * 안정적인 오류 코드 조회.
     *
     * @return 오류 코드 (예: REG-404)
     */
    public String errorCode() {
        return errorCode;
    }

    /**
     * 실패 전에 아무런 변경도 일어나지 않는 유형인지 확인.
     *
     * <p>NOT_FOUND, CONFLICT, VALIDATION_FAILURE는 첫 쓰기 이전에 감지됩니다.</p>
     *
     * @return 부작용 없는 실패 유형이면 true
     */
    public boolean isDetectedBeforeMutation() {
        return this != STORAGE_FAILURE;
    }
}
