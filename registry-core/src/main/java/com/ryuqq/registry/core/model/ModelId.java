package com.ryuqq.registry.core.model;

/**
 * 등록된 Model의 식별자.
 *
 * <p>Metadata Store가 Model 행을 삽입할 때 할당하며, 외부 API 경로의
 * {@code modelId}로 노출됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong> 1 이상의 정수</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class ModelId {

    private final long value;

    private ModelId(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("ModelId must be positive, but was: " + value);
        }
        this.value = value;
    }

    /**
     * ModelId 생성.
     *
     * @param value ModelId 값
     * @return ModelId 인스턴스
     * @throws IllegalArgumentException 값이 양수가 아닌 경우
     */
    public static ModelId of(long value) {
        return new ModelId(value);
    }

    /**
     * ModelId 값 조회.
     *
     * @return ModelId 값
     */
    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ModelId modelId = (ModelId) o;
        return value == modelId.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "ModelId{" + value + '}';
    }
}
