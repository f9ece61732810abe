package com.ryuqq.registry.core.model;

/**
 * Version 행의 식별자.
 *
 * <p>version number와 달리 Model 경계를 넘어 전역적으로 고유하며,
 * Alias가 가리키는 대상입니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class VersionId {

    private final long value;

    private VersionId(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("VersionId must be positive, but was: " + value);
        }
        this.value = value;
    }

    /**
     * VersionId 생성.
     *
     * @param value VersionId 값
     * @return VersionId 인스턴스
     * @throws IllegalArgumentException 값이 양수가 아닌 경우
     */
    public static VersionId of(long value) {
        return new VersionId(value);
    }

    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VersionId versionId = (VersionId) o;
        return value == versionId.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "VersionId{" + value + '}';
    }
}
