package com.ryuqq.registry.engine;

/**
 * Artifact 리컨실 전략.
 *
 * <p>유예 시간이 지나도록 PENDING 상태이고 Artifact Store에 artifact가 없는 Version을
 * 어떻게 처리할지 결정합니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public enum ReconcileStrategy {

    /**
     * 메타데이터 유지 전략.
     *
     * <p>Version 행을 남기고 MISSING으로 표시합니다. 다운로드 시 Missing 결과가 반환되며,
     * 운영자가 Version 삭제 또는 재업로드로 정리할 수 있습니다.</p>
     */
    MARK_MISSING,

    /**
     * 메타데이터 삭제 전략.
     *
     * <p>Version 행과 Alias를 삭제합니다. Model의 version 카운터는 되돌리지 않습니다.</p>
     *
     * <p><strong>주의:</strong></p>
     * <ul>
     *   <li>업로드가 매우 느린 경우 아직 진행 중인 Version이 삭제될 수 있음</li>
     *   <li>유예 시간을 업로드 최대 소요 시간보다 길게 설정해야 함</li>
     * </ul>
     */
    PURGE
}
