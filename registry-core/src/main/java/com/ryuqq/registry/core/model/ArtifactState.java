package com.ryuqq.registry.core.model;

/**
 * Version 행과 Artifact Store 사이의 일관성 상태.
 *
 * <p>Metadata Store와 Artifact Store는 트랜잭션을 공유하지 않으므로,
 * Version 행은 항상 artifact 저장보다 먼저 커밋됩니다. 이 상태는
 * 그 사이의 구간을 명시적으로 기록합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * PENDING ──► STORED   (artifact 저장 확인)
 *    │
 *    └─────► MISSING  (artifact 부재 확인)
 *
 * STORED ◄──► MISSING  (다운로드 시 read-repair)
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public enum ArtifactState {

    /**
     * Version 행은 커밋되었지만 artifact 저장이 아직 확인되지 않음.
     */
    PENDING,

    /**
     * artifact가 Artifact Store에 존재함이 확인됨.
     */
    STORED,

    /**
     * 메타데이터는 존재하지만 artifact가 없음 (무결성 공백).
     */
    MISSING;

    /**
     * Reconciler가 처리해야 하는 상태인지 확인.
     *
     * @return PENDING인 경우 true
     */
    public boolean requiresReconciliation() {
        return this == PENDING;
    }
}
