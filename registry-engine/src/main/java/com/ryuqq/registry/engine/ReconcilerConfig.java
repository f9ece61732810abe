package com.ryuqq.registry.engine;

/**
 * ArtifactReconciler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>gracePeriodMs: PENDING Version을 검사하기 전 대기 시간 (기본 300000ms = 5분)</li>
 *   <li>batchSize: 한 번에 처리할 항목 수 (기본 100)</li>
 *   <li>strategy: artifact가 없을 때의 처리 전략 (기본 MARK_MISSING)</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 * @param gracePeriodMs 유예 시간 (밀리초, 0 이상)
 * @param batchSize 배치 크기 (1 이상)
 * @param strategy 리컨실 전략
 */
public record ReconcilerConfig(long gracePeriodMs, int batchSize, ReconcileStrategy strategy) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: gracePeriodMs=300000ms (5분), batchSize=100, strategy=MARK_MISSING</p>
     */
    public ReconcilerConfig() {
        this(300000, 100, ReconcileStrategy.MARK_MISSING);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ReconcilerConfig {
        if (gracePeriodMs < 0) {
            throw new IllegalArgumentException(
                "gracePeriodMs cannot be negative (current: " + gracePeriodMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
    }

    public ReconcilerConfig withGracePeriodMs(long gracePeriodMs) {
        return new ReconcilerConfig(gracePeriodMs, this.batchSize, this.strategy);
    }

    public ReconcilerConfig withBatchSize(int batchSize) {
        return new ReconcilerConfig(this.gracePeriodMs, batchSize, this.strategy);
    }

    public ReconcilerConfig withStrategy(ReconcileStrategy strategy) {
        return new ReconcilerConfig(this.gracePeriodMs, this.batchSize, strategy);
    }
}
