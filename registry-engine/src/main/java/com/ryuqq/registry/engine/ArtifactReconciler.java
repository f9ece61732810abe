package com.ryuqq.registry.engine;

import com.ryuqq.registry.core.model.ArtifactKey;
import com.ryuqq.registry.core.model.ArtifactState;
import com.ryuqq.registry.core.model.Model;
import com.ryuqq.registry.core.model.ModelVersion;
import com.ryuqq.registry.core.spi.ArtifactStore;
import com.ryuqq.registry.core.spi.MetadataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * ArtifactReconciler 컴포넌트.
 *
 * <p>메타데이터 커밋 후 artifact 저장이 끝나지 않은 Version(PENDING)을 주기적으로 정리합니다.</p>
 *
 * <p><strong>복구 시나리오:</strong></p>
 * <pre>
 * 1. RegistryEngine이 Version(PENDING) 커밋 성공
 * 2. Artifact Store save 실패 또는 STORED 표시 전 크래시
 *    → Version이 PENDING 상태로 남음
 * 3. ArtifactReconciler가 주기적으로 PENDING Version 스캔 (유예 시간 경과분만)
 * 4. artifact 존재 → STORED
 *    artifact 없음 → MARK_MISSING: MISSING 표시 / PURGE: Version 행 삭제
 * </pre>
 *
 * <p><strong>멱등성:</strong></p>
 * <ul>
 *   <li>상태 전이는 트랜잭션 안에서 현재 상태가 PENDING일 때만 적용</li>
 *   <li>여러 인스턴스가 동시에 실행되어도 같은 Version을 두 번 변경하지 않음</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class ArtifactReconciler {

    private static final Logger log = LoggerFactory.getLogger(ArtifactReconciler.class);
    private static final EnumSet<ArtifactState> PENDING_ONLY = EnumSet.of(ArtifactState.PENDING);

    private final MetadataStore metadataStore;
    private final ArtifactStore artifactStore;
    private final ReconcilerConfig config;
    private final Clock clock;

    /**
     * 생성자 (시스템 UTC 시계 사용).
     *
     * @param metadataStore Metadata Store
     * @param artifactStore Artifact Store
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ArtifactReconciler(MetadataStore metadataStore, ArtifactStore artifactStore, ReconcilerConfig config) {
        this(metadataStore, artifactStore, config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param metadataStore Metadata Store
     * @param artifactStore Artifact Store
     * @param config 설정
     * @param clock 유예 시간 계산용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ArtifactReconciler(MetadataStore metadataStore, ArtifactStore artifactStore,
                              ReconcilerConfig config, Clock clock) {
        if (metadataStore == null) {
            throw new IllegalArgumentException("metadataStore cannot be null");
        }
        if (artifactStore == null) {
            throw new IllegalArgumentException("artifactStore cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.metadataStore = metadataStore;
        this.artifactStore = artifactStore;
        this.config = config;
        this.clock = clock;
    }

    /**
     * PENDING Version 스캔 및 정리.
     *
     * <p>주기적으로 호출되어야 합니다 (예: @Scheduled).</p>
     *
     * @return 상태가 확정된 Version 수
     */
    public int scan() {
        log.info("ArtifactReconciler scan started");

        // 1. PENDING 항목 스캔
        List<ModelVersion> pending = metadataStore.inTransaction(
            tx -> tx.findVersionsByArtifactState(ArtifactState.PENDING, config.batchSize()));

        // 2. 유예 시간이 지난 항목만 정리
        Instant cutoff = clock.instant().minusMillis(config.gracePeriodMs());
        int reconciled = 0;
        int skipped = 0;
        for (ModelVersion version : pending) {
            if (version.createdAt().isAfter(cutoff)) {
                skipped++;
                continue;
            }
            if (tryReconcile(version)) {
                reconciled++;
            }
        }

        // 3. 결과 로깅
        log.info("ArtifactReconciler scan completed: {} reconciled out of {} pending ({} within grace period)",
            reconciled, pending.size(), skipped);
        return reconciled;
    }

    /**
     * 개별 Version 정리 시도.
     *
     * <p>예외 발생 시에도 계속 진행하여 다른 항목 정리를 방해하지 않습니다.</p>
     *
     * @param version PENDING Version
     * @return 상태 확정 여부
     */
    private boolean tryReconcile(ModelVersion version) {
        try {
            // 1. 상위 Model 조회 (이미 삭제되었으면 건너뜀)
            Optional<Model> model = metadataStore.inTransaction(tx -> tx.findModel(version.modelId()));
            if (model.isEmpty()) {
                log.debug("Skipping {}: model {} no longer exists", version.id(), version.modelId());
                return false;
            }
            ArtifactKey key = model.get().artifactKey(version.versionNumber(), version.fileName());

            // 2. artifact 존재 확인
            if (artifactStore.exists(key)) {
                boolean changed = metadataStore.inTransaction(tx -> ArtifactStateTransitions.transition(
                    tx, version.id(), PENDING_ONLY, ArtifactState.STORED, clock.instant()));
                if (changed) {
                    log.info("ArtifactReconciler confirmed {}: {} → {}", key, ArtifactState.PENDING, ArtifactState.STORED);
                }
                return changed;
            }

            // 3. 전략 적용
            if (config.strategy() == ReconcileStrategy.PURGE) {
                boolean purged = metadataStore.inTransaction(tx -> tx.findVersionById(version.id())
                    .filter(current -> current.artifactState() == ArtifactState.PENDING)
                    .map(current -> tx.deleteVersion(current.id()))
                    .orElse(false));
                if (purged) {
                    log.warn("ArtifactReconciler purged {} v{}: artifact {} never arrived",
                        version.modelId(), version.versionNumber(), key);
                }
                return purged;
            }

            boolean marked = metadataStore.inTransaction(tx -> ArtifactStateTransitions.transition(
                tx, version.id(), PENDING_ONLY, ArtifactState.MISSING, clock.instant()));
            if (marked) {
                log.warn("ArtifactReconciler marked {} v{} {}: artifact {} not found",
                    version.modelId(), version.versionNumber(), ArtifactState.MISSING, key);
            }
            return marked;

        } catch (Exception e) {
            log.error("Failed to reconcile {} in ArtifactReconciler scan", version.id(), e);
            return false;
        }
    }
}
