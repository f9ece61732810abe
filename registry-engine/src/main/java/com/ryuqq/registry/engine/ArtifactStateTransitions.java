package com.ryuqq.registry.engine;

import com.ryuqq.registry.core.model.ArtifactState;
import com.ryuqq.registry.core.model.ModelVersion;
import com.ryuqq.registry.core.model.VersionId;
import com.ryuqq.registry.core.spi.MetadataTransaction;

import java.time.Instant;
import java.util.Set;

/**
 * Version의 artifact 상태 전이.
 *
 * <p>현재 상태를 트랜잭션 안에서 다시 읽은 뒤 허용된 상태일 때만 변경합니다.
 * 그 사이 Version이 삭제되었거나 다른 상태로 바뀌었다면 아무것도 하지 않습니다.</p>
 */
final class ArtifactStateTransitions {

    private ArtifactStateTransitions() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 조건부 상태 전이.
     *
     * @param tx 트랜잭션
     * @param versionId 대상 Version
     * @param from 허용되는 현재 상태
     * @param to 목표 상태
     * @param at 수정 시각
     * @return 상태가 변경되었으면 true
     */
    static boolean transition(MetadataTransaction tx, VersionId versionId, Set<ArtifactState> from,
                              ArtifactState to, Instant at) {
        ModelVersion current = tx.findVersionById(versionId).orElse(null);
        if (current == null || current.artifactState() == to || !from.contains(current.artifactState())) {
            return false;
        }
        tx.updateVersion(current.withArtifactState(to, at));
        return true;
    }
}
