package com.ryuqq.registry.application.registry;

import com.ryuqq.registry.core.model.ModelId;

/**
 * 삭제 연산 결과.
 *
 * @param modelId 대상 Model ID
 * @param versionsDeleted 삭제된 Version 행 수
 * @param artifactsDeleted Artifact Store에서 실제로 제거된 artifact 수
 *                         (이미 없던 artifact는 포함하지 않음)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record DeletionReport(
    ModelId modelId,
    int versionsDeleted,
    int artifactsDeleted
) {

    public DeletionReport {
        if (modelId == null) {
            throw new IllegalArgumentException("modelId cannot be null");
        }
        if (versionsDeleted < 0 || artifactsDeleted < 0) {
            throw new IllegalArgumentException("counts cannot be negative");
        }
    }
}
