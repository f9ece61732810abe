package com.ryuqq.registry.application.registry;

import com.ryuqq.registry.core.model.ModelId;
import com.ryuqq.registry.core.model.VersionId;

/**
 * Version 등록 결과.
 *
 * @param modelId Model ID
 * @param versionNumber 새로 할당된 version 번호
 * @param versionId 새 Version ID
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record VersionRegistration(
    ModelId modelId,
    int versionNumber,
    VersionId versionId
) {

    public VersionRegistration {
        if (modelId == null) {
            throw new IllegalArgumentException("modelId cannot be null");
        }
        if (versionId == null) {
            throw new IllegalArgumentException("versionId cannot be null");
        }
    }

    public String message() {
        return "Model " + modelId.getValue() + " version " + versionNumber + " uploaded successfully";
    }
}
