package com.ryuqq.registry.application.registry;

import com.ryuqq.registry.core.model.ModelId;

/**
 * Model 등록 결과.
 *
 * @param modelId 새 Model ID
 * @param name Model 표시용 이름
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record ModelRegistration(
    ModelId modelId,
    String name
) {

    public ModelRegistration {
        if (modelId == null) {
            throw new IllegalArgumentException("modelId cannot be null");
        }
    }

    /**
     * 사람이 읽을 수 있는 결과 메시지.
     *
     * @return 메시지
     */
    public String message() {
        return "Model " + name + " uploaded successfully";
    }
}
