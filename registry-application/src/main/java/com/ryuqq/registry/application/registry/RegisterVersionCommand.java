package com.ryuqq.registry.application.registry;

import java.util.Map;
import java.util.Optional;

/**
 * 기존 Model에 새 Version 등록 명령.
 *
 * @param description Version 설명
 * @param createdBy 생성자
 * @param tags 태그
 * @param metrics 지표
 * @param parameters 파라미터
 * @param aliasOrNull Alias (선택, null 가능)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record RegisterVersionCommand(
    String description,
    String createdBy,
    Map<String, Object> tags,
    Map<String, Double> metrics,
    Map<String, Object> parameters,
    String aliasOrNull
) {

    public RegisterVersionCommand {
        CommandValidation.requireNonBlank(description, "description");
        CommandValidation.requireNonBlank(createdBy, "createdBy");
        CommandValidation.requireNullOrNonBlank(aliasOrNull, "alias");
        tags = CommandValidation.copyOrEmpty(tags, "tags");
        metrics = CommandValidation.copyOrEmpty(metrics, "metrics");
        parameters = CommandValidation.copyOrEmpty(parameters, "parameters");
    }

    /**
     * 메타데이터 없이 설명과 생성자만으로 명령 생성.
     *
     * @param description Version 설명
     * @param createdBy 생성자
     * @return RegisterVersionCommand
     */
    public static RegisterVersionCommand of(String description, String createdBy) {
        return new RegisterVersionCommand(description, createdBy, null, null, null, null);
    }

    /**
     * Alias만 변경한 새 인스턴스 생성.
     *
     * @param alias Alias 이름
     * @return 새 RegisterVersionCommand
     */
    public RegisterVersionCommand withAlias(String alias) {
        return new RegisterVersionCommand(description, createdBy, tags, metrics, parameters, alias);
    }

    public Optional<String> alias() {
        return Optional.ofNullable(aliasOrNull);
    }
}
