package com.ryuqq.registry.application.registry;

import com.ryuqq.registry.core.outcome.RegistryException;

import java.util.Map;
import java.util.Optional;

/**
 * 새 Model과 첫 번째 Version 등록 명령.
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * RegisterModelCommand command = RegisterModelCommand.builder("Resnet 50", "image classifier", "dev")
 *     .versionDescription("baseline")
 *     .versionMetrics(Map.of("accuracy", 0.91))
 *     .versionAlias("prod")
 *     .build();
 * </pre>
 *
 * @param name Model 표시용 이름
 * @param description Model 설명
 * @param createdBy 생성자 (Model과 첫 Version 모두에 기록)
 * @param tags Model 태그
 * @param versionDescription 첫 Version 설명
 * @param versionMetrics 첫 Version 지표
 * @param versionParameters 첫 Version 파라미터
 * @param versionTags 첫 Version 태그
 * @param versionAliasOrNull 첫 Version Alias (선택, null 가능)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record RegisterModelCommand(
    String name,
    String description,
    String createdBy,
    Map<String, Object> tags,
    String versionDescription,
    Map<String, Double> versionMetrics,
    Map<String, Object> versionParameters,
    Map<String, Object> versionTags,
    String versionAliasOrNull
) {

    /**
     * Compact Constructor.
     *
     * @throws RegistryException VALIDATION_FAILURE: 필수 문자열이 비어있는 경우
     */
    public RegisterModelCommand {
        CommandValidation.requireNonBlank(name, "name");
        CommandValidation.requireNonBlank(description, "description");
        CommandValidation.requireNonBlank(createdBy, "createdBy");
        CommandValidation.requireNonBlank(versionDescription, "versionDescription");
        CommandValidation.requireNullOrNonBlank(versionAliasOrNull, "versionAlias");
        tags = CommandValidation.copyOrEmpty(tags, "tags");
        versionMetrics = CommandValidation.copyOrEmpty(versionMetrics, "versionMetrics");
        versionParameters = CommandValidation.copyOrEmpty(versionParameters, "versionParameters");
        versionTags = CommandValidation.copyOrEmpty(versionTags, "versionTags");
    }

    /**
     * 첫 Version Alias 조회.
     *
     * @return Alias 이름 (없으면 empty)
     */
    public Optional<String> versionAlias() {
        return Optional.ofNullable(versionAliasOrNull);
    }

    public static Builder builder(String name, String description, String createdBy) {
        return new Builder(name, description, createdBy);
    }

    /**
     * 선택 필드가 많은 명령을 위한 빌더.
     */
    public static final class Builder {

        private final String name;
        private final String description;
        private final String createdBy;
        private Map<String, Object> tags;
        private String versionDescription;
        private Map<String, Double> versionMetrics;
        private Map<String, Object> versionParameters;
        private Map<String, Object> versionTags;
        private String versionAlias;

        private Builder(String name, String description, String createdBy) {
            this.name = name;
            this.description = description;
            this.createdBy = createdBy;
        }

        public Builder tags(Map<String, Object> tags) {
            this.tags = tags;
            return this;
        }

        public Builder versionDescription(String versionDescription) {
            this.versionDescription = versionDescription;
            return this;
        }

        public Builder versionMetrics(Map<String, Double> versionMetrics) {
            this.versionMetrics = versionMetrics;
            return this;
        }

        public Builder versionParameters(Map<String, Object> versionParameters) {
            this.versionParameters = versionParameters;
            return this;
        }

        public Builder versionTags(Map<String, Object> versionTags) {
            this.versionTags = versionTags;
            return this;
        }

        public Builder versionAlias(String versionAlias) {
            this.versionAlias = versionAlias;
            return this;
        }

        public RegisterModelCommand build() {
            return new RegisterModelCommand(name, description, createdBy, tags, versionDescription,
                versionMetrics, versionParameters, versionTags, versionAlias);
        }
    }
}
