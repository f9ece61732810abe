package com.ryuqq.registry.application.registry;

import com.ryuqq.registry.core.model.Model;
import com.ryuqq.registry.core.model.ModelDetails;
import com.ryuqq.registry.core.model.ModelId;
import com.ryuqq.registry.core.model.VersionDetails;
import com.ryuqq.registry.core.outcome.ArtifactResolution;

import java.util.List;

/**
 * Model 레지스트리 연산 계약.
 *
 * <p>외부 HTTP/RPC 계층이 호출하는 유일한 진입점입니다. 모든 연산은 성공 결과를 반환하거나
 * {@link com.ryuqq.registry.core.outcome.RegistryException}을 던집니다.</p>
 *
 * <p><strong>쓰기 순서:</strong></p>
 * <ol>
 *   <li>입력 검증, 존재/중복 검사 (부작용 없음)</li>
 *   <li>Metadata Store 변경을 하나의 트랜잭션으로 커밋</li>
 *   <li>Artifact Store 변경 (트랜잭션 밖, 실패 시 메타데이터는 유지)</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ModelRegistration registration = registry.registerModel(command, ArtifactUpload.of(bytes, "model.skops"));
 * VersionRegistration v2 = registry.registerVersion(registration.modelId(),
 *     RegisterVersionCommand.of("retrained", "dev").withAlias("prod"),
 *     ArtifactUpload.of(newBytes, "model.skops"));
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public interface ModelRegistry {

    /**
     * 모든 Model을 Version, Alias와 함께 조회.
     *
     * @return Model 목록 (없으면 빈 목록)
     */
    List<ModelDetails> listModels();

    /**
     * 등록된 Model 수 조회.
     *
     * @return Model 수
     */
    int countModels();

    /**
     * Model 조회.
     *
     * @param modelId Model ID
     * @return Version이 포함된 Model
     * @throws com.ryuqq.registry.core.outcome.RegistryException NOT_FOUND
     */
    ModelDetails getModel(ModelId modelId);

    /**
     * 새 Model과 version 1 등록.
     *
     * @param command 등록 명령
     * @param artifact version 1 artifact
     * @return 새 Model ID와 이름
     * @throws com.ryuqq.registry.core.outcome.RegistryException CONFLICT (이름 또는 Alias 중복),
     *         STORAGE_FAILURE (메타데이터 커밋 후 artifact 저장 실패)
     */
    ModelRegistration registerModel(RegisterModelCommand command, ArtifactUpload artifact);

    /**
     * Model 메타데이터 부분 수정.
     *
     * @param modelId Model ID
     * @param patch 변경할 필드
     * @return 수정된 Model
     * @throws com.ryuqq.registry.core.outcome.RegistryException NOT_FOUND, CONFLICT (이름 중복)
     */
    Model updateModel(ModelId modelId, ModelPatch patch);

    /**
     * Model과 모든 Version, Alias, artifact 삭제.
     *
     * @param modelId Model ID
     * @return 삭제 결과
     * @throws com.ryuqq.registry.core.outcome.RegistryException NOT_FOUND,
     *         STORAGE_FAILURE (메타데이터 삭제 후 일부 artifact 삭제 실패)
     */
    DeletionReport deleteModel(ModelId modelId);

    /**
     * 기존 Model에 새 Version 등록.
     *
     * @param modelId Model ID
     * @param command 등록 명령
     * @param artifact artifact
     * @return Model ID, 새 version 번호, 새 Version ID
     * @throws com.ryuqq.registry.core.outcome.RegistryException NOT_FOUND, CONFLICT (Alias 중복),
     *         STORAGE_FAILURE
     */
    VersionRegistration registerVersion(ModelId modelId, RegisterVersionCommand command, ArtifactUpload artifact);

    /**
     * Version 조회.
     *
     * @param modelId Model ID
     * @param versionNumber version 번호
     * @return Alias가 포함된 Version
     * @throws com.ryuqq.registry.core.outcome.RegistryException NOT_FOUND
     */
    VersionDetails getVersion(ModelId modelId, int versionNumber);

    /**
     * Version과 Alias, artifact 삭제. Model의 version 카운터는 변경되지 않습니다.
     *
     * @param modelId Model ID
     * @param versionNumber version 번호
     * @return 삭제 결과
     * @throws com.ryuqq.registry.core.outcome.RegistryException NOT_FOUND, STORAGE_FAILURE
     */
    DeletionReport deleteVersion(ModelId modelId, int versionNumber);

    /**
     * Version artifact 위치 확인.
     *
     * @param modelId Model ID
     * @param versionNumber version 번호
     * @return Resolved 또는 Missing (메타데이터는 있으나 artifact 없음)
     * @throws com.ryuqq.registry.core.outcome.RegistryException NOT_FOUND (메타데이터 없음), STORAGE_FAILURE
     */
    ArtifactResolution downloadVersion(ModelId modelId, int versionNumber);
}
