package com.ryuqq.registry.core.model;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Version과 Alias가 즉시 로드된 Model.
 *
 * <p>Version 목록은 version 번호 오름차순으로 정렬됩니다.</p>
 *
 * @param model Model 행
 * @param versions 현재 존재하는 Version 목록
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record ModelDetails(
    Model model,
    List<VersionDetails> versions
) {

    public ModelDetails {
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }
        versions = versions == null
            ? List.of()
            : versions.stream()
                .sorted(Comparator.comparingInt(details -> details.version().versionNumber()))
                .toList();
    }

    /**
     * version 번호로 Version 조회.
     *
     * @param versionNumber version 번호
     * @return VersionDetails (없으면 empty)
     */
    public Optional<VersionDetails> version(int versionNumber) {
        return versions.stream()
            .filter(details -> details.version().versionNumber() == versionNumber)
            .findFirst();
    }
}
