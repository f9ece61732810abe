package com.ryuqq.registry.adapter.localfs.settings;

import com.ryuqq.registry.adapter.localfs.artifact.LocalArtifactStore;
import com.ryuqq.registry.adapter.localfs.artifact.LocalArtifactStoreConfig;
import com.ryuqq.registry.core.spi.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 설정에 따라 활성 Artifact Store 하나를 생성합니다.
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class ArtifactStoreFactory {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStoreFactory.class);

    public static final String LOCAL = "local";

    private ArtifactStoreFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Artifact Store 생성.
     *
     * @param settings 저장소 설정
     * @return 활성 Artifact Store
     * @throws IllegalArgumentException 지원하지 않는 저장 방식인 경우
     */
    public static ArtifactStore create(StorageSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        if (LOCAL.equals(settings.method())) {
            LocalArtifactStore store = new LocalArtifactStore(new LocalArtifactStoreConfig().withBasePath(settings.path()));
            log.info("Using local artifact store at {}", store.basePath());
            return store;
        }
        throw new IllegalArgumentException(
            "Invalid model storage method: " + settings.method() + ". Supported methods: " + LOCAL);
    }
}
