package com.ryuqq.registry.adapter.inmemory.artifact;

import com.ryuqq.registry.core.model.ArtifactKey;
import com.ryuqq.registry.core.spi.ArtifactStorageException;
import com.ryuqq.registry.core.spi.ArtifactStore;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link ArtifactStore} SPI for testing and reference purposes.
 *
 * <p>Artifacts are kept as byte arrays in a {@link ConcurrentHashMap}. Locations are
 * reported as {@code memory:/<modelKey>/<versionNumber>/<fileName>} URIs, which callers
 * can only dereference through {@link #read(ArtifactKey)}.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class InMemoryArtifactStore implements ArtifactStore {

    static final String SCHEME = "memory";

    private final ConcurrentHashMap<ArtifactKey, byte[]> artifacts = new ConcurrentHashMap<>();

    @Override
    public boolean save(ArtifactKey key, InputStream content) {
        requireKey(key);
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        try {
            artifacts.put(key, content.readAllBytes());
            return true;
        } catch (IOException e) {
            throw new ArtifactStorageException(key, "Failed to read artifact content for " + key, e);
        }
    }

    @Override
    public boolean delete(ArtifactKey key) {
        requireKey(key);
        return artifacts.remove(key) != null;
    }

    @Override
    public Optional<URI> resolve(ArtifactKey key) {
        requireKey(key);
        if (!artifacts.containsKey(key)) {
            return Optional.empty();
        }
        try {
            String path = "/" + key.modelKey() + "/" + key.versionNumber() + "/" + key.fileName();
            return Optional.of(new URI(SCHEME, path, null));
        } catch (URISyntaxException e) {
            throw new ArtifactStorageException(key, "Cannot build location for " + key, e);
        }
    }

    @Override
    public Optional<byte[]> read(ArtifactKey key) {
        requireKey(key);
        byte[] content = artifacts.get(key);
        return content == null ? Optional.empty() : Optional.of(content.clone());
    }

    @Override
    public boolean exists(ArtifactKey key) {
        requireKey(key);
        return artifacts.containsKey(key);
    }

    @Override
    public List<String> listFiles(String modelKey, int versionNumber) {
        if (modelKey == null || modelKey.isBlank()) {
            throw new IllegalArgumentException("modelKey cannot be null or blank");
        }
        if (versionNumber <= 0) {
            throw new IllegalArgumentException("versionNumber must be positive, but was: " + versionNumber);
        }
        return artifacts.keySet().stream()
            .filter(key -> key.modelKey().equals(modelKey) && key.versionNumber() == versionNumber)
            .map(ArtifactKey::fileName)
            .sorted()
            .collect(Collectors.toList());
    }

    /**
     * 저장된 artifact 수 (테스트용).
     *
     * @return artifact count
     */
    public int size() {
        return artifacts.size();
    }

    /**
     * 모든 데이터 초기화 (테스트용).
     */
    public void clear() {
        artifacts.clear();
    }

    private static void requireKey(ArtifactKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }
}
