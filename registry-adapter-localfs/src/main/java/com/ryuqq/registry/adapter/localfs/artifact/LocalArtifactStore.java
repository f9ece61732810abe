package com.ryuqq.registry.adapter.localfs.artifact;

import com.ryuqq.registry.core.model.ArtifactKey;
import com.ryuqq.registry.core.spi.ArtifactStorageException;
import com.ryuqq.registry.core.spi.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link ArtifactStore} SPI.
 *
 * <p>Artifacts are stored at {@code <basePath>/<modelKey>/<versionNumber>/<fileName>}.
 * Directories are created lazily on the first save.</p>
 *
 * <p><strong>Write Path:</strong></p>
 * <pre>
 * 1. createDirectories(&lt;basePath&gt;/&lt;modelKey&gt;/&lt;versionNumber&gt;)
 * 2. copy stream → temporary file in the same directory
 * 3. move temporary file → target (atomic where the filesystem supports it)
 * </pre>
 *
 * <p>A reader never observes a partially written artifact under the target name, so
 * {@link #exists(ArtifactKey)} is safe to use for reconciliation.</p>
 *
 * <p><strong>Delete Path:</strong> the file is removed and, when
 * {@link LocalArtifactStoreConfig#pruneEmptyDirectories()} is set, the version and model
 * directories are removed once they are empty. The base directory itself is never removed.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class LocalArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(LocalArtifactStore.class);
    private static final String TEMP_SUFFIX = ".uploading";

    private final Path basePath;
    private final boolean pruneEmptyDirectories;

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public LocalArtifactStore(LocalArtifactStoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.basePath = config.basePath().toAbsolutePath().normalize();
        this.pruneEmptyDirectories = config.pruneEmptyDirectories();
    }

    /**
     * 기본 설정에 basePath만 지정하는 생성자.
     *
     * @param basePath artifact 루트 디렉토리
     */
    public LocalArtifactStore(Path basePath) {
        this(new LocalArtifactStoreConfig().withBasePath(basePath));
    }

    public Path basePath() {
        return basePath;
    }

    @Override
    public boolean save(ArtifactKey key, InputStream content) {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        Path target = pathOf(key);
        Path directory = target.getParent();
        Path temp = directory.resolve(target.getFileName() + TEMP_SUFFIX);

        try {
            Files.createDirectories(directory);
            Files.copy(content, temp, StandardCopyOption.REPLACE_EXISTING);
            moveIntoPlace(temp, target);
            log.debug("Artifact saved: {} ({} bytes)", target, Files.size(target));
            return true;
        } catch (IOException e) {
            cleanupTemp(temp);
            throw new ArtifactStorageException(key, "Failed to save artifact to " + target, e);
        }
    }

    @Override
    public boolean delete(ArtifactKey key) {
        Path target = pathOf(key);
        try {
            boolean deleted = Files.deleteIfExists(target);
            if (deleted && pruneEmptyDirectories) {
                pruneIfEmpty(target.getParent());
                pruneIfEmpty(target.getParent().getParent());
            }
            return deleted;
        } catch (IOException e) {
            throw new ArtifactStorageException(key, "Failed to delete artifact " + target, e);
        }
    }

    @Override
    public Optional<URI> resolve(ArtifactKey key) {
        Path target = pathOf(key);
        return Files.isRegularFile(target) ? Optional.of(target.toUri()) : Optional.empty();
    }

    @Override
    public Optional<byte[]> read(ArtifactKey key) {
        Path target = pathOf(key);
        try {
            return Optional.of(Files.readAllBytes(target));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new ArtifactStorageException(key, "Failed to read artifact " + target, e);
        }
    }

    @Override
    public boolean exists(ArtifactKey key) {
        return Files.isRegularFile(pathOf(key));
    }

    @Override
    public List<String> listFiles(String modelKey, int versionNumber) {
        if (modelKey == null || modelKey.isBlank()) {
            throw new IllegalArgumentException("modelKey cannot be null or blank");
        }
        if (versionNumber <= 0) {
            throw new IllegalArgumentException("versionNumber must be positive, but was: " + versionNumber);
        }
        Path directory = contained(basePath.resolve(modelKey).resolve(String.valueOf(versionNumber)));
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                .filter(Files::isRegularFile)
                .map(path -> path.getFileName().toString())
                .filter(name -> !name.endsWith(TEMP_SUFFIX))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ArtifactStorageException(null, "Failed to list artifacts in " + directory, e);
        }
    }

    private Path pathOf(ArtifactKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return contained(basePath
            .resolve(key.modelKey())
            .resolve(String.valueOf(key.versionNumber()))
            .resolve(key.fileName()));
    }

    private Path contained(Path path) {
        Path normalized = path.normalize();
        if (!normalized.startsWith(basePath) || normalized.equals(basePath)) {
            throw new IllegalArgumentException("Artifact path escapes base directory: " + path);
        }
        return normalized;
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to plain move", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void cleanupTemp(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to remove temporary file {}", temp, e);
        }
    }

    private void pruneIfEmpty(Path directory) throws IOException {
        if (directory == null || directory.equals(basePath) || !directory.startsWith(basePath)) {
            return;
        }
        try (Stream<Path> entries = Files.list(directory)) {
            if (entries.findAny().isPresent()) {
                return;
            }
        }
        try {
            Files.deleteIfExists(directory);
        } catch (DirectoryNotEmptyException e) {
            log.debug("Directory {} was refilled before pruning", directory);
        }
    }
}
