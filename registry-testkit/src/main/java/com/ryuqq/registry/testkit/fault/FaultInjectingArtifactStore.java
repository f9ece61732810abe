package com.ryuqq.registry.testkit.fault;

import com.ryuqq.registry.core.model.ArtifactKey;
import com.ryuqq.registry.core.spi.ArtifactStorageException;
import com.ryuqq.registry.core.spi.ArtifactStore;

import java.io.InputStream;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * {@link ArtifactStore} decorator that injects failures for partial-failure tests.
 *
 * <p>Every call is forwarded to the delegate unless a failure is armed for it. Armed
 * failures stay active until {@link #reset()}.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * FaultInjectingArtifactStore artifacts = new FaultInjectingArtifactStore(new InMemoryArtifactStore());
 * artifacts.failSaves();
 *
 * assertThatThrownBy(() -&gt; registry.registerModel(command, upload))
 *     .isInstanceOf(RegistryException.class);
 * // metadata committed, version left PENDING, no artifact stored
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class FaultInjectingArtifactStore implements ArtifactStore {

    private static final Predicate<ArtifactKey> NONE = key -> false;

    private final ArtifactStore delegate;
    private final AtomicInteger saveAttempts = new AtomicInteger();
    private final AtomicInteger deleteAttempts = new AtomicInteger();

    private volatile Predicate<ArtifactKey> saveFailures = NONE;
    private volatile Predicate<ArtifactKey> deleteFailures = NONE;
    private volatile Predicate<ArtifactKey> resolveFailures = NONE;
    private volatile boolean rejectSaves;

    public FaultInjectingArtifactStore(ArtifactStore delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    /**
     * Makes every save throw {@link ArtifactStorageException}.
     */
    public void failSaves() {
        this.saveFailures = key -> true;
    }

    /**
     * Makes every save return {@code false} without storing anything.
     */
    public void rejectSaves() {
        this.rejectSaves = true;
    }

    /**
     * Makes every delete throw {@link ArtifactStorageException}.
     */
    public void failDeletes() {
        failDeletesWhen(key -> true);
    }

    /**
     * Makes deletes of matching keys throw {@link ArtifactStorageException}.
     *
     * @param condition keys to fail
     */
    public void failDeletesWhen(Predicate<ArtifactKey> condition) {
        if (condition == null) {
            throw new IllegalArgumentException("condition cannot be null");
        }
        this.deleteFailures = condition;
    }

    /**
     * Makes every resolve throw {@link ArtifactStorageException}.
     */
    public void failResolves() {
        this.resolveFailures = key -> true;
    }

    /**
     * Disarms every injected failure. Attempt counters are kept.
     */
    public void reset() {
        this.saveFailures = NONE;
        this.deleteFailures = NONE;
        this.resolveFailures = NONE;
        this.rejectSaves = false;
    }

    public int saveAttempts() {
        return saveAttempts.get();
    }

    public int deleteAttempts() {
        return deleteAttempts.get();
    }

    @Override
    public boolean save(ArtifactKey key, InputStream content) {
        saveAttempts.incrementAndGet();
        if (saveFailures.test(key)) {
            throw new ArtifactStorageException(key, "Injected save failure for " + key);
        }
        if (rejectSaves) {
            return false;
        }
        return delegate.save(key, content);
    }

    @Override
    public boolean delete(ArtifactKey key) {
        deleteAttempts.incrementAndGet();
        if (deleteFailures.test(key)) {
            throw new ArtifactStorageException(key, "Injected delete failure for " + key);
        }
        return delegate.delete(key);
    }

    @Override
    public Optional<URI> resolve(ArtifactKey key) {
        if (resolveFailures.test(key)) {
            throw new ArtifactStorageException(key, "Injected resolve failure for " + key);
        }
        return delegate.resolve(key);
    }

    @Override
    public Optional<byte[]> read(ArtifactKey key) {
        return delegate.read(key);
    }

    @Override
    public boolean exists(ArtifactKey key) {
        return delegate.exists(key);
    }

    @Override
    public List<String> listFiles(String modelKey, int versionNumber) {
        return delegate.listFiles(modelKey, versionNumber);
    }
}
