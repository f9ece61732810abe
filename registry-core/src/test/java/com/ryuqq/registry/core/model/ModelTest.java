package com.ryuqq.registry.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Model, ModelVersion, ArtifactKey record 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class ModelTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant T1 = T0.plusSeconds(60);

    private Model model() {
        return new Model(ModelId.of(1), "Resnet 50", "resnet_50", "desc", "dev", Map.of("team", "vision"), T0, T0, 1);
    }

    @Test
    void nextVersionNumber_LatestPlusOne() {
        assertEquals(2, model().nextVersionNumber());
    }

    @Test
    void withLatestVersion_BumpsCounterAndUpdatedAt() {
        Model bumped = model().withLatestVersion(2, T1);

        assertEquals(2, bumped.latestVersionNumber());
        assertEquals(T1, bumped.updatedAt());
        assertEquals(T0, bumped.createdAt());
    }

    @Test
    void withMetadata_KeepsStorageKeyAndCounter() {
        Model renamed = model().withMetadata("ResNet-50 v2", "new", "ops", Map.of(), T1);

        assertEquals("ResNet-50 v2", renamed.name());
        assertEquals("resnet_50", renamed.storageKey());
        assertEquals(1, renamed.latestVersionNumber());
        assertEquals(T1, renamed.updatedAt());
    }

    @Test
    void artifactKey_UsesStorageKey() {
        ArtifactKey key = model().withMetadata("Renamed", null, null, null, T1).artifactKey(3, "weights.skops");

        assertEquals(ArtifactKey.of("resnet_50", 3, "weights.skops"), key);
    }

    @Test
    void tags_DefensivelyCopiedAndNullBecomesEmpty() {
        // Given
        Map<String, Object> tags = new HashMap<>();
        tags.put("owner", null);

        // When
        Model withNullValue = new Model(ModelId.of(1), "m", "m", null, null, tags, T0, T0, 0);
        tags.put("later", "ignored");
        Model withoutTags = new Model(ModelId.of(2), "n", "n", null, null, null, T0, T0, 0);

        // Then
        assertTrue(withNullValue.tags().containsKey("owner"));
        assertFalse(withNullValue.tags().containsKey("later"));
        assertTrue(withoutTags.tags().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> withNullValue.tags().put("x", "y"));
    }

    @Test
    void constructor_BlankNameOrNegativeCounter_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new Model(ModelId.of(1), " ", "k", null, null, null, T0, T0, 0));
        assertThrows(IllegalArgumentException.class,
            () -> new Model(ModelId.of(1), "n", "k", null, null, null, T0, T0, -1));
        assertThrows(IllegalArgumentException.class,
            () -> new Model(null, "n", "k", null, null, null, T0, T0, 0));
    }

    @Test
    void modelVersion_WithArtifactState_OnlyStateAndUpdatedAtChange() {
        // Given
        ModelVersion pending = new ModelVersion(VersionId.of(5), ModelId.of(1), 2, "d", "dev",
            Map.of(), Map.of("accuracy", 0.91), Map.of("epochs", 10), "file_test.png", ArtifactState.PENDING, T0, T0);

        // When
        ModelVersion stored = pending.withArtifactState(ArtifactState.STORED, T1);

        // Then
        assertEquals(ArtifactState.STORED, stored.artifactState());
        assertEquals(T1, stored.updatedAt());
        assertEquals(pending.id(), stored.id());
        assertEquals(0.91, stored.metrics().get("accuracy"));
        assertEquals(pending.fileName(), stored.fileName());
    }

    @Test
    void artifactKey_InvalidParts_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ArtifactKey.of("", 1, "f"));
        assertThrows(IllegalArgumentException.class, () -> ArtifactKey.of("m", 0, "f"));
        assertThrows(IllegalArgumentException.class, () -> ArtifactKey.of("m", 1, null));
    }

    @Test
    void artifactState_OnlyPendingRequiresReconciliation() {
        assertTrue(ArtifactState.PENDING.requiresReconciliation());
        assertFalse(ArtifactState.STORED.requiresReconciliation());
        assertFalse(ArtifactState.MISSING.requiresReconciliation());
    }
}
