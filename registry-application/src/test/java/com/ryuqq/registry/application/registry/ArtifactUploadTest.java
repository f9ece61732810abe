package com.ryuqq.registry.application.registry;

import com.ryuqq.registry.core.model.ModelId;
import com.ryuqq.registry.core.model.VersionId;
import com.ryuqq.registry.core.outcome.ErrorKind;
import com.ryuqq.registry.core.outcome.RegistryException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ArtifactUpload 및 결과 record 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class ArtifactUploadTest {

    @Test
    void of_ContentIsCopied() throws IOException {
        // Given
        byte[] content = "weights".getBytes(StandardCharsets.UTF_8);

        // When
        ArtifactUpload upload = ArtifactUpload.of(content, "file test.png");
        content[0] = 'X';

        // Then
        assertThat(upload.content()).isEqualTo("weights".getBytes(StandardCharsets.UTF_8));
        assertThat(upload.openStream().readAllBytes()).isEqualTo("weights".getBytes(StandardCharsets.UTF_8));
        assertThat(upload.originalFileName()).isEqualTo("file test.png");
    }

    @Test
    void of_EmptyContentAllowed() {
        assertThat(ArtifactUpload.of(new byte[0], "empty.bin").content()).isEmpty();
    }

    @Test
    void of_NullContent_ValidationFailure() {
        assertThatThrownBy(() -> ArtifactUpload.of(null, "file test.png"))
            .isInstanceOf(RegistryException.class)
            .hasMessageContaining("content cannot be null")
            .extracting(e -> ((RegistryException) e).kind())
            .isEqualTo(ErrorKind.VALIDATION_FAILURE);
    }

    @Test
    void of_BlankFileName_ValidationFailure() {
        assertThatThrownBy(() -> ArtifactUpload.of(new byte[] {1}, " "))
            .isInstanceOf(RegistryException.class)
            .hasMessageContaining("originalFileName");
    }

    @Test
    void registrations_Messages() {
        ModelRegistration model = new ModelRegistration(ModelId.of(1), "test2");
        VersionRegistration version = new VersionRegistration(ModelId.of(1), 2, VersionId.of(7));

        assertThat(model.message()).isEqualTo("Model test2 uploaded successfully");
        assertThat(version.message()).isEqualTo("Model 1 version 2 uploaded successfully");
    }

    @Test
    void deletionReport_NegativeCounts_Rejected() {
        assertThatThrownBy(() -> new DeletionReport(ModelId.of(1), -1, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
