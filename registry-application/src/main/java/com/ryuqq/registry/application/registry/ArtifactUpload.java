package com.ryuqq.registry.application.registry;

import com.ryuqq.registry.core.outcome.RegistryException;

import java.io.ByteArrayInputStream;
import java.io.InputStream;

/**
 * 업로드된 artifact.
 *
 * @param content artifact 바이트
 * @param originalFileName 업로드 시 파일 이름 (정규화 전)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record ArtifactUpload(
    byte[] content,
    String originalFileName
) {

    /**
     * Compact Constructor.
     *
     * @throws RegistryException VALIDATION_FAILURE: content가 null이거나 파일 이름이 비어있는 경우
     */
    public ArtifactUpload {
        if (content == null) {
            throw RegistryException.validation("content cannot be null");
        }
        CommandValidation.requireNonBlank(originalFileName, "originalFileName");
        content = content.clone();
    }

    public static ArtifactUpload of(byte[] content, String originalFileName) {
        return new ArtifactUpload(content, originalFileName);
    }

    /**
     * artifact 바이트를 읽는 스트림 생성.
     *
     * @return 새 InputStream
     */
    public InputStream openStream() {
        return new ByteArrayInputStream(content);
    }

    @Override
    public byte[] content() {
        return content.clone();
    }
}
