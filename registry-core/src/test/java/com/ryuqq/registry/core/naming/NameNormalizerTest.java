package com.ryuqq.registry.core.naming;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NameNormalizer 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class NameNormalizerTest {

    @Test
    void normalize_MixedCaseWithSpaces_LowercasesAndUnderscores() {
        assertEquals("resnet_50", NameNormalizer.normalize("Resnet 50"));
    }

    @Test
    void normalize_UploadFileName_KeepsExtension() {
        assertEquals("file_test.png", NameNormalizer.normalize("file test.png"));
    }

    @Test
    void normalize_EverySpaceReplaced() {
        // 연속 공백, 앞뒤 공백도 각각 '_'로 치환 (trim 없음)
        assertEquals("__a__b_", NameNormalizer.normalize("  A  b "));
    }

    @Test
    void normalize_OtherCharactersUntouched() {
        assertEquals("model-v2.1_final\ttab", NameNormalizer.normalize("Model-V2.1_Final\tTAB"));
    }

    @Test
    void normalize_LocaleIndependent() {
        // 터키어 로케일에서도 'I' → 'i'
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            assertEquals("title", NameNormalizer.normalize("TITLE"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void normalize_Idempotent() {
        String once = NameNormalizer.normalize("Resnet 50");
        assertEquals(once, NameNormalizer.normalize(once));
    }

    @Test
    void normalize_NullName_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> NameNormalizer.normalize(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }
}
