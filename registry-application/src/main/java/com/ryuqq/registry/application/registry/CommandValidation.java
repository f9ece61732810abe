package com.ryuqq.registry.application.registry;

import com.ryuqq.registry.core.outcome.RegistryException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 명령 필드 검증 유틸리티.
 *
 * <p>검증 실패는 {@link RegistryException}({@code VALIDATION_FAILURE})으로 보고됩니다.</p>
 */
final class CommandValidation {

    private CommandValidation() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw RegistryException.validation(field + " cannot be null or blank");
        }
        return value;
    }

    static String requireNullOrNonBlank(String value, String field) {
        if (value != null && value.isBlank()) {
            throw RegistryException.validation(field + " cannot be blank");
        }
        return value;
    }

    static <V> Map<String, V> copyOrEmpty(Map<String, V> map, String field) {
        if (map == null) {
            return Map.of();
        }
        for (String key : map.keySet()) {
            if (key == null) {
                throw RegistryException.validation(field + " cannot contain null keys");
            }
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
