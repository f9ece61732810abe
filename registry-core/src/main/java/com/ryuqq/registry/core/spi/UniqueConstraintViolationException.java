package com.ryuqq.registry.core.spi;

/**
 * Raised by a {@link MetadataTransaction} when an insert or update would break a uniqueness constraint.
 *
 * <p>The engine checks uniqueness before writing; this exception is the storage-layer
 * second line of defence for concurrent writers.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class UniqueConstraintViolationException extends RuntimeException {

    private final String constraint;

    /**
     * @param constraint the constraint name (e.g. {@code model_name}, {@code alias_name})
     * @param message the violation detail
     */
    public UniqueConstraintViolationException(String constraint, String message) {
        super(message);
        this.constraint = constraint;
    }

    public String constraint() {
        return constraint;
    }
}
