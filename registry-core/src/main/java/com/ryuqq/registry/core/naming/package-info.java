/**
 * Name normalization package.
 *
 * <p>{@link com.ryuqq.registry.core.naming.NameNormalizer} derives storage keys from display names.
 * Display names are stored verbatim; only keys used for Artifact Store paths and uniqueness
 * checks are normalized.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.naming;
