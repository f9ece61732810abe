/**
 * Operation outcome package.
 *
 * <p>Defines how registry operations report failures and artifact lookups.</p>
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.outcome.RegistryException} - thrown by every operation on failure</li>
 *   <li>{@link com.ryuqq.registry.core.outcome.ErrorKind} - NOT_FOUND, CONFLICT, VALIDATION_FAILURE, STORAGE_FAILURE</li>
 *   <li>{@link com.ryuqq.registry.core.outcome.Failure} - transport-neutral failure for the API layer</li>
 * </ul>
 *
 * <h2>Artifact Resolution</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.outcome.Resolved} - artifact found</li>
 *   <li>{@link com.ryuqq.registry.core.outcome.Missing} - metadata present, bytes absent</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.outcome;
