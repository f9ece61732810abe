/**
 * In-memory Artifact Store adapter keeping artifact bytes on the heap.
 *
 * <p>Intended for tests and for wiring the registry without a filesystem.
 * Every operation is thread-safe; nothing survives a restart.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.registry.adapter.inmemory.artifact;
