/**
 * Abstract SPI contract tests.
 *
 * <p>Each adapter module extends these classes in its own test sources and supplies a fresh
 * store instance; the inherited {@code @Test} methods then run against that adapter.</p>
 *
 * <pre>{@code
 * class InMemoryMetadataStoreContractTest extends AbstractMetadataStoreContractTest {
 *     @Override
 *     protected MetadataStore createStore() {
 *         return new InMemoryMetadataStore();
 *     }
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
package com.ryuqq.registry.testkit.contract;
