/**
 * In-memory Metadata Store adapter with copy-on-commit transactions.
 *
 * <h2>Transaction Semantics</h2>
 *
 * <ul>
 *   <li><strong>Atomic:</strong> a unit of work sees its own writes; they become visible only when it returns</li>
 *   <li><strong>Rollback:</strong> an exception thrown from the unit of work discards every change</li>
 *   <li><strong>Serialized:</strong> one transaction at a time; nested transactions are rejected</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 *
 * <p>Model name, model storage key, (model, version number), alias name and alias per version
 * are unique. Deleting a model removes its versions; deleting a version removes its alias.</p>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * InMemoryMetadataStore store = new InMemoryMetadataStore();
 * Model model = store.inTransaction(tx -> tx.insertModel(newModel));
 * }</pre>
 *
 * @since 1.0.0
 */
package com.ryuqq.registry.adapter.inmemory.metadata;
