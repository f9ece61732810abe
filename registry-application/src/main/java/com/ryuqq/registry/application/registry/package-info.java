/**
 * Registry application contract.
 *
 * <p>{@link com.ryuqq.registry.application.registry.ModelRegistry} is the operation surface
 * offered to the transport layer, with its command and result records.</p>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * engine (RegistryEngine)
 *   ↓ implements
 * application (ModelRegistry, commands, results)
 *   ↓ depends on
 * core (model, outcome, spi)
 * </pre>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.application.registry;
