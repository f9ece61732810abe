/**
 * Failure injection for exercising the registry's partial-failure paths.
 *
 * @since 1.0.0
 */
package com.ryuqq.registry.testkit.fault;
