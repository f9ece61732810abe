/**
 * Storage backend selection from environment variables.
 *
 * @since 1.0.0
 */
package com.ryuqq.registry.adapter.localfs.settings;
