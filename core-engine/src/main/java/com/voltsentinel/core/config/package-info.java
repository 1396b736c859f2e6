/**
 * Configuration loading and validation for Volt Sentinel.
 *
 * <p>
 * Thresholds, debounce windows and buffer capacities are defined in YAML and
 * loaded by {@link com.voltsentinel.core.config.MonitorConfigLoader} into a
 * {@link com.voltsentinel.core.config.MonitorConfig} instance. Validation runs
 * automatically after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.voltsentinel.core.config;
