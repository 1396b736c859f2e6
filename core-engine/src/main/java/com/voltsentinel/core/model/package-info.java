/**
 * Domain model classes for Volt Sentinel.
 *
 * <p>
 * This package contains the value types shared between the monitoring engine
 * and the Flink job layer:
 * </p>
 * <ul>
 * <li>{@link com.voltsentinel.core.model.HealthPayload}: decoded transport
 * payload</li>
 * <li>{@link com.voltsentinel.core.model.HealthRecord}: normalized battery
 * snapshot</li>
 * <li>{@link com.voltsentinel.core.model.AlertRecord}: alert emitted by the
 * detector</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.voltsentinel.core.model;
