/**
 * Apache Flink streaming job for Volt Sentinel.
 *
 * <p>
 * Wires the core detection engine into a Flink pipeline that consumes battery
 * health payloads from Kafka, keeps per-vehicle history in keyed state, runs
 * the alert rules per record and publishes alerts back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.voltsentinel.flink.BatteryMonitorJob}: main entry point</li>
 * <li>{@link com.voltsentinel.flink.BatteryMonitorProcessFunction}: keyed
 * process function</li>
 * <li>{@link com.voltsentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.voltsentinel.flink.HealthServer}: HTTP health and readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.voltsentinel.flink;
