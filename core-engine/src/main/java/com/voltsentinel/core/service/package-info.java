/**
 * The monitoring orchestrator.
 *
 * <p>
 * {@link com.voltsentinel.core.service.MonitorService} owns the per-vehicle
 * registry (history, current health, health channel), the alert ledger and
 * the retention cleanup task. Construct it once per process through its
 * builder and share the instance.
 * </p>
 *
 * @since 1.0.0
 */
package com.voltsentinel.core.service;
