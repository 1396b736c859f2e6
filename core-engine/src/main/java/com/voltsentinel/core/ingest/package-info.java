/**
 * Ingestion helpers: payload normalization and telemetry topic routing.
 *
 * @since 1.0.0
 */
package com.voltsentinel.core.ingest;
