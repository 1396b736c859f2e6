/**
 * Per-vehicle bounded history of battery-health snapshots.
 *
 * @since 1.0.0
 */
package com.voltsentinel.core.history;
