/**
 * Rolling analytics over battery-health history.
 *
 * @since 1.0.0
 */
package com.voltsentinel.core.analytics;
