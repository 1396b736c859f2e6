/**
 * Publish/subscribe channels for health and alert updates.
 *
 * @since 1.0.0
 */
package com.voltsentinel.core.notify;
