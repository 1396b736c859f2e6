/**
 * The alert ledger: bounded, newest-first alert storage with read tracking.
 *
 * @since 1.0.0
 */
package com.voltsentinel.core.alert;
