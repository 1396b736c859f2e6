package com.voltsentinel.core.notify;

/**
 * Handle returned by {@link Broadcaster#subscribe}. Closing it unregisters the
 * listener; closing twice is harmless.
 *
 * @since 1.0.0
 */
public interface Subscription extends AutoCloseable {

    /**
     * Unregister the listener. Never throws.
     */
    @Override
    void close();

    /**
     * @return {@code true} while the listener is still registered
     */
    boolean isActive();
}
