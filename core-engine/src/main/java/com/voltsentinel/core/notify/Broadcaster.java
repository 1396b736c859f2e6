package com.voltsentinel.core.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Fire-and-forget publish/subscribe channel.
 *
 * <p>
 * Listeners are invoked on the supplied {@link Executor}, never on the
 * publishing thread unless the executor runs tasks inline. A late subscriber
 * only sees events published after it subscribed. A listener that throws is
 * logged and does not affect the other listeners.
 * </p>
 *
 * @param <T> event type
 * @since 1.0.0
 */
public class Broadcaster<T> implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Broadcaster.class);

    private final String name;
    private final Executor executor;
    private final List<Registration> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param name     channel name used in log messages
     * @param executor dispatch executor; must not be {@code null}
     */
    public Broadcaster(String name, Executor executor) {
        this.name = Objects.requireNonNull(name, "Channel name must not be null");
        this.executor = Objects.requireNonNull(executor, "Executor must not be null");
    }

    /**
     * Register a listener.
     *
     * @param listener event consumer; must not be {@code null}
     * @return handle that unregisters the listener when closed; already inactive
     *         if the channel is closed
     */
    public Subscription subscribe(Consumer<? super T> listener) {
        Objects.requireNonNull(listener, "Listener must not be null");
        Registration registration = new Registration(listener);
        if (closed.get()) {
            registration.active.set(false);
            return registration;
        }
        listeners.add(registration);
        LOG.debug("Channel [{}] subscriber added ({} total)", name, listeners.size());
        return registration;
    }

    /**
     * Deliver {@code event} to every current listener. No-op once closed or
     * without listeners.
     *
     * @param event the event
     */
    public void publish(T event) {
        if (closed.get()) {
            return;
        }
        for (Registration registration : listeners) {
            try {
                executor.execute(() -> registration.deliver(event));
            } catch (RejectedExecutionException e) {
                LOG.warn("Channel [{}] dropped an event: dispatcher rejected it", name, e);
            }
        }
    }

    public int subscriberCount() {
        return listeners.size();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public String getName() {
        return name;
    }

    /**
     * Close the channel and deactivate every subscription.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            for (Registration registration : listeners) {
                registration.active.set(false);
            }
            listeners.clear();
            LOG.debug("Channel [{}] closed", name);
        }
    }

    private final class Registration implements Subscription {

        private final Consumer<? super T> listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Registration(Consumer<? super T> listener) {
            this.listener = listener;
        }

        private void deliver(T event) {
            if (!active.get()) {
                return;
            }
            try {
                listener.accept(event);
            } catch (Exception e) {
                LOG.error("Channel [{}] subscriber threw an exception", name, e);
            }
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                listeners.remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
