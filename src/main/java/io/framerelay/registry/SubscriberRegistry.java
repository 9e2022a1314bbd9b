package io.framerelay.registry;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Set of live subscribers, keyed by id, in join order.
 * <p>
 * All operations take one exclusive lock; {@link #snapshot()} holds it only for the copy, so
 * broadcasts iterate a private list while joins and leaves proceed.
 */
@Slf4j
public final class SubscriberRegistry {
    private final Map<String, Subscriber> subscribers = new LinkedHashMap<>();
    private final Lock lock = new ReentrantLock();

    /**
     * @return false if a subscriber with the same id is already registered
     */
    public boolean add(final Subscriber subscriber) {
        lock.lock();
        try {
            if (subscribers.putIfAbsent(subscriber.id(), subscriber) != null) {
                return false;
            }
        } finally {
            lock.unlock();
        }
        log.info("Subscriber joined: {}", subscriber.describe());
        return true;
    }

    /**
     * Removes this exact subscriber instance.
     *
     * @return true if it was registered
     */
    public boolean remove(final Subscriber subscriber) {
        final boolean removed;
        lock.lock();
        try {
            removed = subscribers.remove(subscriber.id(), subscriber);
        } finally {
            lock.unlock();
        }
        if (removed) {
            log.info("Subscriber left: {}", subscriber.describe());
        }
        return removed;
    }

    public boolean remove(final String id) {
        final Subscriber removed;
        lock.lock();
        try {
            removed = subscribers.remove(id);
        } finally {
            lock.unlock();
        }
        if (removed != null) {
            log.info("Subscriber left: {}", removed.describe());
        }
        return removed != null;
    }

    public boolean contains(final String id) {
        lock.lock();
        try {
            return subscribers.containsKey(id);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return an immutable copy of the current members in join order
     */
    public List<Subscriber> snapshot() {
        lock.lock();
        try {
            return List.copyOf(subscribers.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return subscribers.size();
        } finally {
            lock.unlock();
        }
    }
}
