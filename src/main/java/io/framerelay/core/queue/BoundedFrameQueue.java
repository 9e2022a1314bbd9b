package io.framerelay.core.queue;

import io.framerelay.core.model.Frame;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity frame ring with a drop-oldest overflow policy.
 * <p>
 * {@link #push(Frame)} never blocks: when the ring is full the oldest frame is evicted first.
 * {@link #pop(Duration)} blocks the consumer up to a timeout.
 */
public final class BoundedFrameQueue {
    private final Frame[] slots;
    private final Lock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final AtomicLong dropped = new AtomicLong();

    private int head;
    private int size;

    /**
     * @param capacity number of frames retained, at least one
     */
    public BoundedFrameQueue(final int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be at least 1: " + capacity);
        }
        this.slots = new Frame[capacity];
    }

    /**
     * Appends a frame, evicting the oldest one if the ring is full.
     *
     * @return true if a frame was evicted to make room
     */
    public boolean push(final Frame frame) {
        lock.lock();
        try {
            boolean evicted = false;
            if (size == slots.length) {
                slots[head] = null;
                head = (head + 1) % slots.length;
                size--;
                dropped.incrementAndGet();
                evicted = true;
            }
            slots[(head + size) % slots.length] = frame;
            size++;
            notEmpty.signal();
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the oldest frame, waiting up to {@code timeout} for one to arrive.
     *
     * @return the frame, or empty if the timeout elapsed first
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<Frame> pop(final Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (size == 0) {
                if (remaining <= 0) return Optional.empty();
                remaining = notEmpty.awaitNanos(remaining);
            }
            final Frame frame = slots[head];
            slots[head] = null;
            head = (head + 1) % slots.length;
            size--;
            return Optional.of(frame);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Frame> pop(final long timeout, final TimeUnit unit) throws InterruptedException {
        return pop(Duration.ofNanos(unit.toNanos(timeout)));
    }

    /**
     * @return retained frames, oldest first
     */
    public List<Frame> snapshot() {
        lock.lock();
        try {
            final List<Frame> out = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                out.add(slots[(head + i) % slots.length]);
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return slots.length;
    }

    /**
     * @return frames evicted by overflow since construction
     */
    public long dropped() {
        return dropped.get();
    }
}
