package com.postmarksystems.mailbox;

import org.jctools.queues.MpscUnboundedArrayQueue;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mailbox backed by a JCTools MPSC (Multi-Producer Single-Consumer) unbounded queue.
 *
 * Any number of senders may offer concurrently without locking; only the single
 * consumer polls. The lock and condition are used solely to park the consumer while
 * the queue is empty, and producers only touch them when a consumer is parked.
 *
 * @param <T> The type of elements
 */
public class MpscMailbox<T> implements Mailbox<T> {

    public static final int DEFAULT_CHUNK_SIZE = 128;

    private final MpscUnboundedArrayQueue<T> queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private volatile boolean consumerWaiting = false;

    public MpscMailbox() {
        this(DEFAULT_CHUNK_SIZE);
    }

    /**
     * Creates a mailbox growing in chunks of the given size.
     *
     * @param chunkSize the chunk size, rounded up to a power of 2 (at least 2)
     */
    public MpscMailbox(int chunkSize) {
        this.queue = new MpscUnboundedArrayQueue<>(chunkSizeFor(chunkSize));
    }

    @Override
    public boolean offer(T element) {
        Objects.requireNonNull(element, "Element cannot be null");
        boolean added = queue.offer(element);
        if (added && consumerWaiting) {
            lock.lock();
            try {
                notEmpty.signal();
            } finally {
                lock.unlock();
            }
        }
        return added;
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        T element = queue.poll();
        if (element != null || timeout <= 0) {
            return element;
        }

        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            consumerWaiting = true;
            // Re-check after publishing the flag so a concurrent offer cannot be missed.
            while ((element = queue.poll()) == null) {
                if (nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return element;
        } finally {
            consumerWaiting = false;
            lock.unlock();
        }
    }

    @Override
    public T take() throws InterruptedException {
        T element = queue.poll();
        if (element != null) {
            return element;
        }

        lock.lockInterruptibly();
        try {
            consumerWaiting = true;
            while ((element = queue.poll()) == null) {
                notEmpty.await();
            }
            return element;
        } finally {
            consumerWaiting = false;
            lock.unlock();
        }
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        Objects.requireNonNull(collection, "Collection cannot be null");
        int count = 0;
        T element;
        while (count < maxElements && (element = queue.poll()) != null) {
            collection.add(element);
            count++;
        }
        return count;
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    private static int chunkSizeFor(int requested) {
        if (requested <= 2) {
            return 2;
        }
        int result = Integer.highestOneBit(requested);
        return result == requested ? result : result << 1;
    }
}
