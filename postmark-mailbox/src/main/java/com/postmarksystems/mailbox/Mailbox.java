package com.postmarksystems.mailbox;

import java.util.Collection;
import java.util.concurrent.TimeUnit;

/**
 * Queue an actor's envelopes wait in until its dispatcher picks them up.
 * Mailboxes are unbounded: {@link #offer} only refuses null.
 *
 * @param <T> The type of elements stored in the mailbox
 */
public interface Mailbox<T> {

    /**
     * Appends the element at the tail of the mailbox.
     *
     * @param element the element to add
     * @return true if the element was added
     */
    boolean offer(T element);

    /**
     * Retrieves and removes the head of this mailbox, or returns null if empty.
     */
    T poll();

    /**
     * Retrieves and removes the head of this mailbox, waiting up to the
     * specified wait time if necessary for an element to become available.
     *
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return the head of this mailbox, or null if timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    T poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Retrieves and removes the head of this mailbox, waiting if necessary
     * until an element becomes available.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    T take() throws InterruptedException;

    /**
     * Removes up to maxElements available elements and adds them to the given collection.
     *
     * @return the number of elements transferred
     */
    int drainTo(Collection<? super T> collection, int maxElements);

    int size();

    boolean isEmpty();
}
