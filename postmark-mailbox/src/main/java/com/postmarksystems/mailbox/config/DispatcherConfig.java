package com.postmarksystems.mailbox.config;

import java.util.concurrent.ThreadFactory;

/**
 * Configuration for an actor's mailbox and the thread dispatching its envelopes.
 */
public class DispatcherConfig {
    // Default values
    public static final int DEFAULT_INITIAL_CAPACITY = 128;
    public static final long DEFAULT_POLL_TIMEOUT_MS = 100;
    public static final String DEFAULT_THREAD_NAME_PREFIX = "postmark-actor-";
    public static final boolean DEFAULT_DAEMON_THREADS = true;

    // System property names
    public static final String INITIAL_CAPACITY_PROPERTY = "postmark.dispatcher.initialCapacity";
    public static final String POLL_TIMEOUT_PROPERTY = "postmark.dispatcher.pollTimeoutMs";
    public static final String THREAD_NAME_PREFIX_PROPERTY = "postmark.dispatcher.threadNamePrefix";
    public static final String DAEMON_THREADS_PROPERTY = "postmark.dispatcher.daemonThreads";

    private int initialCapacity = DEFAULT_INITIAL_CAPACITY;
    private long pollTimeoutMs = DEFAULT_POLL_TIMEOUT_MS;
    private String threadNamePrefix = DEFAULT_THREAD_NAME_PREFIX;
    private boolean daemonThreads = DEFAULT_DAEMON_THREADS;

    /**
     * Creates a config from the {@code postmark.dispatcher.*} system properties,
     * falling back to the defaults for the ones that are not set.
     *
     * @return A new config
     */
    public static DispatcherConfig fromSystemProperties() {
        DispatcherConfig config = new DispatcherConfig();
        config.setInitialCapacity(Integer.getInteger(INITIAL_CAPACITY_PROPERTY, DEFAULT_INITIAL_CAPACITY));
        config.setPollTimeoutMs(Long.getLong(POLL_TIMEOUT_PROPERTY, DEFAULT_POLL_TIMEOUT_MS));
        config.setThreadNamePrefix(System.getProperty(THREAD_NAME_PREFIX_PROPERTY, DEFAULT_THREAD_NAME_PREFIX));
        String daemon = System.getProperty(DAEMON_THREADS_PROPERTY);
        if (daemon != null) {
            config.setDaemonThreads(Boolean.parseBoolean(daemon));
        }
        return config;
    }

    /**
     * Sets the initial chunk size of the mailbox queue.
     *
     * @param initialCapacity The chunk size; the queue itself is unbounded
     * @return This DispatcherConfig instance
     */
    public DispatcherConfig setInitialCapacity(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive: " + initialCapacity);
        }
        this.initialCapacity = initialCapacity;
        return this;
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    /**
     * Sets how long the dispatch loop waits for an envelope before checking whether it
     * should keep running.
     *
     * @param pollTimeoutMs The poll timeout in milliseconds
     * @return This DispatcherConfig instance
     */
    public DispatcherConfig setPollTimeoutMs(long pollTimeoutMs) {
        if (pollTimeoutMs <= 0) {
            throw new IllegalArgumentException("pollTimeoutMs must be positive: " + pollTimeoutMs);
        }
        this.pollTimeoutMs = pollTimeoutMs;
        return this;
    }

    public long getPollTimeoutMs() {
        return pollTimeoutMs;
    }

    public DispatcherConfig setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
        return this;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public DispatcherConfig setDaemonThreads(boolean daemonThreads) {
        this.daemonThreads = daemonThreads;
        return this;
    }

    public boolean isDaemonThreads() {
        return daemonThreads;
    }

    /**
     * Creates the thread factory used to run the dispatch loop of the given actor.
     *
     * @param actorId The ID of the actor
     * @return A thread factory producing named threads
     */
    public ThreadFactory createThreadFactory(String actorId) {
        return runnable -> {
            Thread thread = new Thread(runnable, threadNamePrefix + actorId);
            thread.setDaemon(daemonThreads);
            return thread;
        };
    }

    @Override
    public String toString() {
        return "DispatcherConfig{" +
                "initialCapacity=" + initialCapacity +
                ", pollTimeoutMs=" + pollTimeoutMs +
                ", threadNamePrefix='" + threadNamePrefix + '\'' +
                ", daemonThreads=" + daemonThreads +
                '}';
    }
}
