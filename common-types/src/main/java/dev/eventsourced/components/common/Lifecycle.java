package dev.eventsourced.components.common;

/**
 * Life cycle of a component that owns background resources, such as the worker threads
 * behind a fire-and-forget event publisher
 */
public interface Lifecycle {
    /**
     * Start the component. Must be idempotent: calling {@link #start()} on an already started
     * component (where {@link #isStarted()} returns true) is ignored
     */
    void start();

    /**
     * Stop the component and release its background resources. Must be idempotent: calling
     * {@link #stop()} on an already stopped component (where {@link #isStarted()} returns false) is ignored
     */
    void stop();

    /**
     * @return true if the component is started otherwise false
     */
    boolean isStarted();
}
