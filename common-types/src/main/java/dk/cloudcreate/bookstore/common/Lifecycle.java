package dk.cloudcreate.bookstore.common;

/**
 * Common process life cycle interface, implemented by every background component of the engine
 * (projection workers, the command scheduler, the composition root)
 */
public interface Lifecycle {
    /**
     * Start the processing. This operation must be idempotent, such that duplicate calls
     * to {@link #start()} for an already started process (where {@link #isStarted()} returns true)
     * are ignored
     */
    void start();

    /**
     * Stop the processing. This operation must be idempotent, such that duplicate calls
     * to {@link #stop()} for an already stopped process (where {@link #isStarted()} returns false)
     * are ignored.<br>
     * Stopping is cooperative: work that is in-flight is allowed to finish
     */
    void stop();

    /**
     * Returns true if the process is started
     *
     * @return true if the process is started otherwise false
     */
    boolean isStarted();
}
