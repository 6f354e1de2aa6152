package dk.cloudcreate.bookstore.scheduler;

public enum ScheduledCommandStatus {
    /**
     * Waiting for its due time (or for a redelivery after a transient failure)
     */
    PENDING,
    /**
     * Claimed by a scheduler instance that is dispatching it. A claim older than the claim timeout is reclaimed
     */
    CLAIMED,
    EXECUTED,
    /**
     * Permanent failure or exhausted redeliveries. Never dispatched again
     */
    FAILED
}
