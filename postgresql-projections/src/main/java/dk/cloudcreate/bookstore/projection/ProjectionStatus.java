package dk.cloudcreate.bookstore.projection;

/**
 * Life cycle of one projection for one tenant
 */
public enum ProjectionStatus {
    STOPPED,
    /**
     * Behind the head of the tenant's event log and processing full batches
     */
    CATCHING_UP,
    /**
     * Processed everything that was committed when the last batch was read
     */
    LIVE,
    /**
     * Replaying the full history into a new generation; reads are served from the previous generation
     */
    REBUILDING,
    /**
     * An event failed to apply. Nothing more is processed until the projection is resumed or rebuilt
     */
    HALTED
}
