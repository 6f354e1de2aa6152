package dk.cloudcreate.bookstore.common.transaction;

/**
 * A unit of work spans a single underlying transaction. Everything performed using the same {@link UnitOfWork}
 * is committed or rolled back together (e.g. an event append and the scheduled commands it registers, or
 * projection document writes and the projection checkpoint)
 */
public interface UnitOfWork {
    /**
     * Start the {@link UnitOfWork} and any underlying transaction
     */
    void start();

    /**
     * Commit the {@link UnitOfWork} and any underlying transaction - see {@link UnitOfWorkStatus#Committed}.<br>
     * Callbacks registered using {@link #onAfterCommit(Runnable)} are run after the transaction has been committed
     */
    void commit();

    /**
     * Roll back the {@link UnitOfWork} and any underlying transaction - see {@link UnitOfWorkStatus#RolledBack}
     *
     * @param cause the cause of the rollback
     */
    void rollback(Exception cause);

    /**
     * Roll back the {@link UnitOfWork} using any cause registered with {@link #markAsRollbackOnly(Exception)}
     */
    default void rollback() {
        rollback(getCauseOfRollback());
    }

    UnitOfWorkStatus status();

    /**
     * The cause of a Rollback or a {@link #markAsRollbackOnly(Exception)}
     */
    Exception getCauseOfRollback();

    void markAsRollbackOnly(Exception cause);

    /**
     * Register a callback that is run once the {@link UnitOfWork} has been committed successfully.
     * Callbacks are skipped if the {@link UnitOfWork} is rolled back
     *
     * @param callback the callback
     */
    void onAfterCommit(Runnable callback);
}
