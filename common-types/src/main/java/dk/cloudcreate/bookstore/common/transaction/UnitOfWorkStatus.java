package dk.cloudcreate.bookstore.common.transaction;

public enum UnitOfWorkStatus {
    Ready(false),
    Started(false),
    Committed(true),
    RolledBack(true),
    MarkedForRollbackOnly(false);

    public final boolean isCompleted;

    UnitOfWorkStatus(boolean isCompleted) {
        this.isCompleted = isCompleted;
    }
}
