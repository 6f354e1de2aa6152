package dk.cloudcreate.bookstore.common.transaction;

public class NoActiveUnitOfWorkException extends UnitOfWorkException {
    public NoActiveUnitOfWorkException() {
        super("No active UnitOfWork");
    }
}
