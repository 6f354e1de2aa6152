package dk.cloudcreate.bookstore.common.transaction;

/**
 * Specialization of {@link UnitOfWorkFactory} that creates and maintains {@link HandleAwareUnitOfWork}'s
 */
public interface HandleAwareUnitOfWorkFactory<UOW extends HandleAwareUnitOfWork> extends UnitOfWorkFactory<UOW> {
}
