package dk.cloudcreate.bookstore.common.transaction;

import dk.cloudcreate.bookstore.common.functional.*;
import org.slf4j.*;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * This interface creates a {@link UnitOfWork}.<br>
 * {@link #usingUnitOfWork(CheckedConsumer)} and {@link #withUnitOfWork(CheckedFunction)} join an existing {@link UnitOfWork}
 * if one is active for the current thread, otherwise they create, commit (or roll back) their own.<br>
 * {@link RuntimeException}'s are rethrown unchanged, checked exceptions are wrapped in a {@link UnitOfWorkException}
 *
 * @param <UOW> the {@link UnitOfWork} sub-type returned by the {@link UnitOfWorkFactory}
 */
public interface UnitOfWorkFactory<UOW extends UnitOfWork> {
    Logger unitOfWorkLog = LoggerFactory.getLogger(UnitOfWorkFactory.class);

    /**
     * Get a required active {@link UnitOfWork}
     *
     * @return the active {@link UnitOfWork}
     * @throws NoActiveUnitOfWorkException if the is no active {@link UnitOfWork}
     */
    UOW getRequiredUnitOfWork();

    /**
     * Get the current {@link UnitOfWork} or create a new {@link UnitOfWork}
     * if one is missing
     *
     * @return a {@link UnitOfWork}
     */
    UOW getOrCreateNewUnitOfWork();

    Optional<UOW> getCurrentUnitOfWork();

    default void usingUnitOfWork(CheckedConsumer<UOW> unitOfWorkConsumer) {
        checkNotNull(unitOfWorkConsumer, "No unitOfWorkConsumer provided");
        withUnitOfWork(unitOfWork -> {
            unitOfWorkConsumer.accept(unitOfWork);
            return null;
        });
    }

    default <R> R withUnitOfWork(CheckedFunction<UOW, R> unitOfWorkFunction) {
        checkNotNull(unitOfWorkFunction, "No unitOfWorkFunction provided");
        var existingUnitOfWork = getCurrentUnitOfWork();
        var unitOfWork = existingUnitOfWork.orElseGet(() -> {
            unitOfWorkLog.trace("Creating a new UnitOfWork as there wasn't an existing UnitOfWork");
            return getOrCreateNewUnitOfWork();
        });
        existingUnitOfWork.ifPresent(uow -> unitOfWorkLog.trace("NestedUnitOfWork: Reusing existing UnitOfWork"));
        try {
            var result = unitOfWorkFunction.apply(unitOfWork);
            if (existingUnitOfWork.isEmpty()) {
                unitOfWorkLog.trace("Committing the UnitOfWork created by this method call");
                unitOfWork.commit();
            }
            return result;
        } catch (Exception e) {
            if (existingUnitOfWork.isEmpty()) {
                unitOfWorkLog.debug("Rolling back the UnitOfWork created by this method call due to {}", e.getClass().getSimpleName());
                unitOfWork.rollback(e);
            } else {
                unitOfWorkLog.debug("NestedUnitOfWork: Marking UnitOfWork as rollback only due to {}", e.getClass().getSimpleName());
                unitOfWork.markAsRollbackOnly(e);
            }
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new UnitOfWorkException(e);
        }
    }
}
