package dk.cloudcreate.bookstore.common.transaction;

import org.jdbi.v3.core.*;
import org.slf4j.*;

import java.util.*;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@link HandleAwareUnitOfWorkFactory} that binds a Jdbi {@link Handle} with an open transaction to the current thread
 */
public class JdbiUnitOfWorkFactory implements HandleAwareUnitOfWorkFactory<JdbiUnitOfWorkFactory.JdbiUnitOfWork> {
    private static final Logger log = LoggerFactory.getLogger(JdbiUnitOfWorkFactory.class);

    private final Jdbi                          jdbi;
    private final ThreadLocal<JdbiUnitOfWork> unitsOfWork = new ThreadLocal<>();

    public JdbiUnitOfWorkFactory(Jdbi jdbi) {
        this.jdbi = checkNotNull(jdbi, "No jdbi provided");
    }

    public Jdbi getJdbi() {
        return jdbi;
    }

    @Override
    public JdbiUnitOfWork getRequiredUnitOfWork() {
        var unitOfWork = unitsOfWork.get();
        if (unitOfWork == null) {
            throw new NoActiveUnitOfWorkException();
        }
        return unitOfWork;
    }

    @Override
    public JdbiUnitOfWork getOrCreateNewUnitOfWork() {
        var unitOfWork = unitsOfWork.get();
        if (unitOfWork == null) {
            unitOfWork = new JdbiUnitOfWork();
            unitOfWork.start();
            unitsOfWork.set(unitOfWork);
        }
        return unitOfWork;
    }

    @Override
    public Optional<JdbiUnitOfWork> getCurrentUnitOfWork() {
        return Optional.ofNullable(unitsOfWork.get());
    }

    private void removeUnitOfWork() {
        unitsOfWork.remove();
    }

    public class JdbiUnitOfWork implements HandleAwareUnitOfWork {
        private final List<Runnable> afterCommitCallbacks = new ArrayList<>();
        private       Handle           handle;
        private       UnitOfWorkStatus status             = UnitOfWorkStatus.Ready;
        private       Exception        causeOfRollback;

        @Override
        public void start() {
            if (status == UnitOfWorkStatus.Ready || status.isCompleted) {
                log.trace("Starting UnitOfWork with initial status {}", status);
                handle = jdbi.open();
                handle.begin();
                status = UnitOfWorkStatus.Started;
            } else if (status != UnitOfWorkStatus.Started) {
                throw new UnitOfWorkException(String.format("Cannot start a UnitOfWork with status %s", status));
            }
        }

        @Override
        public void commit() {
            if (status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                rollback(causeOfRollback);
                throw new UnitOfWorkException("UnitOfWork was marked as rollback only and has been rolled back", causeOfRollback);
            }
            if (status != UnitOfWorkStatus.Started) {
                throw new UnitOfWorkException(String.format("Cannot commit a UnitOfWork with status %s", status));
            }
            try {
                handle.commit();
                status = UnitOfWorkStatus.Committed;
            } catch (RuntimeException e) {
                rollback(e);
                throw new UnitOfWorkException("Failed to commit UnitOfWork", e);
            } finally {
                close();
            }
            for (var callback : afterCommitCallbacks) {
                try {
                    callback.run();
                } catch (RuntimeException e) {
                    log.error("After commit callback failed", e);
                }
            }
            afterCommitCallbacks.clear();
        }

        @Override
        public void rollback(Exception cause) {
            if (status == UnitOfWorkStatus.Started || status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                causeOfRollback = cause;
                try {
                    handle.rollback();
                } finally {
                    status = UnitOfWorkStatus.RolledBack;
                    afterCommitCallbacks.clear();
                    close();
                }
            } else if (status == UnitOfWorkStatus.RolledBack) {
                log.trace("UnitOfWork is already rolled back");
            } else {
                throw new UnitOfWorkException(String.format("Cannot rollback a UnitOfWork with status %s", status));
            }
        }

        @Override
        public UnitOfWorkStatus status() {
            return status;
        }

        @Override
        public Exception getCauseOfRollback() {
            return causeOfRollback;
        }

        @Override
        public void markAsRollbackOnly(Exception cause) {
            if (status == UnitOfWorkStatus.Started) {
                status = UnitOfWorkStatus.MarkedForRollbackOnly;
                causeOfRollback = cause;
            }
        }

        @Override
        public void onAfterCommit(Runnable callback) {
            afterCommitCallbacks.add(checkNotNull(callback, "No callback provided"));
        }

        @Override
        public Handle handle() {
            if (handle == null || status.isCompleted) {
                throw new UnitOfWorkException(String.format("UnitOfWork with status %s has no active handle", status));
            }
            return handle;
        }

        private void close() {
            try {
                if (handle != null) {
                    handle.close();
                }
            } finally {
                handle = null;
                removeUnitOfWork();
            }
        }
    }
}
