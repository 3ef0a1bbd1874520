package com.tessera.multitenancy.testing;

import com.tessera.multitenancy.UnitOfWork;
import com.tessera.multitenancy.UnitOfWorkManager;
import java.util.Optional;

/**
 * {@link UnitOfWorkManager} whose units of work are opened explicitly and bound to the calling
 * thread.
 *
 * <p>Lives in src/main so other modules can use it from their tests.
 *
 * <pre>{@code
 * try (var ignored = unitOfWorkManager.begin(5L)) {
 *     evaluator.isGranted(userId, "Orders.Approve");
 * }
 * }</pre>
 */
public final class ThreadLocalUnitOfWorkManager implements UnitOfWorkManager {

    private final ThreadLocal<UnitOfWork> current = new ThreadLocal<>();

    @Override
    public Optional<UnitOfWork> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Opens a unit of work bound to the given tenant (null for host). Closing the returned scope
     * restores the previously active unit of work.
     */
    public Scope begin(Long tenantId) {
        UnitOfWork previous = current.get();
        current.set(() -> Optional.ofNullable(tenantId));
        return () -> {
            if (previous != null) {
                current.set(previous);
            } else {
                current.remove();
            }
        };
    }

    /** An open unit of work. */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {

        @Override
        void close();
    }
}
