package com.flagship.handle_pay.guard;

import com.flagship.handle_pay.error.ProtocolError;
import com.flagship.handle_pay.error.ProtocolException;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Call-in-progress guard for one component instance.
 *
 * Acquire with try-with-resources:
 * <pre>
 * try (ReentrancyGuard.Scope ignored = guard.enter()) {
 *     ...
 * }
 * </pre>
 * A second {@link #enter()} from the same call stack (a custody move calling back
 * into the component) fails with {@code REENTRANT_CALL}. Calls on other threads
 * wait until the current call leaves the scope.
 * <p>
 * The scope ends when the method body returns, before the surrounding
 * transaction commits. Any balance a call pays out from must therefore be read
 * under a row lock ({@code FOR UPDATE}), not trusted from a plain read.
 */
public final class ReentrancyGuard {

    private final String component;
    private final ReentrantLock lock = new ReentrantLock();

    public ReentrancyGuard(String component) {
        this.component = component;
    }

    public Scope enter() {
        if (lock.isHeldByCurrentThread()) {
            throw new ProtocolException(ProtocolError.REENTRANT_CALL,
                "Reentrant call into " + component + " rejected");
        }
        lock.lock();
        return new Scope();
    }

    public boolean isEntered() {
        return lock.isLocked();
    }

    /**
     * Releases the guard exactly once.
     */
    public final class Scope implements AutoCloseable {

        private boolean released;

        private Scope() {
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                lock.unlock();
            }
        }
    }
}
