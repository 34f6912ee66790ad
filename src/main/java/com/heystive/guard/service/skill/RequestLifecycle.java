package com.heystive.guard.service.skill;

import com.heystive.guard.domain.RequestStage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks one skill request through its stages.
 *
 * <pre>
 * UNVALIDATED → RATE_CHECKED → PERMISSION_CHECKED → EXECUTING → {COMPLETED, FAILED, TIMEOUT}
 * </pre>
 *
 * <p>Any non-terminal stage may move to FAILED. Transitions are guarded by a lock and
 * the visited stages are kept for diagnostics.
 */
public final class RequestLifecycle {

    private final Lock lock = new ReentrantLock();
    private final List<RequestStage> history = new ArrayList<>();
    private RequestStage stage = RequestStage.UNVALIDATED;

    public RequestLifecycle() {
        history.add(stage);
    }

    /**
     * Moves to the next stage.
     *
     * @throws IllegalStateException if the transition is not allowed from the current stage
     */
    public void advance(RequestStage next) {
        Objects.requireNonNull(next, "next");
        lock.lock();
        try {
            if (!stage.canAdvanceTo(next)) {
                throw new IllegalStateException("Illegal request transition " + stage + " -> " + next);
            }
            stage = next;
            history.add(next);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves to FAILED unless the request already reached a terminal stage.
     *
     * @return true if the stage changed
     */
    public boolean fail() {
        lock.lock();
        try {
            if (stage.isTerminal()) {
                return false;
            }
            stage = RequestStage.FAILED;
            history.add(stage);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public RequestStage current() {
        lock.lock();
        try {
            return stage;
        } finally {
            lock.unlock();
        }
    }

    public List<RequestStage> history() {
        lock.lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }
}
