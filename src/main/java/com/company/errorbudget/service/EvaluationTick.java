package com.company.errorbudget.service;

import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One scheduled evaluation of one service. Once abandoned its results are
 * discarded instead of written.
 *
 * <p>A tick cannot be abandoned while it commits a target: the commit and its
 * cache, event and alert follow-ups either all happen or none do.
 */
public class EvaluationTick {

    private enum State { RUNNING, COMMITTING, ABANDONED }

    @Getter
    private final Long serviceId;
    @Getter
    private final long generation;
    @Getter
    private final Instant startedAt;
    private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);

    public EvaluationTick(Long serviceId, long generation, Instant startedAt) {
        this.serviceId = serviceId;
        this.generation = generation;
        this.startedAt = startedAt;
    }

    /**
     * @return false when the tick is committing and has to be waited for
     */
    public boolean abandon() {
        return state.compareAndSet(State.RUNNING, State.ABANDONED);
    }

    public boolean isAbandoned() {
        return state.get() == State.ABANDONED;
    }

    /**
     * Claims the commit of one target.
     *
     * @return false when the tick was abandoned first
     */
    public boolean beginCommit() {
        return state.compareAndSet(State.RUNNING, State.COMMITTING);
    }

    public void endCommit() {
        state.compareAndSet(State.COMMITTING, State.RUNNING);
    }
}
