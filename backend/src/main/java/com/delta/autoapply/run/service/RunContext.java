package com.delta.autoapply.run.service;

import com.delta.autoapply.run.events.RunEventBus;
import com.delta.autoapply.run.events.RunEventSink;
import com.delta.autoapply.run.gate.ApprovalGate;
import com.delta.autoapply.run.model.EventEnvelope;
import com.delta.autoapply.run.model.RunSession;
import com.delta.autoapply.run.model.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Everything that belongs to one run: its session snapshot, approval gate, event stream
 * and the task executing it.
 */
public class RunContext implements RunEventSink {
    private static final Logger log = LoggerFactory.getLogger(RunContext.class);

    private final String runId;
    private final RunEventBus eventBus;
    private final ApprovalGate gate;
    private final AtomicReference<RunSession> session;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean signInConfirmed = new AtomicBoolean(false);
    private volatile Future<?> task;

    public RunContext(String runId, String applyUrl, RunEventBus eventBus) {
        this.runId = runId;
        this.eventBus = eventBus;
        this.gate = new ApprovalGate(runId);
        this.session = new AtomicReference<>(RunSession.created(runId, applyUrl, Instant.now()));
        eventBus.open(runId);
    }

    @Override
    public String runId() {
        return runId;
    }

    @Override
    public void emit(EventEnvelope envelope) {
        eventBus.emit(runId, envelope);
    }

    public RunSession session() {
        return session.get();
    }

    public RunStatus status() {
        return session.get().status();
    }

    public ApprovalGate gate() {
        return gate;
    }

    /**
     * Applies the human's continue click. Before the review pause it only confirms sign-in,
     * so the single-use gate stays armed for the approval that follows prefill.
     *
     * @return true when the approval gate was released
     */
    public boolean signal() {
        RunStatus current = status();
        if (current == RunStatus.AWAITING_APPROVAL || current.isTerminal()) {
            gate.signal();
            return true;
        }
        signInConfirmed.set(true);
        return false;
    }

    public boolean signInConfirmed() {
        return signInConfirmed.get();
    }

    public void transition(RunStatus next) {
        RunSession previous = session.getAndUpdate(current -> current.withStatus(next, Instant.now()));
        log.info("Run {} {} -> {}", runId, previous.status(), next);
        emit(EventEnvelope.status(next));
    }

    void attachTask(Future<?> task) {
        this.task = task;
    }

    /**
     * Claims the right to execute the run. Returns false when the run was cancelled
     * before its task got to start.
     */
    boolean claimStart() {
        return started.compareAndSet(false, true);
    }

    boolean interruptTask() {
        Future<?> current = task;
        return current != null && current.cancel(true);
    }

    void completeEvents() {
        eventBus.complete(runId);
    }
}
