package com.delta.autoapply.run.service;

import com.delta.autoapply.config.AutoApplyProperties;
import com.delta.autoapply.run.events.RunEventBus;
import com.delta.autoapply.run.events.RunEventSubscription;
import com.delta.autoapply.run.model.ApplyRequest;
import com.delta.autoapply.run.model.EventEnvelope;
import com.delta.autoapply.run.model.RunSession;
import com.delta.autoapply.run.model.RunStatus;
import com.delta.autoapply.run.model.RunStatusResponse;
import com.delta.autoapply.run.model.StartRunResponse;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Service
public class ApplicationRunService {
    private static final Logger log = LoggerFactory.getLogger(ApplicationRunService.class);

    private final RunRegistry registry;
    private final RunEventBus eventBus;
    private final OneClickApplyPipeline pipeline;
    private final ExecutorService runExecutor;
    private final ScheduledExecutorService runReaper;
    private final AutoApplyProperties properties;

    public ApplicationRunService(
        RunRegistry registry,
        RunEventBus eventBus,
        OneClickApplyPipeline pipeline,
        @Qualifier("runExecutor") ExecutorService runExecutor,
        @Qualifier("runReaper") ScheduledExecutorService runReaper,
        AutoApplyProperties properties
    ) {
        this.registry = registry;
        this.eventBus = eventBus;
        this.pipeline = pipeline;
        this.runExecutor = runExecutor;
        this.runReaper = runReaper;
        this.properties = properties;
    }

    public StartRunResponse start(ApplyRequest request) {
        RunContext context = registry.register(request.applyUrl());
        log.info("Starting run {} for {}", context.runId(), request.applyUrl());
        try {
            Future<?> task = runExecutor.submit(() -> execute(context, request));
            context.attachTask(task);
        } catch (RejectedExecutionException e) {
            registry.release(context.runId());
            throw new RunUnavailableException("Run executor is not accepting new runs", e);
        }
        return new StartRunResponse(context.runId(), context.status());
    }

    public void signalGate(String runId) {
        RunContext context = registry.require(runId);
        if (context.signal()) {
            log.info("Approval gate signalled for run {}", runId);
        } else {
            log.info("Sign-in confirmed for run {} ({})", runId, context.status());
        }
    }

    /**
     * Interrupts the run. A run whose task has not started yet is failed right here.
     */
    public RunStatusResponse cancel(String runId) {
        RunContext context = registry.require(runId);
        if (context.claimStart()) {
            context.interruptTask();
            context.emit(EventEnvelope.warn("Run cancelled"));
            context.transition(RunStatus.FAILED);
            context.emit(EventEnvelope.done(false));
            finish(context);
        } else if (!context.status().isTerminal()) {
            context.interruptTask();
        }
        return status(runId);
    }

    public RunStatusResponse status(String runId) {
        RunContext context = registry.require(runId);
        RunSession session = context.session();
        return new RunStatusResponse(
            session.runId(),
            session.applyUrl(),
            session.status(),
            session.createdAt(),
            session.updatedAt(),
            session.finishedAt(),
            context.gate().isSignalled()
        );
    }

    public RunEventSubscription events(String runId) {
        return eventBus.stream(runId);
    }

    @PreDestroy
    public void cancelActiveRuns() {
        for (RunContext context : registry.active()) {
            log.info("Cancelling run {} on shutdown", context.runId());
            context.interruptTask();
        }
    }

    private void execute(RunContext context, ApplyRequest request) {
        if (!context.claimStart()) {
            return;
        }
        try {
            pipeline.run(context, request);
        } finally {
            finish(context);
        }
    }

    private void finish(RunContext context) {
        context.completeEvents();
        int retention = properties.getRuns().getRetentionSeconds();
        try {
            runReaper.schedule(() -> registry.release(context.runId()), retention, TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Reaper unavailable, releasing run {} now", context.runId());
            registry.release(context.runId());
        }
    }
}
