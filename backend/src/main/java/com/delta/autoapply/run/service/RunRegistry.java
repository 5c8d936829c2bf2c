package com.delta.autoapply.run.service;

import com.delta.autoapply.run.events.RunEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Component
public class RunRegistry {
    private static final Logger log = LoggerFactory.getLogger(RunRegistry.class);

    private final ConcurrentMap<String, RunContext> runs = new ConcurrentHashMap<>();
    private final RunEventBus eventBus;

    public RunRegistry(RunEventBus eventBus) {
        this.eventBus = eventBus;
    }

    public RunContext register(String applyUrl) {
        String runId = UUID.randomUUID().toString();
        RunContext context = new RunContext(runId, applyUrl, eventBus);
        runs.put(runId, context);
        return context;
    }

    public Optional<RunContext> find(String runId) {
        return runId == null ? Optional.empty() : Optional.ofNullable(runs.get(runId));
    }

    public RunContext require(String runId) {
        return find(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    public void release(String runId) {
        if (runs.remove(runId) != null) {
            log.info("Released run {}", runId);
        }
        eventBus.release(runId);
    }

    public List<RunContext> active() {
        return runs.values().stream().filter(context -> !context.status().isTerminal()).toList();
    }

    public int size() {
        return runs.size();
    }
}
