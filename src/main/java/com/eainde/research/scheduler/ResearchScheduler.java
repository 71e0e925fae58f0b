package com.eainde.research.scheduler;

import com.eainde.research.config.ResearchProperties;
import com.eainde.research.memory.MemoryStore;
import com.eainde.research.model.Signal;
import com.eainde.research.workflow.PipelineEngine;
import com.eainde.research.workflow.RunOutcome;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Polls unprocessed signals, oldest first, and hands each to a pipeline run on
 * the bounded worker pool. A signal already being researched is skipped.
 */
@Log4j2
@Component
public class ResearchScheduler {

    private final MemoryStore memoryStore;
    private final PipelineEngine engine;
    private final ExecutorService workerExecutor;
    private final ResearchProperties properties;

    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    public ResearchScheduler(MemoryStore memoryStore,
                             PipelineEngine engine,
                             @Qualifier("pipelineWorkerExecutor") ExecutorService workerExecutor,
                             ResearchProperties properties) {
        this.memoryStore = memoryStore;
        this.engine = engine;
        this.workerExecutor = workerExecutor;
        this.properties = properties;
    }

    @Scheduled(cron = "${research.scheduler.cron:0 0 9 * * *}")
    public void scheduledPoll() {
        if (!properties.getScheduler().isEnabled()) {
            log.debug("Scheduler disabled, skipping poll");
            return;
        }
        poll();
    }

    /**
     * @return number of runs submitted
     */
    public int poll() {
        List<Signal> pending = memoryStore.findUnprocessedSignals(properties.getScheduler().getBatchSize());
        int submitted = 0;
        for (Signal signal : pending) {
            if (dispatch(signal)) {
                submitted++;
            }
        }
        log.info("Polled {} unprocessed signals, submitted {} runs", pending.size(), submitted);
        return submitted;
    }

    /**
     * Submits a run unless one for the same signal is already in flight.
     */
    public boolean dispatch(Signal signal) {
        if (!inFlight.add(signal.id())) {
            log.debug("Signal {} already in flight", signal.id());
            return false;
        }
        workerExecutor.execute(() -> {
            try {
                RunOutcome outcome = engine.run(signal);
                log.info("Signal {} finished with {}", signal.id(), outcome.status());
            } catch (RuntimeException e) {
                // the run keeps its last checkpoint and the signal stays unprocessed for the next poll
                log.error("Run for signal {} aborted", signal.id(), e);
            } finally {
                inFlight.remove(signal.id());
            }
        });
        return true;
    }

    boolean isInFlight(long signalId) {
        return inFlight.contains(signalId);
    }
}
