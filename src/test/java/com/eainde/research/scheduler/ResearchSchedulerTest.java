package com.eainde.research.scheduler;

import com.eainde.research.config.ResearchProperties;
import com.eainde.research.memory.MemoryStore;
import com.eainde.research.model.Signal;
import com.eainde.research.state.RunStatus;
import com.eainde.research.workflow.PipelineEngine;
import com.eainde.research.workflow.RunOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResearchSchedulerTest {

    @Mock
    private MemoryStore memoryStore;

    @Mock
    private PipelineEngine engine;

    private final ExecutorService workers = Executors.newFixedThreadPool(2);
    private ResearchProperties properties;
    private ResearchScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new ResearchProperties();
        properties.getScheduler().setBatchSize(10);
        scheduler = new ResearchScheduler(memoryStore, engine, workers, properties);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    private static Signal signal(long id) {
        return new Signal(id, Instant.EPOCH, "insider_buy", "S" + id, Map.of(), false, false, null);
    }

    private static RunOutcome completed(Signal signal) {
        return new RunOutcome(PipelineEngine.runIdFor(signal.id()), signal.id(), RunStatus.COMPLETED,
                List.of(), null, null, null);
    }

    private void awaitReleased(long signalId) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (scheduler.isInFlight(signalId) && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
    }

    @Test
    @DisplayName("poll submits one run per unprocessed signal")
    void poll_submitsRuns() {
        Signal first = signal(1);
        Signal second = signal(2);
        when(memoryStore.findUnprocessedSignals(10)).thenReturn(List.of(first, second));
        when(engine.run(any(Signal.class))).thenAnswer(inv -> completed(inv.getArgument(0)));

        int submitted = scheduler.poll();

        assertThat(submitted).isEqualTo(2);
        verify(engine, timeout(2_000)).run(first);
        verify(engine, timeout(2_000)).run(second);
    }

    @Test
    @DisplayName("a signal already in flight is not dispatched twice")
    void dispatch_skipsInFlight() throws InterruptedException {
        Signal signal = signal(1);
        CountDownLatch release = new CountDownLatch(1);
        when(engine.run(signal)).thenAnswer(inv -> {
            release.await(5, TimeUnit.SECONDS);
            return completed(signal);
        });

        assertThat(scheduler.dispatch(signal)).isTrue();
        assertThat(scheduler.dispatch(signal)).isFalse();
        assertThat(scheduler.isInFlight(1L)).isTrue();

        release.countDown();
        awaitReleased(1L);
        assertThat(scheduler.dispatch(signal)).isTrue();
    }

    @Test
    @DisplayName("a crashing run releases the signal for the next poll")
    void crashedRun_releasesSignal() throws InterruptedException {
        Signal signal = signal(1);
        when(engine.run(signal)).thenThrow(new IllegalStateException("checkpoint store down"));

        scheduler.dispatch(signal);

        awaitReleased(1L);
        assertThat(scheduler.isInFlight(1L)).isFalse();
    }

    @Test
    @DisplayName("disabled scheduler does not poll")
    void disabled_skipsPoll() {
        properties.getScheduler().setEnabled(false);

        scheduler.scheduledPoll();

        verify(memoryStore, never()).findUnprocessedSignals(10);
    }
}
