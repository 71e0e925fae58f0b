package com.eainde.research.workflow;

import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Halt conditions of the runs being driven, looked up by run id from inside
 * the graph before each node starts. A run id is driven by one caller at a
 * time.
 */
@Log4j2
@Component
public class RunGuards {

    public enum Halt {
        CANCELLED,
        OUT_OF_BUDGET
    }

    private final Map<String, Guard> guards = new ConcurrentHashMap<>();
    private final Clock clock;

    public RunGuards(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param deadline instant after which no further node may start, {@code null} for none
     * @throws IllegalStateException when the run is already being driven
     */
    public Guard register(String runId, RunCancellation cancellation, Instant deadline) {
        Guard guard = new Guard(cancellation, deadline);
        Guard existing = guards.putIfAbsent(runId, guard);
        if (existing != null) {
            throw new IllegalStateException("Run " + runId + " is already being driven");
        }
        return guard;
    }

    public void release(String runId) {
        guards.remove(runId);
    }

    /**
     * Evaluates the run's halt conditions. Once a run is halted it stays halted.
     */
    public Optional<Halt> check(String runId) {
        Guard guard = runId == null ? null : guards.get(runId);
        return guard == null ? Optional.empty() : guard.check();
    }

    public final class Guard {

        private final RunCancellation cancellation;
        private final Instant deadline;
        private final AtomicReference<Halt> halt = new AtomicReference<>();

        private Guard(RunCancellation cancellation, Instant deadline) {
            this.cancellation = cancellation;
            this.deadline = deadline;
        }

        Optional<Halt> check() {
            if (cancellation.isCancelled()) {
                halt.compareAndSet(null, Halt.CANCELLED);
            } else if (deadline != null && clock.instant().isAfter(deadline)) {
                halt.compareAndSet(null, Halt.OUT_OF_BUDGET);
            }
            return halted();
        }

        public Optional<Halt> halted() {
            return Optional.ofNullable(halt.get());
        }

        public Instant deadline() {
            return deadline;
        }
    }
}
