package com.eainde.research.workflow;

import com.eainde.research.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunGuardsTest {

    private static final Instant START = Instant.parse("2026-03-02T09:00:00Z");

    private final MutableClock clock = new MutableClock(START);
    private final RunGuards guards = new RunGuards(clock);

    @Test
    @DisplayName("deadline in the past halts the run and the halt sticks")
    void deadlinePassed_staysHalted() {
        RunGuards.Guard guard = guards.register("signal-1", RunCancellation.none(), START.plus(Duration.ofMinutes(5)));

        assertThat(guards.check("signal-1")).isEmpty();
        clock.advance(Duration.ofMinutes(6));
        assertThat(guards.check("signal-1")).contains(RunGuards.Halt.OUT_OF_BUDGET);

        clock.advance(Duration.ofMinutes(-6));
        assertThat(guard.halted()).contains(RunGuards.Halt.OUT_OF_BUDGET);
    }

    @Test
    @DisplayName("cancellation wins over an expired deadline")
    void cancellation_reportedFirst() {
        RunCancellation cancellation = new RunCancellation();
        guards.register("signal-1", cancellation, START);
        cancellation.cancel();
        clock.advance(Duration.ofMinutes(1));

        assertThat(guards.check("signal-1")).contains(RunGuards.Halt.CANCELLED);
    }

    @Test
    @DisplayName("a run can only be driven by one caller at a time")
    void doubleRegistration_rejected() {
        guards.register("signal-1", RunCancellation.none(), null);

        assertThatThrownBy(() -> guards.register("signal-1", RunCancellation.none(), null))
                .isInstanceOf(IllegalStateException.class);

        guards.release("signal-1");
        assertThat(guards.check("signal-1")).isEmpty();
        guards.register("signal-1", RunCancellation.none(), null);
    }
}
