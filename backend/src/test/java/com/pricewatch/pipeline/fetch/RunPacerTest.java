package com.pricewatch.pipeline.fetch;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RunPacerTest {

    @Test
    void intervalFollowsRateLimitWithFloor() {
        assertThat(RunPacer.intervalFor(30, 50)).isEqualTo(2000);
        assertThat(RunPacer.intervalFor(600, 50)).isEqualTo(100);
        assertThat(RunPacer.intervalFor(6000, 50)).isEqualTo(50);
    }

    @Test
    void firstCallIsImmediateAndLaterCallsAreSpaced() throws Exception {
        RunPacer pacer = new RunPacer(100);

        assertThat(pacer.pendingDelayMs()).isZero();
        long start = System.nanoTime();
        pacer.awaitNextCall();
        pacer.awaitNextCall();
        pacer.awaitNextCall();
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

        assertThat(elapsedMs).isGreaterThanOrEqualTo(200);
        assertThat(pacer.pendingDelayMs()).isLessThanOrEqualTo(100L);
    }
}
