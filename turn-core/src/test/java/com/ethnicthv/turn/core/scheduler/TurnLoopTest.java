package com.ethnicthv.turn.core.scheduler;

import com.ethnicthv.turn.Turns;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TurnLoop and Turns facade")
public class TurnLoopTest {

    /** Acts every {@code period} ticks and counts its turns. */
    static final class Ticker implements TimedEntity {
        final double period;
        double waitTime;
        int turns;
        Runnable sideEffect = () -> { };

        Ticker(double period) {
            this.period = period;
            this.waitTime = period;
        }

        @Override
        public double getWaitTime() {
            return waitTime;
        }

        @Override
        public void setWaitTime(double waitTime) {
            this.waitTime = waitTime;
        }

        @Override
        public void update() {
            turns++;
            waitTime = period;
            sideEffect.run();
        }
    }

    @Test
    @DisplayName("runTicks steps the scheduler the requested number of times")
    void runTicks() {
        Scheduler scheduler = new Scheduler();
        Ticker t = new Ticker(2);
        scheduler.add(t);
        TurnLoop loop = new TurnLoop(scheduler);

        assertEquals(5, loop.runTicks(5));
        assertEquals(5, t.turns);
        assertEquals(10.0, scheduler.getCurrentTime());
        assertEquals(0, loop.runTicks(0));
    }

    @Test
    @DisplayName("runUntil stops as soon as the condition holds")
    void runUntil() {
        Scheduler scheduler = new Scheduler();
        Ticker t = new Ticker(3);
        scheduler.add(t);
        TurnLoop loop = new TurnLoop(scheduler);

        int ticks = loop.runUntil(() -> scheduler.getCurrentTime() >= 12, 100);
        assertEquals(4, ticks);
        assertEquals(4, t.turns);

        assertEquals(0, loop.runUntil(() -> true, 100));
        assertEquals(7, loop.runUntil(() -> false, 7));
    }

    @Test
    @DisplayName("stop from an entity ends the loop after the current step")
    void stopFromEntity() {
        Scheduler scheduler = new Scheduler();
        TurnLoop loop = new TurnLoop(scheduler);
        Ticker t = new Ticker(1);
        AtomicInteger calls = new AtomicInteger();
        t.sideEffect = () -> {
            if (calls.incrementAndGet() == 3) loop.stop();
        };
        scheduler.add(t);

        assertEquals(3, loop.runTicks(50));
        assertEquals(3, t.turns);

        // a new run clears the previous stop request
        assertEquals(2, loop.runTicks(2));
    }

    @Test
    @DisplayName("argument validation")
    void rejectsBadArguments() {
        TurnLoop loop = new TurnLoop(new Scheduler());
        assertThrows(IllegalArgumentException.class, () -> new TurnLoop(null));
        assertThrows(IllegalArgumentException.class, () -> loop.runTicks(-1));
        assertThrows(IllegalArgumentException.class, () -> loop.runUntil(null, 1));
        assertThrows(IllegalArgumentException.class, () -> loop.runUntil(() -> true, -1));
    }

    @Test
    @DisplayName("Turns facade: spawn, step, retire, new game")
    void facadeLifecycle() {
        Ticker fast = new Ticker(1);
        Ticker slow = new Ticker(4);
        Turns turns = Turns.builder()
                .initialCapacity(8)
                .add(fast)
                .add(slow)
                .build();

        assertFalse(turns.isPaused());
        // ticks 1-3: fast alone; tick 4: both are due, slow was queued earlier so it goes first
        assertEquals(5, turns.getLoop().runTicks(4));
        assertEquals(4, fast.turns);
        assertEquals(1, slow.turns);
        assertEquals(4.0, turns.getCurrentTime());

        turns.retire(slow);
        turns.retire(slow);
        assertEquals(1, turns.step());
        assertEquals(1, slow.turns);

        turns.pause();
        assertTrue(turns.isPaused());
        assertEquals(0, turns.step());
        turns.resume();

        turns.newGame();
        assertEquals(0, turns.getScheduler().size());
        assertEquals(0.0, turns.getCurrentTime());
        assertEquals(0, turns.step());

        Ticker late = new Ticker(2);
        turns.spawn(late);
        assertEquals(1, turns.step());
        assertEquals(2.0, turns.getCurrentTime());
    }

    @Test
    @DisplayName("Turns builder validates its input")
    void facadeBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> Turns.builder().add(null));
        assertThrows(IllegalArgumentException.class, () -> Turns.builder().addAll(null));
        assertThrows(IllegalArgumentException.class, () -> Turns.builder().initialCapacity(-5));

        Turns paused = Turns.builder().startPaused(true).add(new Ticker(1)).build();
        assertTrue(paused.isPaused());
        assertEquals(0, paused.step());
    }
}
