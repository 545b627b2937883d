package com.ethnicthv.turn.core.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BooleanSupplier;

/**
 * TurnLoop - logical-time driver built on top of {@link Scheduler}.
 * <p>
 * Unlike a frame loop there is no wall clock: one tick is one {@link Scheduler#run()} call,
 * and the loop only decides how many of them to make.
 */
public final class TurnLoop {

    private static final Logger LOG = LoggerFactory.getLogger(TurnLoop.class);

    private final Scheduler scheduler;
    private boolean stopRequested;

    public TurnLoop(Scheduler scheduler) {
        if (scheduler == null) throw new IllegalArgumentException("scheduler must not be null");
        this.scheduler = scheduler;
    }

    /**
     * Step the scheduler {@code ticks} times, or fewer if {@link #stop()} is called meanwhile.
     *
     * @return total number of activations across all steps
     */
    public int runTicks(int ticks) {
        if (ticks < 0) throw new IllegalArgumentException("ticks must be >= 0");
        stopRequested = false;
        int activations = 0;
        for (int i = 0; i < ticks && !stopRequested; i++) {
            activations += scheduler.run();
        }
        return activations;
    }

    /**
     * Step the scheduler until {@code condition} holds, {@link #stop()} is called, or
     * {@code maxTicks} steps have been made. The condition is checked before every step.
     *
     * @return number of steps made
     */
    public int runUntil(BooleanSupplier condition, int maxTicks) {
        if (condition == null) throw new IllegalArgumentException("condition must not be null");
        if (maxTicks < 0) throw new IllegalArgumentException("maxTicks must be >= 0");
        stopRequested = false;
        int ticks = 0;
        while (ticks < maxTicks && !stopRequested && !condition.getAsBoolean()) {
            scheduler.run();
            ticks++;
        }
        if (ticks == maxTicks && !stopRequested && !condition.getAsBoolean()) {
            LOG.debug("runUntil gave up after {} ticks at t={}", maxTicks, scheduler.getCurrentTime());
        }
        return ticks;
    }

    /**
     * Request the running loop to stop once the current step completes.
     * Safe to call from an entity's {@code update()}.
     */
    public void stop() {
        stopRequested = true;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }
}
