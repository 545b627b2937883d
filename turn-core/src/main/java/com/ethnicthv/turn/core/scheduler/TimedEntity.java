package com.ethnicthv.turn.core.scheduler;

/**
 * TimedEntity - contract for anything that acts on its own schedule under a {@link Scheduler}.
 * <p>
 * The wait time is the number of logical ticks left before the next {@link #update()}.
 * The scheduler decrements it as the virtual clock advances; the entity resets it inside
 * {@link #update()} to express how long its action takes.
 */
public interface TimedEntity {

    /** Ticks remaining until the next activation. */
    double getWaitTime();

    /**
     * Set the ticks remaining until the next activation. Called by the scheduler while
     * advancing the clock, and by the entity itself from {@link #update()}.
     */
    void setWaitTime(double waitTime);

    /**
     * Act once and set the new wait time.
     * <p>
     * On return the wait time must be strictly greater than it was when this method was
     * invoked. Otherwise the scheduler overrides it with the invocation value plus one.
     */
    void update();
}
