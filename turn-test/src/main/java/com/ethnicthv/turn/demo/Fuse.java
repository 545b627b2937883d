package com.ethnicthv.turn.demo;

import com.ethnicthv.turn.core.scheduler.Scheduler;
import com.ethnicthv.turn.core.scheduler.TimedEntity;

/**
 * A lit fuse: ticks a fixed number of times, then detonates and retires itself
 * from the scheduler it was given.
 */
public class Fuse implements TimedEntity {

    private final String name;
    private final Scheduler scheduler;
    private final ActionLog log;
    private final double interval;
    private int ticksLeft;
    private double waitTime;
    private boolean detonated;

    public Fuse(String name, int ticks, double interval, Scheduler scheduler, ActionLog log) {
        if (ticks < 1) throw new IllegalArgumentException("ticks must be >= 1");
        if (!(interval > 0)) throw new IllegalArgumentException("interval must be > 0");
        this.name = name;
        this.ticksLeft = ticks;
        this.interval = interval;
        this.scheduler = scheduler;
        this.log = log;
        this.waitTime = interval;
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
        ticksLeft--;
        if (ticksLeft > 0) {
            log.record(name);
            waitTime = interval;
            return;
        }
        log.record(name + ":boom");
        detonated = true;
        scheduler.remove(this);
    }

    public boolean isDetonated() {
        return detonated;
    }
}
