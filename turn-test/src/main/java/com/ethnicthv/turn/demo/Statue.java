package com.ethnicthv.turn.demo;

import com.ethnicthv.turn.core.scheduler.TimedEntity;

/**
 * Buggy entity: acts but never sets a new wait time. The scheduler keeps it from
 * starving everyone else by bumping it one tick per activation.
 */
public class Statue implements TimedEntity {

    private final String name;
    private final ActionLog log;
    private double waitTime;

    public Statue(String name, ActionLog log) {
        this.name = name;
        this.log = log;
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
        log.record(name);
    }

    @Override
    public String toString() {
        return "Statue[" + name + "]";
    }
}
