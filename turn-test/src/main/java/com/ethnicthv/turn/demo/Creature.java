package com.ethnicthv.turn.demo;

import com.ethnicthv.turn.core.scheduler.TimedEntity;

/**
 * A monster or player: each turn costs {@link #TURN_COST} divided by its speed, so a creature
 * twice as fast acts twice as often.
 */
public class Creature implements TimedEntity {

    public static final double TURN_COST = 10.0;

    private final String name;
    private final double speed;
    private final ActionLog log;
    private double waitTime;
    private int turns;

    public Creature(String name, double speed, ActionLog log) {
        if (name == null) throw new IllegalArgumentException("name must not be null");
        if (!(speed > 0)) throw new IllegalArgumentException("speed must be > 0");
        if (log == null) throw new IllegalArgumentException("log must not be null");
        this.name = name;
        this.speed = speed;
        this.log = log;
        this.waitTime = turnCost();
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
        log.record(name);
        waitTime = turnCost();
    }

    public double turnCost() {
        return TURN_COST / speed;
    }

    public String getName() {
        return name;
    }

    public double getSpeed() {
        return speed;
    }

    public int getTurns() {
        return turns;
    }

    @Override
    public String toString() {
        return "Creature[" + name + ", speed=" + speed + ", wait=" + waitTime + "]";
    }
}
