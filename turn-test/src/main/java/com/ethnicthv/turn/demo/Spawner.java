package com.ethnicthv.turn.demo;

import com.ethnicthv.turn.core.scheduler.Scheduler;
import com.ethnicthv.turn.core.scheduler.TimedEntity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Monster nest: every {@code interval} ticks it adds a new {@link Creature} to the scheduler,
 * up to {@code limit} of them.
 */
public class Spawner implements TimedEntity {

    private final String name;
    private final Scheduler scheduler;
    private final ActionLog log;
    private final double interval;
    private final double offspringSpeed;
    private final int limit;
    private final List<Creature> spawned = new ArrayList<>();
    private double waitTime;

    public Spawner(String name, double interval, double offspringSpeed, int limit,
                   Scheduler scheduler, ActionLog log) {
        if (!(interval > 0)) throw new IllegalArgumentException("interval must be > 0");
        this.name = name;
        this.interval = interval;
        this.offspringSpeed = offspringSpeed;
        this.limit = limit;
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
        waitTime = interval;
        if (spawned.size() >= limit) {
            return;
        }
        Creature child = new Creature(name + "#" + spawned.size(), offspringSpeed, log);
        spawned.add(child);
        log.record(name);
        scheduler.add(child);
    }

    public List<Creature> getSpawned() {
        return Collections.unmodifiableList(spawned);
    }
}
