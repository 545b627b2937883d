package com.ethnicthv.turn.demo;

import com.ethnicthv.turn.core.scheduler.Scheduler;
import com.ethnicthv.turn.core.scheduler.TurnLoop;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Demo entities: spawn and death during a run")
public class DemoEntitiesTest {

    @Test
    @DisplayName("fuse ticks, detonates and retires itself")
    void fuseRetiresItself() {
        ActionLog log = new ActionLog();
        Scheduler scheduler = new Scheduler();
        Fuse fuse = new Fuse("bomb", 3, 2.0, scheduler, log);
        Creature player = new Creature("player", 1.0, log);
        scheduler.add(fuse);
        scheduler.add(player);

        new TurnLoop(scheduler).runTicks(5);

        assertTrue(fuse.isDetonated());
        assertFalse(scheduler.contains(fuse));
        assertEquals(1, scheduler.size());
        assertEquals(List.of("bomb", "bomb", "bomb:boom", "player"), log.entries().subList(0, 4));
        assertEquals(3, log.count("bomb") + log.count("bomb:boom"));
    }

    @Test
    @DisplayName("spawner adds creatures that join the turn order")
    void spawnerAddsCreatures() {
        ActionLog log = new ActionLog();
        Scheduler scheduler = new Scheduler();
        Spawner nest = new Spawner("nest", 10.0, 1.0, 2, scheduler, log);
        scheduler.add(nest);

        TurnLoop loop = new TurnLoop(scheduler);
        loop.runUntil(() -> scheduler.getCurrentTime() >= 50, 1_000);

        List<Creature> spawned = nest.getSpawned();
        assertEquals(2, spawned.size());
        assertEquals(3, scheduler.size());
        // spawned at t=10 and t=20, each acting every 10 ticks afterwards
        assertEquals(4, spawned.get(0).getTurns());
        assertEquals(3, spawned.get(1).getTurns());
        assertEquals(2, log.count("nest"));
    }

    @Test
    @DisplayName("creature validates its construction arguments")
    void creatureValidation() {
        ActionLog log = new ActionLog();
        assertThrows(IllegalArgumentException.class, () -> new Creature(null, 1, log));
        assertThrows(IllegalArgumentException.class, () -> new Creature("x", 0, log));
        assertThrows(IllegalArgumentException.class, () -> new Creature("x", Double.NaN, log));
        assertThrows(IllegalArgumentException.class, () -> new Creature("x", 1, null));

        Creature c = new Creature("x", 4, log);
        assertEquals(2.5, c.turnCost());
        assertEquals(2.5, c.getWaitTime());
    }
}
