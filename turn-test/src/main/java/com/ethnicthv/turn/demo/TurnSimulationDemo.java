package com.ethnicthv.turn.demo;

import com.ethnicthv.turn.Turns;
import com.ethnicthv.turn.core.scheduler.Scheduler;

/**
 * Demo of a small dungeon turn order driven through the {@link Turns} facade:
 * a fast and a slow creature, a buggy statue, a fuse and a monster nest.
 */
public class TurnSimulationDemo {

    public static void main(String[] args) {
        ActionLog log = new ActionLog();
        Turns turns = Turns.builder()
                .initialCapacity(32)
                .add(new Creature("player", 1.0, log))
                .add(new Creature("bat", 2.0, log))
                .add(new Creature("zombie", 0.5, log))
                .add(new Statue("statue", log))
                .build();

        Scheduler scheduler = turns.getScheduler();
        scheduler.add(new Fuse("bomb", 3, 5.0, scheduler, log));
        scheduler.add(new Spawner("nest", 25.0, 1.5, 3, scheduler, log));

        System.out.println("=== Running 100 ticks of virtual time ===");
        int steps = turns.getLoop().runUntil(() -> turns.getCurrentTime() >= 100, 10_000);

        System.out.printf("Steps: %d, virtual time: %.1f, activations: %d%n",
                steps, turns.getCurrentTime(), log.size());
        for (String actor : new String[]{"player", "bat", "zombie", "statue", "bomb", "nest"}) {
            System.out.printf("  %-8s %d%n", actor, log.count(actor));
        }
        System.out.println("Entities still scheduled: " + scheduler.size());

        turns.newGame();
        System.out.println("\n=== Demo Complete ===");
    }
}
