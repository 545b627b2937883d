package com.ethnicthv.turn;

import com.ethnicthv.turn.core.scheduler.Scheduler;
import com.ethnicthv.turn.core.scheduler.TimedEntity;
import com.ethnicthv.turn.core.scheduler.TurnLoop;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Turns - the single entry point (Facade) for a game session's turn order.
 * <p>
 * Wraps a {@link Scheduler} and a {@link TurnLoop} bound to it. One instance lives for one
 * session; {@link #newGame()} resets it for the next.
 */
public final class Turns {

    private final Scheduler scheduler;
    private final TurnLoop loop;

    // Private constructor, use Turns.builder() instead.
    private Turns(Scheduler scheduler) {
        this.scheduler = scheduler;
        this.loop = new TurnLoop(scheduler);
    }

    public static Builder builder() {
        return new Builder();
    }

    // =================================================================
    // Public API Delegates
    // =================================================================

    /** Entity enters the simulation (spawn). */
    public void spawn(TimedEntity entity) {
        scheduler.add(entity);
    }

    /** Entity leaves the simulation (death). No-op if it is not scheduled. */
    public void retire(TimedEntity entity) {
        scheduler.remove(entity);
    }

    /**
     * Advance to the next activation.
     *
     * @return number of entities that acted
     */
    public int step() {
        return scheduler.run();
    }

    /** Drop every entity and reset the virtual clock. */
    public void newGame() {
        loop.stop();
        scheduler.clear();
    }

    public void pause() {
        scheduler.pause();
    }

    public void resume() {
        scheduler.resume();
    }

    public boolean isPaused() {
        return scheduler.isPaused();
    }

    public double getCurrentTime() {
        return scheduler.getCurrentTime();
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public TurnLoop getLoop() {
        return loop;
    }

    // =================================================================
    // Builder Implementation
    // =================================================================

    public static class Builder {
        private final Scheduler.Builder schedulerBuilder = Scheduler.builder();
        private final List<TimedEntity> initial = new ArrayList<>();

        public Builder initialCapacity(int initialCapacity) {
            schedulerBuilder.initialCapacity(initialCapacity);
            return this;
        }

        public Builder startPaused(boolean startPaused) {
            schedulerBuilder.startPaused(startPaused);
            return this;
        }

        /**
         * Schedule an entity as soon as the session is built.
         */
        public Builder add(TimedEntity entity) {
            if (entity == null) throw new IllegalArgumentException("entity must not be null");
            initial.add(entity);
            return this;
        }

        public Builder addAll(Collection<? extends TimedEntity> entities) {
            if (entities == null) throw new IllegalArgumentException("entities must not be null");
            for (TimedEntity e : entities) {
                add(e);
            }
            return this;
        }

        public Turns build() {
            Scheduler scheduler = schedulerBuilder.build();
            scheduler.addAll(initial);
            return new Turns(scheduler);
        }
    }
}
