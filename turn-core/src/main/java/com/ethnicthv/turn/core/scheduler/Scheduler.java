package com.ethnicthv.turn.core.scheduler;

import com.ethnicthv.turn.core.queue.BinaryHeap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Decides which {@link TimedEntity} acts next and advances the shared virtual clock.
 * <p>
 * Each {@link #run()} step:
 * <ol>
 *   <li>reads the smallest wait time in the queue ({@code elapsed});</li>
 *   <li>if positive, subtracts it from every queued entity and adds it to the virtual clock;</li>
 *   <li>pops and updates every entity whose wait time is now {@code <= 0}, in queue order;</li>
 *   <li>re-inserts the updated entities once no eligible entity is left.</li>
 * </ol>
 * An entity whose {@code update()} does not raise its wait time above the value it had at
 * invocation is bumped to that value plus one, so a faulty entity cannot monopolize the clock.
 * <p>
 * Entities may add, remove or clear entities from inside their own {@code update()}. An entity
 * removed after it was popped in the current step is not re-inserted, and one added again
 * while it waits for re-insertion is not scheduled twice.
 * <p>
 * Single-threaded and non-reentrant: calling {@link #run()} from an {@code update()} throws.
 */
public class Scheduler {

    private static final Logger LOG = LoggerFactory.getLogger(Scheduler.class);

    private final BinaryHeap<TimedEntity> entities;
    // Entities popped during the current step, waiting to be pushed back
    private final List<Activation> pending = new ArrayList<>();
    private boolean paused;
    private boolean running;
    private double currentTime;

    public Scheduler() {
        this(16, false);
    }

    private Scheduler(int initialCapacity, boolean startPaused) {
        this.entities = new BinaryHeap<>(TimedEntity::getWaitTime, initialCapacity);
        this.paused = startPaused;
    }

    public static Builder builder() {
        return new Builder();
    }

    // =================================================================
    // Membership
    // =================================================================

    /**
     * Schedule an entity with its current wait time.
     * <p>
     * Ignored for an entity that already acted in the step in progress; it is re-inserted
     * when the step ends. Adding an entity that is already queued schedules it twice.
     *
     * @throws IllegalArgumentException if the entity is null or its wait time is NaN or
     *                                  below {@link BinaryHeap#MIN_KEY}
     */
    public void add(TimedEntity entity) {
        if (isPending(entity)) {
            LOG.trace("Ignored add of {}, already pending re-insertion", entity);
            return;
        }
        entities.push(entity);
    }

    /**
     * Schedule several entities at once. Entities pending re-insertion are skipped as in
     * {@link #add(TimedEntity)}.
     *
     * @throws IllegalArgumentException if the collection or any entity is invalid; nothing is added then
     */
    public void addAll(Collection<? extends TimedEntity> batch) {
        if (pending.isEmpty() || batch == null) {
            entities.pushAll(batch);
            return;
        }
        List<TimedEntity> fresh = new ArrayList<>(batch.size());
        for (TimedEntity e : batch) {
            if (!isPending(e)) fresh.add(e);
        }
        entities.pushAll(fresh);
    }

    /**
     * Retire an entity. No-op if it is not scheduled.
     */
    public void remove(TimedEntity entity) {
        if (entities.remove(entity)) {
            return;
        }
        for (int i = 0; i < pending.size(); i++) {
            if (pending.get(i).entity() == entity) {
                pending.remove(i);
                LOG.trace("Retired {} while pending re-insertion", entity);
                return;
            }
        }
    }

    /**
     * Drop every entity and reset the virtual clock. The paused state is kept.
     */
    public void clear() {
        entities.clear();
        pending.clear();
        currentTime = 0;
    }

    public boolean contains(TimedEntity entity) {
        return entities.contains(entity) || isPending(entity);
    }

    private boolean isPending(TimedEntity entity) {
        for (Activation a : pending) {
            if (a.entity() == entity) return true;
        }
        return false;
    }

    /** Number of scheduled entities, including those updated in the step in progress. */
    public int size() {
        return entities.size() + pending.size();
    }

    // =================================================================
    // State
    // =================================================================

    public void pause() {
        paused = true;
    }

    public void resume() {
        paused = false;
    }

    public boolean isPaused() {
        return paused;
    }

    /**
     * Virtual clock: the sum of every {@code elapsed} consumed by {@link #run()} since
     * construction or the last {@link #clear()}.
     */
    public double getCurrentTime() {
        return currentTime;
    }

    // =================================================================
    // Step
    // =================================================================

    /**
     * Advance the clock to the next activation and update every entity that is due.
     *
     * @return number of entities updated; 0 when paused or empty
     * @throws IllegalStateException if called from inside an entity's {@code update()}
     */
    public int run() {
        if (running) {
            throw new IllegalStateException("Scheduler.run() is not reentrant");
        }
        if (paused || entities.isEmpty()) {
            return 0;
        }
        running = true;
        int activated = 0;
        try {
            advanceClock();

            TimedEntity entity = entities.peek();
            while (entity != null && entity.getWaitTime() <= 0) {
                entities.pop();
                double oldWaitTime = entity.getWaitTime();
                pending.add(new Activation(entity, oldWaitTime));
                try {
                    entity.update();
                } finally {
                    // negated test so a NaN result is bumped as well
                    if (!(entity.getWaitTime() > oldWaitTime)) {
                        LOG.debug("{} did not advance its wait time ({} -> {}), forcing {}",
                                entity, oldWaitTime, entity.getWaitTime(), oldWaitTime + 1);
                        entity.setWaitTime(oldWaitTime + 1);
                    }
                }
                activated++;
                LOG.trace("Activated {} at t={}, next in {}", entity, currentTime, entity.getWaitTime());
                entity = entities.peek();
            }
        } finally {
            try {
                reinsertPending();
            } finally {
                pending.clear();
                running = false;
            }
        }
        return activated;
    }

    // Another entity's update may have spoiled a pending key; fall back to the bump value
    private void reinsertPending() {
        List<TimedEntity> batch = new ArrayList<>(pending.size());
        for (Activation a : pending) {
            TimedEntity e = a.entity();
            if (!BinaryHeap.isValidKey(e.getWaitTime())) {
                LOG.debug("{} left with invalid wait time {}, forcing {}",
                        e, e.getWaitTime(), a.waitTime() + 1);
                e.setWaitTime(a.waitTime() + 1);
            }
            batch.add(e);
        }
        entities.pushAll(batch);
    }

    private void advanceClock() {
        double elapsed = entities.peek().getWaitTime();
        // +Infinity at the head means every entity is parked
        if (elapsed <= 0 || elapsed == Double.POSITIVE_INFINITY) {
            return;
        }
        for (int i = 0, len = entities.size(); i < len; i++) {
            TimedEntity e = entities.peek(i);
            e.setWaitTime(e.getWaitTime() - elapsed);
        }
        currentTime += elapsed;
    }

    /** An entity popped in the current step and its wait time when it was invoked. */
    private record Activation(TimedEntity entity, double waitTime) {
    }

    // =================================================================
    // Builder
    // =================================================================

    public static class Builder {
        private int initialCapacity = 16;
        private boolean startPaused;

        /**
         * Pre-size the queue for the expected number of entities.
         */
        public Builder initialCapacity(int initialCapacity) {
            if (initialCapacity < 0) {
                throw new IllegalArgumentException("initialCapacity must be >= 0");
            }
            this.initialCapacity = initialCapacity;
            return this;
        }

        /**
         * Create the scheduler in the paused state.
         */
        public Builder startPaused(boolean startPaused) {
            this.startPaused = startPaused;
            return this;
        }

        public Scheduler build() {
            return new Scheduler(initialCapacity, startPaused);
        }
    }
}
