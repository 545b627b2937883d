package com.ethnicthv.turn.benchmark;

import com.ethnicthv.turn.core.scheduler.Scheduler;
import com.ethnicthv.turn.demo.ActionLog;
import com.ethnicthv.turn.demo.Creature;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Cost of one {@link Scheduler#run()} step as the number of scheduled creatures grows.
 * Speeds are drawn from a small set so several creatures are due in most steps.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Fork(value = 1, jvmArgs = {"-Xms1G", "-Xmx1G"})
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class SchedulerBenchmark {

    private static final double[] SPEEDS = {0.5, 1.0, 1.25, 2.0, 4.0};

    @State(Scope.Thread)
    public static class SchedulerState {
        @Param({"100", "1000", "10000"})
        public int entityCount;

        public Scheduler scheduler;
        public ActionLog log;

        @Setup(Level.Trial)
        public void setup() {
            Random rnd = new Random(17);
            scheduler = Scheduler.builder().initialCapacity(entityCount).build();
            log = new ActionLog();
            for (int i = 0; i < entityCount; i++) {
                Creature c = new Creature("c" + i, SPEEDS[rnd.nextInt(SPEEDS.length)], log);
                c.setWaitTime(rnd.nextInt(20));
                scheduler.add(c);
            }
        }

        @Setup(Level.Iteration)
        public void resetLog() {
            log.clear();
        }
    }

    @Benchmark
    public int run_step(SchedulerState s) {
        return s.scheduler.run();
    }

    @Benchmark
    public void run_hundredSteps(SchedulerState s, Blackhole bh) {
        for (int i = 0; i < 100; i++) {
            bh.consume(s.scheduler.run());
        }
    }
}
