package com.ethnicthv.turn.benchmark;

import com.ethnicthv.turn.core.queue.BinaryHeap;
import org.openjdk.jmh.annotations.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Microbenchmarks comparing bulk insertion paths of {@link BinaryHeap}:
 * - pushAll into an empty heap (bottom-up heapify) vs one push per element.
 * - identity removal from the middle of the heap.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 1, jvmArgs = {"-Xms1G", "-Xmx1G"})
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class BinaryHeapBenchmark {

    public static final class Slot {
        double key;

        Slot(double key) {
            this.key = key;
        }
    }

    @State(Scope.Thread)
    public static class HeapState {
        @Param({"1000", "10000"})
        public int size;

        public List<Slot> slots;
        public BinaryHeap<Slot> heap;

        @Setup(Level.Trial)
        public void createSlots() {
            Random rnd = new Random(3);
            slots = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                slots.add(new Slot(rnd.nextInt(size)));
            }
        }

        @Setup(Level.Invocation)
        public void freshHeap() {
            heap = new BinaryHeap<>(s -> s.key, size);
        }
    }

    @Benchmark
    public BinaryHeap<Slot> pushAll_batch(HeapState s) {
        s.heap.pushAll(s.slots);
        return s.heap;
    }

    @Benchmark
    public BinaryHeap<Slot> push_perElement(HeapState s) {
        for (Slot slot : s.slots) {
            s.heap.push(slot);
        }
        return s.heap;
    }

    @Benchmark
    public BinaryHeap<Slot> remove_half(HeapState s) {
        s.heap.pushAll(s.slots);
        for (int i = 0; i < s.slots.size(); i += 2) {
            s.heap.remove(s.slots.get(i));
        }
        return s.heap;
    }
}
