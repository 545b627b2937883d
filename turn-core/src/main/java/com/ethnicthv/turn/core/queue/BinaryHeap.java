package com.ethnicthv.turn.core.queue;

import java.util.Arrays;
import java.util.Collection;
import java.util.function.ToDoubleFunction;

/**
 * Array-backed binary min-heap ordered by an externally supplied numeric key.
 * <p>
 * The key is read through the extractor on every comparison, never cached. Callers may
 * therefore change keys between heap operations as long as the relative order of the
 * elements inside the heap is preserved (e.g. subtracting the same amount from all of them).
 * <p>
 * Equal keys are ordered by insertion: every push stamps its slot with a sequence number,
 * so ties pop first-in-first-out. Re-inserting an element gives it a new stamp.
 * <p>
 * The heap does not own its elements and compares them by identity on {@link #remove}.
 * Not thread-safe.
 *
 * @param <T> element type
 */
public final class BinaryHeap<T> {

    private static final int DEFAULT_CAPACITY = 16;

    /**
     * Smallest accepted key, -2^53. Below it {@code key + 1 == key}, and -Infinity is below it.
     */
    public static final double MIN_KEY = -0x1p53;

    private final ToDoubleFunction<? super T> keyExtractor;
    private Object[] elements;   // dense heap array
    private long[] sequence;     // insertion stamp, parallel to elements
    private int size;
    private long nextSequence;

    public BinaryHeap(ToDoubleFunction<? super T> keyExtractor) {
        this(keyExtractor, DEFAULT_CAPACITY);
    }

    /**
     * @param keyExtractor    reads the ordering key of an element
     * @param initialCapacity number of slots to pre-allocate
     */
    public BinaryHeap(ToDoubleFunction<? super T> keyExtractor, int initialCapacity) {
        if (keyExtractor == null) throw new IllegalArgumentException("keyExtractor must not be null");
        if (initialCapacity < 0) throw new IllegalArgumentException("initialCapacity must be >= 0");
        this.keyExtractor = keyExtractor;
        this.elements = new Object[Math.max(1, initialCapacity)];
        this.sequence = new long[elements.length];
    }

    /**
     * Insert an element in O(log n).
     *
     * @throws IllegalArgumentException if the element is null or its key is not {@link #isValidKey valid}
     */
    public void push(T element) {
        validate(element);
        ensureCapacity(size + 1);
        int i = size++;
        elements[i] = element;
        sequence[i] = nextSequence++;
        siftUp(i);
    }

    /**
     * Insert every element of the collection, in iteration order.
     * <p>
     * All elements are validated before any is inserted. A batch at least as large as the
     * current heap is appended and re-heapified bottom-up in O(n + k); smaller batches are
     * sifted up one by one.
     *
     * @throws IllegalArgumentException if any element is null or has an invalid key
     */
    public void pushAll(Collection<? extends T> batch) {
        if (batch == null) throw new IllegalArgumentException("batch must not be null");
        if (batch.isEmpty()) return;
        for (T element : batch) {
            validate(element);
        }
        int count = batch.size();
        ensureCapacity(size + count);
        if (count < size) {
            for (T element : batch) {
                int i = size++;
                elements[i] = element;
                sequence[i] = nextSequence++;
                siftUp(i);
            }
            return;
        }
        for (T element : batch) {
            elements[size] = element;
            sequence[size] = nextSequence++;
            size++;
        }
        heapify();
    }

    /**
     * Remove and return the minimum element.
     *
     * @return the minimum, or {@code null} if the heap is empty
     */
    public T pop() {
        if (size == 0) return null;
        T top = elementAt(0);
        removeAt(0);
        return top;
    }

    /**
     * @return the minimum element without removing it, or {@code null} if the heap is empty
     */
    public T peek() {
        return size == 0 ? null : elementAt(0);
    }

    /**
     * Element at internal rank {@code index}. Rank 0 is the minimum; other ranks follow the
     * heap layout, not sorted order. Meant for visiting every element without popping.
     *
     * @throws IndexOutOfBoundsException if {@code index} is not in {@code 0..size-1}
     */
    public T peek(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index " + index + " out of bounds for size " + size);
        }
        return elementAt(index);
    }

    /**
     * Remove a specific element, matched by identity, wherever it sits in the heap.
     *
     * @return {@code true} if the element was present and has been removed
     */
    public boolean remove(T element) {
        int index = indexOf(element);
        if (index < 0) return false;
        removeAt(index);
        return true;
    }

    /**
     * Identity membership test, O(n).
     */
    public boolean contains(T element) {
        return indexOf(element) >= 0;
    }

    /**
     * A key is valid when it is not NaN and not below {@link #MIN_KEY}. +Infinity is accepted.
     */
    public static boolean isValidKey(double key) {
        return key >= MIN_KEY;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Drop every element. Capacity is kept.
     */
    public void clear() {
        Arrays.fill(elements, 0, size, null);
        size = 0;
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void validate(T element) {
        if (element == null) throw new IllegalArgumentException("element must not be null");
        double key = keyExtractor.applyAsDouble(element);
        if (Double.isNaN(key)) {
            throw new IllegalArgumentException("key must not be NaN: " + element);
        }
        if (!isValidKey(key)) {
            throw new IllegalArgumentException("key must be >= " + MIN_KEY + ": " + element);
        }
    }

    @SuppressWarnings("unchecked")
    private T elementAt(int i) {
        return (T) elements[i];
    }

    private int indexOf(T element) {
        if (element == null) return -1;
        for (int i = 0; i < size; i++) {
            if (elements[i] == element) return i;
        }
        return -1;
    }

    // Swap-with-last, then restore order in whichever direction the moved element needs.
    private void removeAt(int index) {
        int last = --size;
        if (index != last) {
            elements[index] = elements[last];
            sequence[index] = sequence[last];
        }
        elements[last] = null;
        if (index < size) {
            int settled = siftDown(index);
            if (settled == index) {
                siftUp(index);
            }
        }
    }

    private boolean less(int a, int b) {
        double ka = keyExtractor.applyAsDouble(elementAt(a));
        double kb = keyExtractor.applyAsDouble(elementAt(b));
        if (ka < kb) return true;
        if (ka > kb) return false;
        return sequence[a] < sequence[b];
    }

    private void siftUp(int i) {
        while (i > 0) {
            int parent = (i - 1) >>> 1;
            if (!less(i, parent)) break;
            swap(i, parent);
            i = parent;
        }
    }

    private int siftDown(int i) {
        while (true) {
            int left = (i << 1) + 1;
            int right = left + 1;
            int min = i;
            if (left < size && less(left, min)) min = left;
            if (right < size && less(right, min)) min = right;
            if (min == i) return i;
            swap(i, min);
            i = min;
        }
    }

    private void heapify() {
        for (int i = (size >>> 1) - 1; i >= 0; i--) {
            siftDown(i);
        }
    }

    private void swap(int a, int b) {
        Object e = elements[a];
        elements[a] = elements[b];
        elements[b] = e;
        long s = sequence[a];
        sequence[a] = sequence[b];
        sequence[b] = s;
    }

    private void ensureCapacity(int required) {
        if (required <= elements.length) return;
        int newCapacity = Math.max(required, elements.length << 1);
        elements = Arrays.copyOf(elements, newCapacity);
        sequence = Arrays.copyOf(sequence, newCapacity);
    }
}
