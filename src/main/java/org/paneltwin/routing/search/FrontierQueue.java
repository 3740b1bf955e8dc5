package org.paneltwin.routing.search;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;

/**
 * Min-priority queue of grid cells for A*, with decrease-key.
 * <p>
 * <strong>Ordering:</strong> lower priority first. Among equal priorities the entry inserted
 * (or re-prioritized) most recently wins, i.e. ties resolve LIFO. Every insert and every
 * successful decrease-key stamps the entry with a fresh sequence number, which makes
 * extraction order fully deterministic.
 * </p>
 * <p>
 * Heap slots are kept in parallel primitive arrays and grow on demand; only the
 * cell-to-slot position map is sized by the grid.
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe.</p>
 */
public class FrontierQueue {
    private static final int INITIAL_CAPACITY = 64;

    // Binary heap, 1-based indexing for easier parent/child math
    private int[] heapCells;
    private int[] heapPriorities;
    private long[] heapSequences;

    // positions[cellIndex] = heap slot, 0 means not present
    private final int[] positions;

    @Getter
    @Accessors(fluent = true)
    private int size = 0;
    @Getter
    @Accessors(fluent = true)
    private int peakSize = 0;
    private long nextSequence = 0L;

    /**
     * @param cellCount number of addressable cells; must be {@code > 0}.
     */
    public FrontierQueue(int cellCount) {
        if (cellCount <= 0) {
            throw new IllegalArgumentException("cellCount must be positive");
        }
        this.positions = new int[cellCount];
        int capacity = Math.min(cellCount, INITIAL_CAPACITY) + 1;
        this.heapCells = new int[capacity];
        this.heapPriorities = new int[capacity];
        this.heapSequences = new long[capacity];
    }

    /**
     * Inserts a cell or lowers its priority if it is already queued.
     *
     * @param cellIndex flat cell index.
     * @param priority A* total cost {@code f = g + h}.
     * @return {@code true} if the queue changed; {@code false} when the cell was already
     * queued with an equal or lower priority.
     * @throws IllegalArgumentException if the cell index is out of bounds.
     */
    public boolean insertOrDecrease(int cellIndex, int priority) {
        if (cellIndex < 0 || cellIndex >= positions.length) {
            throw new IllegalArgumentException(
                    "cellIndex " + cellIndex + " out of bounds (max: " + (positions.length - 1) + ")"
            );
        }

        int existing = positions[cellIndex];
        if (existing > 0) {
            if (priority >= heapPriorities[existing]) {
                return false;
            }
            heapPriorities[existing] = priority;
            heapSequences[existing] = nextSequence++;
            swim(existing);
            return true;
        }

        ensureCapacity(size + 2);
        size++;
        heapCells[size] = cellIndex;
        heapPriorities[size] = priority;
        heapSequences[size] = nextSequence++;
        positions[cellIndex] = size;
        if (size > peakSize) {
            peakSize = size;
        }
        swim(size);
        return true;
    }

    /**
     * Removes and returns the cell with the lowest priority.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public int extractMin() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        int min = heapCells[1];
        positions[min] = 0;
        if (size == 1) {
            size = 0;
            return min;
        }
        moveSlot(size, 1);
        size--;
        sink(1);
        return min;
    }

    public boolean contains(int cellIndex) {
        return cellIndex >= 0 && cellIndex < positions.length && positions[cellIndex] > 0;
    }

    /**
     * Returns the queued priority of a cell.
     *
     * @throws IllegalArgumentException if the cell is not queued.
     */
    public int priorityOf(int cellIndex) {
        if (!contains(cellIndex)) {
            throw new IllegalArgumentException("cell " + cellIndex + " is not queued");
        }
        return heapPriorities[positions[cellIndex]];
    }

    public boolean isEmpty() {
        return size == 0;
    }

    // --- Heap Helper Methods ---

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    /**
     * Returns whether slot {@code i} should be extracted after slot {@code j}.
     */
    private boolean greater(int i, int j) {
        int byPriority = Integer.compare(heapPriorities[i], heapPriorities[j]);
        if (byPriority != 0) {
            return byPriority > 0;
        }
        // LIFO on ties: the older entry (smaller sequence) ranks behind
        return heapSequences[i] < heapSequences[j];
    }

    private void swap(int i, int j) {
        int cell = heapCells[i];
        int priority = heapPriorities[i];
        long sequence = heapSequences[i];

        heapCells[i] = heapCells[j];
        heapPriorities[i] = heapPriorities[j];
        heapSequences[i] = heapSequences[j];

        heapCells[j] = cell;
        heapPriorities[j] = priority;
        heapSequences[j] = sequence;

        positions[heapCells[i]] = i;
        positions[heapCells[j]] = j;
    }

    private void moveSlot(int from, int to) {
        heapCells[to] = heapCells[from];
        heapPriorities[to] = heapPriorities[from];
        heapSequences[to] = heapSequences[from];
        positions[heapCells[to]] = to;
    }

    private void ensureCapacity(int required) {
        if (required <= heapCells.length) {
            return;
        }
        int grown = (int) Math.min((long) positions.length + 1, Math.max(required, (long) heapCells.length * 2));
        heapCells = Arrays.copyOf(heapCells, grown);
        heapPriorities = Arrays.copyOf(heapPriorities, grown);
        heapSequences = Arrays.copyOf(heapSequences, grown);
    }
}
