package org.gridmaze.search;

import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * A min-priority frontier for best-first grid search (A*, greedy best-first).
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Arena entries:</strong> every {@link #push(int, double)} appends an entry to
 * structure-of-arrays storage and returns its stable entry id. Entries are never moved or
 * reused during one search.</li>
 * <li><strong>Lazy deletion:</strong> re-prioritizing a cell means invalidating its old entry
 * and pushing a new one. Invalidated entries stay in the heap and are skipped on poll.</li>
 * <li><strong>Stable ties:</strong> equal priorities pop in insertion order (FIFO), so results
 * are deterministic for a fixed neighbor order.</li>
 * </ul>
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. It is intended for single-threaded use.</p>
 */
public class PriorityFrontier {

    // Arena (Structure of Arrays): index = entry id
    private final IntArrayList cellByEntry;
    private final DoubleArrayList priorityByEntry;
    private final BooleanArrayList liveByEntry;

    // Binary heap of entry ids (0-based)
    private final IntArrayList heap;

    private int liveCount = 0;

    public PriorityFrontier() {
        this(16);
    }

    /**
     * @param expectedEntries capacity hint, typically the grid cell count.
     */
    public PriorityFrontier(int expectedEntries) {
        if (expectedEntries < 0) {
            throw new IllegalArgumentException("expectedEntries must be non-negative");
        }
        this.cellByEntry = new IntArrayList(expectedEntries);
        this.priorityByEntry = new DoubleArrayList(expectedEntries);
        this.liveByEntry = new BooleanArrayList(expectedEntries);
        this.heap = new IntArrayList(expectedEntries);
    }

    /**
     * Adds a live entry.
     *
     * @param cellIndex cell the entry refers to.
     * @param priority ordering key, lower pops first. Must not be NaN.
     * @return stable entry id, usable with {@link #invalidate(int)}.
     */
    public int push(int cellIndex, double priority) {
        if (Double.isNaN(priority)) {
            throw new IllegalArgumentException("priority must not be NaN");
        }
        int entryId = cellByEntry.size();
        cellByEntry.add(cellIndex);
        priorityByEntry.add(priority);
        liveByEntry.add(true);
        liveCount++;

        heap.add(entryId);
        swim(heap.size() - 1);
        return entryId;
    }

    /**
     * Tags an entry as stale. It stays in the heap and is discarded when it surfaces.
     *
     * @return {@code true} if the entry was live before this call.
     */
    public boolean invalidate(int entryId) {
        checkEntry(entryId);
        if (!liveByEntry.getBoolean(entryId)) {
            return false;
        }
        liveByEntry.set(entryId, false);
        liveCount--;
        return true;
    }

    /**
     * Removes the live entry with the lowest priority (earliest insertion on ties).
     *
     * @return entry id of the removed entry.
     * @throws EmptyQueueException if no live entry remains.
     */
    public int pollEntry() {
        while (!heap.isEmpty()) {
            int entryId = removeTop();
            if (liveByEntry.getBoolean(entryId)) {
                liveByEntry.set(entryId, false);
                liveCount--;
                return entryId;
            }
        }
        throw new EmptyQueueException("Frontier is empty");
    }

    /**
     * Convenience form of {@link #pollEntry()} returning the entry's cell.
     */
    public int pollCell() {
        return cellByEntry.getInt(pollEntry());
    }

    public int cellOf(int entryId) {
        checkEntry(entryId);
        return cellByEntry.getInt(entryId);
    }

    public double priorityOf(int entryId) {
        checkEntry(entryId);
        return priorityByEntry.getDouble(entryId);
    }

    public boolean isLive(int entryId) {
        checkEntry(entryId);
        return liveByEntry.getBoolean(entryId);
    }

    /**
     * @return true when no live entry remains (stale heap slots are ignored).
     */
    public boolean isEmpty() {
        return liveCount == 0;
    }

    /**
     * @return number of live entries.
     */
    public int size() {
        return liveCount;
    }

    /**
     * Diagnostic: number of heap slots including stale entries.
     */
    public int heapSize() {
        return heap.size();
    }

    /**
     * Drops every entry; entry ids issued before the call become invalid.
     */
    public void clear() {
        cellByEntry.clear();
        priorityByEntry.clear();
        liveByEntry.clear();
        heap.clear();
        liveCount = 0;
    }

    private void checkEntry(int entryId) {
        if (entryId < 0 || entryId >= cellByEntry.size()) {
            throw new IllegalArgumentException(
                    "entryId " + entryId + " out of bounds (issued: " + cellByEntry.size() + ")");
        }
    }

    // --- Heap Helper Methods ---

    private int removeTop() {
        int top = heap.getInt(0);
        int last = heap.removeInt(heap.size() - 1);
        if (!heap.isEmpty()) {
            heap.set(0, last);
            sink(0);
        }
        return top;
    }

    private void swim(int k) {
        while (k > 0) {
            int parent = (k - 1) >>> 1;
            if (!less(k, parent)) {
                break;
            }
            swap(k, parent);
            k = parent;
        }
    }

    private void sink(int k) {
        int size = heap.size();
        while (2 * k + 1 < size) {
            int j = 2 * k + 1;
            if (j + 1 < size && less(j + 1, j)) j++;
            if (!less(j, k)) break;
            swap(k, j);
            k = j;
        }
    }

    /**
     * Orders by priority, then by entry id (insertion order) for stability.
     */
    private boolean less(int i, int j) {
        int a = heap.getInt(i);
        int b = heap.getInt(j);
        int byPriority = Double.compare(priorityByEntry.getDouble(a), priorityByEntry.getDouble(b));
        if (byPriority != 0) {
            return byPriority < 0;
        }
        return a < b;
    }

    private void swap(int i, int j) {
        int tmp = heap.getInt(i);
        heap.set(i, heap.getInt(j));
        heap.set(j, tmp);
    }
}
