package org.Fabnet.sampling;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Fixed-capacity ring of recently sampled node ids; the oldest entry is evicted first.
 */
public final class RecencyBuffer {
    private final int[] ring;
    private int head;
    private int size;

    public RecencyBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.ring = new int[capacity];
    }

    public void push(int nodeId) {
        ring[(head + size) % ring.length] = nodeId;
        if (size < ring.length) {
            size++;
        } else {
            head = (head + 1) % ring.length;
        }
    }

    /**
     * Returns true when some buffered id lies closer than {@code minDistance} to {@code nodeId}.
     */
    public boolean isWithin(int nodeId, int minDistance) {
        for (int i = 0; i < size; i++) {
            long distance = Math.abs((long) ring[(head + i) % ring.length] - nodeId);
            if (distance < minDistance) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns buffered ids oldest first.
     */
    public IntList snapshot() {
        IntArrayList ids = new IntArrayList(size);
        for (int i = 0; i < size; i++) {
            ids.add(ring[(head + i) % ring.length]);
        }
        return ids;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return ring.length;
    }

    public void clear() {
        head = 0;
        size = 0;
    }
}
