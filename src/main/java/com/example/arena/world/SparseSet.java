package com.example.arena.world;

import java.util.Arrays;

/**
 * Sparse Set for fast entity-to-row mapping.
 * - O(1) insertion, deletion, lookup
 * - Keeps rows densely packed so tables iterate without gaps
 * - Grows on demand as entity ids get larger
 */
public class SparseSet {
    private int[] sparse;  // entity -> dense index
    private int[] dense;   // dense index -> entity
    private int size;

    public SparseSet(int initialCapacity) {
        int cap = Math.max(8, initialCapacity);
        this.sparse = new int[cap];
        this.dense = new int[cap];
        this.size = 0;
        Arrays.fill(sparse, -1);
    }

    /**
     * Add an entity to the set, returning its dense index
     */
    public int add(int entityId) {
        if (entityId < 0) {
            throw new IllegalArgumentException("entity id must be >= 0, got " + entityId);
        }
        if (has(entityId)) {
            return sparse[entityId];
        }
        ensureSparse(entityId);
        if (size == dense.length) {
            dense = Arrays.copyOf(dense, dense.length * 2);
        }

        int denseIndex = size;
        sparse[entityId] = denseIndex;
        dense[denseIndex] = entityId;
        size++;
        return denseIndex;
    }

    /**
     * Remove an entity from the set using swap-and-pop
     */
    public void remove(int entityId) {
        if (!has(entityId)) {
            return;
        }

        int denseIndex = sparse[entityId];
        int lastEntity = dense[size - 1];

        // Swap with last element
        dense[denseIndex] = lastEntity;
        sparse[lastEntity] = denseIndex;

        // Mark as removed
        sparse[entityId] = -1;
        size--;
    }

    /**
     * Check if entity exists in the set
     */
    public boolean has(int entityId) {
        return entityId >= 0 && entityId < sparse.length && sparse[entityId] != -1;
    }

    /**
     * Get the dense index for an entity, or -1 if absent
     */
    public int getDenseIndex(int entityId) {
        return has(entityId) ? sparse[entityId] : -1;
    }

    /**
     * Get the entity ID at a dense index
     */
    public int getEntity(int denseIndex) {
        return dense[denseIndex];
    }

    /**
     * Get the number of entities in the set
     */
    public int size() {
        return size;
    }

    /**
     * Members in ascending id order.
     */
    public int[] toSortedArray() {
        int[] out = Arrays.copyOf(dense, size);
        Arrays.sort(out);
        return out;
    }

    /**
     * Clear all entities
     */
    public void clear() {
        Arrays.fill(sparse, -1);
        size = 0;
    }

    private void ensureSparse(int entityId) {
        if (entityId < sparse.length) return;
        int newLen = sparse.length;
        while (newLen <= entityId) newLen *= 2;
        int oldLen = sparse.length;
        sparse = Arrays.copyOf(sparse, newLen);
        Arrays.fill(sparse, oldLen, newLen, -1);
    }
}
