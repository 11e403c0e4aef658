package com.example.arena.world;

import java.util.Arrays;

/**
 * One column of the component store: at most one value of type {@code T} per entity.
 * Rows are kept dense through a {@link SparseSet}; removal swaps the last row in.
 */
public class ComponentTable<T> {
    private final String name;
    private final SparseSet index;
    private Object[] values;
    private long modCount;

    public ComponentTable(String name, int initialCapacity) {
        this.name = name;
        this.index = new SparseSet(initialCapacity);
        this.values = new Object[Math.max(8, initialCapacity)];
    }

    public String getName() {
        return name;
    }

    /**
     * Attach (or replace) the component for an entity.
     */
    public T put(int entity, T value) {
        if (value == null) {
            throw new IllegalArgumentException(name + ": component value must not be null");
        }
        int row = index.add(entity);
        if (row >= values.length) {
            values = Arrays.copyOf(values, Math.max(values.length * 2, row + 1));
        }
        values[row] = value;
        modCount++;
        return value;
    }

    /**
     * The component for an entity, or null if it has none.
     */
    @SuppressWarnings("unchecked")
    public T get(int entity) {
        int row = index.getDenseIndex(entity);
        return row < 0 ? null : (T) values[row];
    }

    public boolean has(int entity) {
        return index.has(entity);
    }

    /**
     * Detach the component from an entity.
     * @return the removed value, or null if there was none
     */
    @SuppressWarnings("unchecked")
    public T remove(int entity) {
        int row = index.getDenseIndex(entity);
        if (row < 0) return null;
        T removed = (T) values[row];
        int last = index.size() - 1;
        values[row] = values[last];
        values[last] = null;
        index.remove(entity);
        modCount++;
        return removed;
    }

    public int size() {
        return index.size();
    }

    /** Bumped by every put, remove and clear; in-place edits of a value do not count. */
    public long getModCount() {
        return modCount;
    }

    /** Entity owning the row at {@code row}. */
    public int entityAt(int row) {
        return index.getEntity(row);
    }

    /** All owning entities, ascending. */
    public int[] entities() {
        return index.toSortedArray();
    }

    public void clear() {
        index.clear();
        Arrays.fill(values, null);
        modCount++;
    }

    @Override
    public String toString() {
        return "ComponentTable[" + name + ", rows=" + size() + "]";
    }
}
