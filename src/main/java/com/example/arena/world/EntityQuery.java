package com.example.arena.world;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Attribute-set membership query: entities owning every table in {@code with}
 * and none in {@code without}. Results are in ascending id order so every
 * system iterates deterministically.
 */
public class EntityQuery {
    private final List<ComponentTable<?>> with = new ArrayList<>();
    private final List<ComponentTable<?>> without = new ArrayList<>();

    EntityQuery() {}

    public EntityQuery with(ComponentTable<?>... tables) {
        with.addAll(Arrays.asList(tables));
        return this;
    }

    public EntityQuery without(ComponentTable<?>... tables) {
        without.addAll(Arrays.asList(tables));
        return this;
    }

    public int[] entities() {
        if (with.isEmpty()) {
            throw new IllegalStateException("query needs at least one required component");
        }
        ComponentTable<?> smallest = with.get(0);
        for (ComponentTable<?> t : with) {
            if (t.size() < smallest.size()) smallest = t;
        }
        int[] out = new int[smallest.size()];
        int n = 0;
        for (int row = 0; row < smallest.size(); row++) {
            int e = smallest.entityAt(row);
            if (matches(e)) out[n++] = e;
        }
        int[] result = Arrays.copyOf(out, n);
        Arrays.sort(result);
        return result;
    }

    public void forEach(IntConsumer action) {
        for (int e : entities()) {
            action.accept(e);
        }
    }

    public int count() {
        return entities().length;
    }

    private boolean matches(int entity) {
        for (ComponentTable<?> t : with) {
            if (!t.has(entity)) return false;
        }
        for (ComponentTable<?> t : without) {
            if (t.has(entity)) return false;
        }
        return true;
    }
}
