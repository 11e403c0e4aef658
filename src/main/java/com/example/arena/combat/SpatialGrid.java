package com.example.arena.combat;

import com.example.arena.model.Position;
import com.example.arena.world.ArenaWorld;
import com.example.arena.world.PositionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Uniform grid over targetable entities (those with Position, Health and Team).
 * <p>
 * Kept current through {@link PositionListener} callbacks from the world, and
 * reconciled against the store once per tick by {@link #sync()}. Components
 * attached or detached without a callback are caught before the next query by
 * {@link #reconcileMembership()}. Any mismatch is logged and repaired.
 */
public class SpatialGrid implements PositionListener {
    private static final Logger logger = LoggerFactory.getLogger(SpatialGrid.class);

    private final ArenaWorld world;
    private final double cellSize;
    private final Map<Long, List<Integer>> cells = new HashMap<>();
    private final Map<Integer, Long> cellByEntity = new HashMap<>();
    private long repairs = 0;
    private long membershipStamp = -1;

    public SpatialGrid(ArenaWorld world, double cellSize) {
        if (!(cellSize > 0)) throw new IllegalArgumentException("cellSize must be > 0");
        this.world = world;
        this.cellSize = cellSize;
    }

    public double getCellSize() { return cellSize; }

    public int size() { return cellByEntity.size(); }

    public boolean contains(int entity) { return cellByEntity.containsKey(entity); }

    /** Total desyncs repaired since creation. */
    public long getRepairCount() { return repairs; }

    // ========== Maintenance ==========

    public void insert(int entity, double x, double y) {
        long key = cellKey(x, y);
        Long old = cellByEntity.put(entity, key);
        if (old != null) {
            if (old == key) return;
            removeFromCell(old, entity);
        }
        cells.computeIfAbsent(key, k -> new ArrayList<>()).add(entity);
    }

    public void remove(int entity) {
        Long key = cellByEntity.remove(entity);
        if (key != null) removeFromCell(key, entity);
    }

    @Override
    public void onMoved(int entity, double x, double y) {
        if (contains(entity) || isTargetable(entity)) {
            insert(entity, x, y);
        }
    }

    @Override
    public void onDestroyed(int entity) {
        remove(entity);
    }

    /**
     * Reconcile with the store: drop ids that are gone, insert targetable
     * entities that are missing, and move any entity whose recorded cell no
     * longer matches its position.
     *
     * @return number of entries repaired
     */
    public int sync() {
        int fixed = 0;
        Iterator<Map.Entry<Integer, Long>> it = cellByEntity.entrySet().iterator();
        List<Integer> stale = new ArrayList<>();
        while (it.hasNext()) {
            int e = it.next().getKey();
            if (!isTargetable(e)) stale.add(e);
        }
        for (int e : stale) {
            logger.warn("[SpatialGrid] desync: entity {} indexed but no longer targetable, removing", e);
            remove(e);
            fixed++;
        }
        int[] targetable = world.query()
            .with(world.positions(), world.healths(), world.teams())
            .entities();
        for (int e : targetable) {
            Position p = world.positions().get(e);
            Long recorded = cellByEntity.get(e);
            long actual = cellKey(p.getX(), p.getY());
            if (recorded == null) {
                logger.warn("[SpatialGrid] desync: targetable entity {} was never indexed, inserting at {}", e, p);
                insert(e, p.getX(), p.getY());
                fixed++;
            } else if (recorded != actual) {
                logger.warn("[SpatialGrid] desync: entity {} recorded in stale cell, reinserting at {}", e, p);
                insert(e, p.getX(), p.getY());
                fixed++;
            }
        }
        repairs += fixed;
        membershipStamp = currentStamp();
        return fixed;
    }

    /**
     * Cheap pre-query guard. When no position, health or team component has
     * been attached or detached since the last reconcile this does nothing;
     * otherwise indexed ids are checked against the targetable set and any
     * entity missing from the grid is inserted.
     *
     * @return number of entries repaired
     */
    public int reconcileMembership() {
        long stamp = currentStamp();
        if (stamp == membershipStamp) return 0;
        int fixed = 0;
        List<Integer> stale = new ArrayList<>();
        for (int e : cellByEntity.keySet()) {
            if (!isTargetable(e)) stale.add(e);
        }
        for (int e : stale) {
            logger.warn("[SpatialGrid] desync: entity {} indexed but no longer targetable, removing", e);
            remove(e);
            fixed++;
        }
        int[] targetable = world.query()
            .with(world.positions(), world.healths(), world.teams())
            .entities();
        for (int e : targetable) {
            if (contains(e)) continue;
            Position p = world.positions().get(e);
            logger.warn("[SpatialGrid] desync: targetable entity {} was never indexed, inserting at {}", e, p);
            insert(e, p.getX(), p.getY());
            fixed++;
        }
        repairs += fixed;
        membershipStamp = stamp;
        return fixed;
    }

    // ========== Queries ==========

    /**
     * Ids recorded in cells overlapping the square around (x, y) of half-size
     * {@code radius}. An infinite radius returns every indexed id. Callers
     * must still check distance and liveness.
     */
    public List<Integer> candidates(double x, double y, double radius) {
        if (Double.isInfinite(radius) || radius * 2 / cellSize > 4096) {
            return new ArrayList<>(cellByEntity.keySet());
        }
        int minCx = cellCoord(x - radius);
        int maxCx = cellCoord(x + radius);
        int minCy = cellCoord(y - radius);
        int maxCy = cellCoord(y + radius);
        List<Integer> out = new ArrayList<>();
        for (int cx = minCx; cx <= maxCx; cx++) {
            for (int cy = minCy; cy <= maxCy; cy++) {
                List<Integer> bucket = cells.get(pack(cx, cy));
                if (bucket != null) out.addAll(bucket);
            }
        }
        return out;
    }

    /**
     * Called when a query turns up an id the store disagrees with.
     * @return true if the entity is still valid (after any repair)
     */
    boolean verify(int entity) {
        if (!isTargetable(entity)) {
            logger.warn("[SpatialGrid] desync: query returned entity {} missing from the store, removing", entity);
            remove(entity);
            repairs++;
            return false;
        }
        Position p = world.positions().get(entity);
        long actual = cellKey(p.getX(), p.getY());
        Long recorded = cellByEntity.get(entity);
        if (recorded == null || recorded != actual) {
            logger.warn("[SpatialGrid] desync: entity {} found in stale cell, reinserting at {}", entity, p);
            insert(entity, p.getX(), p.getY());
            repairs++;
        }
        return true;
    }

    public void clear() {
        cells.clear();
        cellByEntity.clear();
        membershipStamp = -1;
    }

    // ========== Helpers ==========

    private long currentStamp() {
        return world.positions().getModCount()
            + world.healths().getModCount()
            + world.teams().getModCount();
    }

    private boolean isTargetable(int entity) {
        return world.exists(entity)
            && world.positions().has(entity)
            && world.healths().has(entity)
            && world.teams().has(entity);
    }

    private void removeFromCell(long key, int entity) {
        List<Integer> bucket = cells.get(key);
        if (bucket == null) return;
        bucket.remove(Integer.valueOf(entity));
        if (bucket.isEmpty()) cells.remove(key);
    }

    private int cellCoord(double v) {
        return (int) Math.floor(v / cellSize);
    }

    private long cellKey(double x, double y) {
        return pack(cellCoord(x), cellCoord(y));
    }

    private static long pack(int cx, int cy) {
        return ((long) cx << 32) | (cy & 0xffffffffL);
    }
}
