package com.example.arena;

import com.example.arena.model.Health;
import com.example.arena.model.Position;
import com.example.arena.model.Team;
import com.example.arena.world.ArenaWorld;
import com.example.arena.world.ComponentTable;
import com.example.arena.world.EntityNotFoundException;
import com.example.arena.world.SparseSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the entity-component store: sparse sets, component tables,
 * membership queries and the entity lifecycle.
 */
@DisplayName("Component store")
public class ComponentStoreTest {

    // ========== SparseSet ==========

    @Test
    @DisplayName("SparseSet add/remove keeps the dense array packed")
    void sparseSetSwapAndPop() {
        SparseSet set = new SparseSet(4);
        set.add(3);
        set.add(7);
        set.add(1);
        assertEquals(3, set.size());

        set.remove(3);
        assertFalse(set.has(3));
        assertTrue(set.has(7));
        assertTrue(set.has(1));
        assertEquals(2, set.size());
        assertEquals(-1, set.getDenseIndex(3));
        assertArrayEquals(new int[]{1, 7}, set.toSortedArray());
    }

    @Test
    @DisplayName("SparseSet grows for large ids and ignores duplicates")
    void sparseSetGrows() {
        SparseSet set = new SparseSet(8);
        set.add(1000);
        assertEquals(0, set.add(1000));
        assertTrue(set.has(1000));
        assertFalse(set.has(999));
        assertFalse(set.has(-1));
        assertEquals(1, set.size());
        assertThrows(IllegalArgumentException.class, () -> set.add(-5));
    }

    // ========== ComponentTable ==========

    @Test
    @DisplayName("ComponentTable keeps values attached to their entity after removals")
    void componentTableRemoveSwapsLastRow() {
        ComponentTable<String> table = new ComponentTable<>("Name", 2);
        table.put(1, "one");
        table.put(2, "two");
        table.put(3, "three");

        assertEquals("one", table.remove(1));
        assertNull(table.get(1));
        assertEquals("two", table.get(2));
        assertEquals("three", table.get(3));
        assertEquals(2, table.size());
        assertNull(table.remove(1));
    }

    @Test
    @DisplayName("ComponentTable rejects null values and replaces existing ones")
    void componentTablePut() {
        ComponentTable<String> table = new ComponentTable<>("Name", 8);
        assertThrows(IllegalArgumentException.class, () -> table.put(1, null));
        table.put(1, "a");
        table.put(1, "b");
        assertEquals("b", table.get(1));
        assertEquals(1, table.size());
    }

    // ========== Queries ==========

    @Test
    @DisplayName("Queries return members in ascending id order")
    void queryOrderAndFilters() {
        ArenaWorld world = new ArenaWorld(150, true);
        int a = world.createEntity();
        int b = world.createEntity();
        int c = world.createEntity();
        // insert out of order so row order differs from id order
        world.healths().put(c, new Health(10));
        world.healths().put(a, new Health(10));
        world.healths().put(b, new Health(10));
        world.teams().put(c, new Team(0));
        world.teams().put(a, new Team(1));
        world.positions().put(b, new Position(0, 0));

        assertArrayEquals(new int[]{a, b, c}, world.query().with(world.healths()).entities());
        assertArrayEquals(new int[]{a, c}, world.query().with(world.healths(), world.teams()).entities());
        assertArrayEquals(new int[]{a, c},
            world.query().with(world.healths()).without(world.positions()).entities());
        assertEquals(1, world.query().with(world.positions()).count());
    }

    @Test
    @DisplayName("A query without required components is a programming error")
    void emptyQueryRejected() {
        ArenaWorld world = new ArenaWorld(150, true);
        assertThrows(IllegalStateException.class, () -> world.query().entities());
    }

    // ========== Entity lifecycle ==========

    @Test
    @DisplayName("Destroyed ids are recycled first-in first-out")
    void idRecycling() {
        ArenaWorld world = new ArenaWorld(150, true);
        int a = world.createEntity();
        int b = world.createEntity();
        world.destroyEntity(b);
        world.destroyEntity(a);
        assertEquals(b, world.createEntity());
        assertEquals(a, world.createEntity());
    }

    @Test
    @DisplayName("Destroying an entity strips every component")
    void destroyRemovesComponents() {
        ArenaWorld world = new ArenaWorld(150, true);
        int e = world.createEntity();
        world.positions().put(e, new Position(1, 2));
        world.healths().put(e, new Health(50));
        world.destroyEntity(e);

        assertFalse(world.exists(e));
        assertFalse(world.positions().has(e));
        assertFalse(world.healths().has(e));
        assertFalse(world.isAlive(e));
    }

    @Test
    @DisplayName("The match sentinel holds the clock and cannot be destroyed")
    void sentinel() {
        ArenaWorld world = new ArenaWorld(150, true);
        assertEquals(0, world.getMatchEntity());
        assertEquals(150, world.gameTimer().getMatchDuration(), 1e-9);
        assertNotNull(world.showdownState());
        assertThrows(IllegalArgumentException.class, () -> world.destroyEntity(world.getMatchEntity()));
    }

    @Test
    @DisplayName("Strict mode fails fast on missing entities")
    void strictContracts() {
        ArenaWorld world = new ArenaWorld(150, true);
        int e = world.createEntity();
        world.destroyEntity(e);

        EntityNotFoundException ex = assertThrows(EntityNotFoundException.class,
            () -> world.get(world.healths(), e));
        assertEquals(e, ex.getEntity());
        assertThrows(EntityNotFoundException.class, () -> world.move(e, 1, 1));
        assertThrows(EntityNotFoundException.class, () -> world.destroyEntity(e));
    }

    @Test
    @DisplayName("Lenient mode turns missing-entity access into a no-op")
    void lenientContracts() {
        ArenaWorld world = new ArenaWorld(150, false);
        assertNull(world.get(world.healths(), 42));
        assertDoesNotThrow(() -> world.move(42, 1, 1));
        assertDoesNotThrow(() -> world.destroyEntity(42));
        assertFalse(world.exists(42));
    }

    @Test
    @DisplayName("clear() drops everything except the sentinel")
    void clearKeepsSentinel() {
        ArenaWorld world = new ArenaWorld(150, true);
        for (int i = 0; i < 5; i++) {
            int e = world.createEntity();
            world.healths().put(e, new Health(10));
        }
        world.clear();
        assertEquals(1, world.entityCount());
        assertEquals(0, world.healths().size());
        assertNotNull(world.gameTimer());
    }
}
