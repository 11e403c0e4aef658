package com.example.arena.world;

import com.example.arena.model.Behavior;
import com.example.arena.model.Damage;
import com.example.arena.model.Dash;
import com.example.arena.model.Facing;
import com.example.arena.model.GameTimer;
import com.example.arena.model.Health;
import com.example.arena.model.MoveTarget;
import com.example.arena.model.Position;
import com.example.arena.model.Projectile;
import com.example.arena.model.RangedAttack;
import com.example.arena.model.Shield;
import com.example.arena.model.ShowdownState;
import com.example.arena.model.Team;
import com.example.arena.model.Velocity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.List;

/**
 * Columnar entity-component store for one match.
 * <p>
 * Exposes exactly the component tables the simulation needs. Entity ids are
 * non-negative ints; destroyed ids are recycled first-in first-out. The match
 * clock and phase live on a sentinel entity created with the world.
 * <p>
 * Touching an entity that does not exist is a contract violation: in strict
 * mode it raises {@link EntityNotFoundException}, otherwise it is logged and
 * ignored.
 */
public class ArenaWorld {
    private static final Logger logger = LoggerFactory.getLogger(ArenaWorld.class);

    public static final int NO_ENTITY = -1;
    private static final int INITIAL_CAPACITY = 256;

    private final SparseSet entities = new SparseSet(INITIAL_CAPACITY);
    private final ArrayDeque<Integer> freeIds = new ArrayDeque<>();
    private int nextId = 0;
    private final boolean strictContracts;

    private final ComponentTable<Position> positions = new ComponentTable<>("Position", INITIAL_CAPACITY);
    private final ComponentTable<Velocity> velocities = new ComponentTable<>("Velocity", INITIAL_CAPACITY);
    private final ComponentTable<Facing> facings = new ComponentTable<>("Facing", INITIAL_CAPACITY);
    private final ComponentTable<Health> healths = new ComponentTable<>("Health", INITIAL_CAPACITY);
    private final ComponentTable<Team> teams = new ComponentTable<>("Team", INITIAL_CAPACITY);
    private final ComponentTable<Damage> damages = new ComponentTable<>("Damage", INITIAL_CAPACITY);
    private final ComponentTable<Dash> dashes = new ComponentTable<>("Dash", INITIAL_CAPACITY);
    private final ComponentTable<Shield> shields = new ComponentTable<>("Shield", INITIAL_CAPACITY);
    private final ComponentTable<RangedAttack> rangedAttacks = new ComponentTable<>("RangedAttack", INITIAL_CAPACITY);
    private final ComponentTable<Projectile> projectiles = new ComponentTable<>("Projectile", INITIAL_CAPACITY);
    private final ComponentTable<MoveTarget> moveTargets = new ComponentTable<>("MoveTarget", INITIAL_CAPACITY);
    private final ComponentTable<Behavior> behaviors = new ComponentTable<>("Behavior", INITIAL_CAPACITY);
    private final ComponentTable<GameTimer> gameTimers = new ComponentTable<>("GameTimer", 8);
    private final ComponentTable<ShowdownState> showdownStates = new ComponentTable<>("ShowdownState", 8);

    private final List<ComponentTable<?>> allTables = List.of(
        positions, velocities, facings, healths, teams, damages, dashes, shields,
        rangedAttacks, projectiles, moveTargets, behaviors, gameTimers, showdownStates);

    private final int matchEntity;
    private PositionListener positionListener;

    public ArenaWorld(double matchDuration, boolean strictContracts) {
        this.strictContracts = strictContracts;
        this.matchEntity = createEntity();
        gameTimers.put(matchEntity, new GameTimer(matchDuration));
        showdownStates.put(matchEntity, new ShowdownState());
    }

    // ========== Tables ==========

    public ComponentTable<Position> positions() { return positions; }
    public ComponentTable<Velocity> velocities() { return velocities; }
    public ComponentTable<Facing> facings() { return facings; }
    public ComponentTable<Health> healths() { return healths; }
    public ComponentTable<Team> teams() { return teams; }
    public ComponentTable<Damage> damages() { return damages; }
    public ComponentTable<Dash> dashes() { return dashes; }
    public ComponentTable<Shield> shields() { return shields; }
    public ComponentTable<RangedAttack> rangedAttacks() { return rangedAttacks; }
    public ComponentTable<Projectile> projectiles() { return projectiles; }
    public ComponentTable<MoveTarget> moveTargets() { return moveTargets; }
    public ComponentTable<Behavior> behaviors() { return behaviors; }

    // ========== Match singletons ==========

    public int getMatchEntity() { return matchEntity; }

    public GameTimer gameTimer() {
        return gameTimers.get(matchEntity);
    }

    public ShowdownState showdownState() {
        return showdownStates.get(matchEntity);
    }

    // ========== Entities ==========

    public int createEntity() {
        int id = freeIds.isEmpty() ? nextId++ : freeIds.pollFirst();
        entities.add(id);
        return id;
    }

    /**
     * Remove an entity and every component it owns. The id becomes reusable.
     */
    public void destroyEntity(int entity) {
        if (entity == matchEntity) {
            throw new IllegalArgumentException("the match sentinel entity cannot be destroyed");
        }
        if (!checkExists(entity, "destroyEntity")) return;
        for (ComponentTable<?> t : allTables) {
            t.remove(entity);
        }
        entities.remove(entity);
        freeIds.addLast(entity);
        if (positionListener != null) {
            positionListener.onDestroyed(entity);
        }
    }

    public boolean exists(int entity) {
        return entities.has(entity);
    }

    /**
     * Existing entity with {@code Health.current > 0}.
     */
    public boolean isAlive(int entity) {
        Health h = healths.get(entity);
        return h != null && h.isAlive();
    }

    public int entityCount() {
        return entities.size();
    }

    public EntityQuery query() {
        return new EntityQuery();
    }

    /**
     * Component lookup that enforces the entity contract.
     * @return the component, or null if the entity lacks it (or, in lenient mode, does not exist)
     */
    public <T> T get(ComponentTable<T> table, int entity) {
        if (!checkExists(entity, table.getName())) return null;
        return table.get(entity);
    }

    /**
     * Write a position and tell the spatial index.
     */
    public void move(int entity, double x, double y) {
        Position p = get(positions, entity);
        if (p == null) return;
        p.set(x, y);
        if (positionListener != null) {
            positionListener.onMoved(entity, x, y);
        }
    }

    public void setPositionListener(PositionListener listener) {
        this.positionListener = listener;
    }

    public boolean isStrictContracts() {
        return strictContracts;
    }

    /**
     * Drop every entity except the match sentinel. Used at match teardown.
     */
    public void clear() {
        for (int e : entities.toSortedArray()) {
            if (e != matchEntity) destroyEntity(e);
        }
        freeIds.clear();
    }

    private boolean checkExists(int entity, String context) {
        if (entities.has(entity)) return true;
        if (strictContracts) {
            throw new EntityNotFoundException(entity, context);
        }
        logger.warn("[ArenaWorld] access to missing entity {} ignored ({})", entity, context);
        return false;
    }
}
