package com.example.arena.combat;

import com.example.arena.model.Position;
import com.example.arena.world.ArenaWorld;

/**
 * Nearest-enemy lookup used by auto-attacks, projectiles and auto-battle steering.
 */
public interface ProximityQuery {

    /**
     * Nearest living entity not on {@code team} within {@code maxRadius} of (x, y).
     * Equal distances resolve to the lowest entity id.
     *
     * @return the entity id, or {@link ArenaWorld#NO_ENTITY}
     */
    int findNearestEnemy(double x, double y, int team, double maxRadius);

    default int findNearestEnemy(Position position, int team, double maxRadius) {
        return findNearestEnemy(position.getX(), position.getY(), team, maxRadius);
    }
}
