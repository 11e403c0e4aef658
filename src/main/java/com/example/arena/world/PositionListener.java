package com.example.arena.world;

/**
 * Observer of position writes and entity removal; the spatial index registers one.
 */
public interface PositionListener {

    void onMoved(int entity, double x, double y);

    void onDestroyed(int entity);
}
