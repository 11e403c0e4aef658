package com.example.arena.event;

/**
 * An entity removed by the cleanup pass because its health reached zero.
 */
public record DeathEvent(int entityId, int teamId, double x, double y) {
}
