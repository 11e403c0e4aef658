package com.example.arena.event;

/**
 * Order an entity to walk to a point. Ignored once the showdown starts.
 */
public record MoveCommand(int entityId, double x, double y) implements InputEvent {
}
