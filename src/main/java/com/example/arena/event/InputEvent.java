package com.example.arena.event;

/**
 * Something the input layer asks of a single entity.
 */
public interface InputEvent {
    int entityId();
}
