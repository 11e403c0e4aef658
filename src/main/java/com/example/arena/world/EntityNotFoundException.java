package com.example.arena.world;

/**
 * Raised in strict mode when code touches an entity id that does not exist
 * (never created, or already destroyed).
 */
public class EntityNotFoundException extends IllegalStateException {

    private final int entity;

    public EntityNotFoundException(int entity, String context) {
        super("Entity " + entity + " does not exist (" + context + ")");
        this.entity = entity;
    }

    public int getEntity() {
        return entity;
    }
}
