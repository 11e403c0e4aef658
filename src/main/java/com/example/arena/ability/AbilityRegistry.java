package com.example.arena.ability;

import com.example.arena.model.AbilityKind;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Ability handlers by kind.
 */
public class AbilityRegistry {
    private final Map<AbilityKind, AbilityHandler> handlers = new EnumMap<>(AbilityKind.class);

    /** Registry with the Dash, Shield and Ranged-Attack handlers. */
    public static AbilityRegistry standard() {
        AbilityRegistry registry = new AbilityRegistry();
        registry.register(new DashHandler());
        registry.register(new ShieldHandler());
        registry.register(new RangedAttackHandler());
        return registry;
    }

    public void register(AbilityHandler handler) {
        if (handler == null) return;
        handlers.put(handler.kind(), handler);
    }

    public AbilityHandler get(AbilityKind kind) {
        return kind == null ? null : handlers.get(kind);
    }

    /** Handlers in {@link AbilityKind} declaration order. */
    public Collection<AbilityHandler> all() {
        return Collections.unmodifiableCollection(handlers.values());
    }
}
