package com.example.arena.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Reads {@link SimulationConfig} from a YAML document on the classpath.
 * Keys that are absent keep their default value.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "/config/arena.yaml";

    private ConfigLoader() {}

    /**
     * Resolve the resource path from {@code ARENA_CONFIG} or {@code -Darena.config},
     * falling back to {@link #DEFAULT_RESOURCE}.
     */
    public static SimulationConfig load() {
        String path = System.getenv("ARENA_CONFIG");
        if (path == null || path.isEmpty()) {
            path = System.getProperty("arena.config", DEFAULT_RESOURCE);
        }
        return loadFromYamlResource(path);
    }

    /**
     * Load a config resource. A missing resource yields the defaults.
     * @throws IllegalArgumentException if the document is malformed
     */
    public static SimulationConfig loadFromYamlResource(String resourcePath) {
        try (InputStream is = ConfigLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                logger.warn("[ConfigLoader] config resource not found: {}, using defaults", resourcePath);
                return SimulationConfig.defaults();
            }
            Yaml yaml = new Yaml();
            Object doc = yaml.load(is);
            SimulationConfig cfg = fromMap(asMap(doc, "<root>"));
            logger.info("[ConfigLoader] loaded {} from {}", cfg, resourcePath);
            return cfg;
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read config " + resourcePath, e);
        } catch (RuntimeException e) {
            if (e instanceof IllegalArgumentException) throw e;
            throw new IllegalArgumentException("Malformed config " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Build a config from an already-parsed YAML tree.
     */
    public static SimulationConfig fromMap(Map<String, Object> root) {
        SimulationConfig d = SimulationConfig.defaults();
        if (root == null) return d;

        Map<String, Object> phases = section(root, "phases");
        Map<String, Object> arena = section(root, "arena");
        Map<String, Object> combat = section(root, "combat");
        Map<String, Object> abilities = section(root, "abilities");
        Map<String, Object> dash = section(abilities, "dash");
        Map<String, Object> shield = section(abilities, "shield");
        Map<String, Object> ranged = section(abilities, "ranged");
        Map<String, Object> movement = section(root, "movement");
        Map<String, Object> spatial = section(root, "spatial");
        Map<String, Object> runtime = section(root, "simulation");

        return new SimulationConfig(
            new SimulationConfig.PhaseTimings(
                num(phases, "warning_at", d.phases.warningAt),
                num(phases, "collapse_at", d.phases.collapseAt),
                num(phases, "showdown_at", d.phases.showdownAt),
                num(phases, "match_end_at", d.phases.matchEndAt)),
            new SimulationConfig.ArenaSettings(
                num(arena, "width", d.arena.width),
                num(arena, "height", d.arena.height),
                num(arena, "center_x", d.arena.centerX),
                num(arena, "center_y", d.arena.centerY),
                num(arena, "teleport_radius", d.arena.teleportRadius)),
            new SimulationConfig.CombatSettings(
                num(combat, "base_damage", d.combat.baseDamage),
                num(combat, "base_range", d.combat.baseRange),
                num(combat, "base_attack_speed", d.combat.baseAttackSpeed),
                num(combat, "base_health", d.combat.baseHealth)),
            new SimulationConfig.DashSettings(
                num(dash, "max_cooldown", d.dash.maxCooldown),
                num(dash, "duration", d.dash.duration),
                num(dash, "distance", d.dash.distance),
                num(dash, "damage", d.dash.damage),
                num(dash, "contact_radius", d.dash.contactRadius)),
            new SimulationConfig.ShieldSettings(
                num(shield, "max_cooldown", d.shield.maxCooldown),
                num(shield, "duration", d.shield.duration),
                num(shield, "damage_reduction", d.shield.damageReduction)),
            new SimulationConfig.RangedSettings(
                num(ranged, "max_cooldown", d.ranged.maxCooldown),
                num(ranged, "duration", d.ranged.duration),
                num(ranged, "range", d.ranged.range),
                num(ranged, "damage", d.ranged.damage),
                num(ranged, "projectile_speed", d.ranged.projectileSpeed),
                num(ranged, "hit_radius", d.ranged.hitRadius)),
            new SimulationConfig.MovementSettings(
                num(movement, "speed", d.movement.speed),
                num(movement, "arrival_threshold", d.movement.arrivalThreshold)),
            new SimulationConfig.SpatialSettings(
                bool(spatial, "enabled", d.spatial.enabled),
                num(spatial, "cell_size", d.spatial.cellSize)),
            new SimulationConfig.RuntimeSettings(
                num(runtime, "tick_rate", d.runtime.tickRate),
                (long) num(runtime, "seed", d.runtime.seed),
                bool(runtime, "strict_contracts", d.runtime.strictContracts)));
    }

    private static Map<String, Object> section(Map<String, Object> parent, String key) {
        if (parent == null) return null;
        Object v = parent.get(key);
        if (v == null) return null;
        return asMap(v, key);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object v, String key) {
        if (v == null) return null;
        if (!(v instanceof Map)) {
            throw new IllegalArgumentException("config key '" + key + "' must be a mapping");
        }
        return (Map<String, Object>) v;
    }

    private static double num(Map<String, Object> m, String key, double def) {
        if (m == null) return def;
        Object v = m.get(key);
        if (v == null) return def;
        if (v instanceof Number number) return number.doubleValue();
        try {
            return Double.parseDouble(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("config key '" + key + "' must be a number, got '" + v + "'");
        }
    }

    private static boolean bool(Map<String, Object> m, String key, boolean def) {
        if (m == null) return def;
        Object v = m.get(key);
        if (v == null) return def;
        if (v instanceof Boolean b) return b;
        String s = v.toString().trim().toLowerCase();
        if (s.equals("true") || s.equals("yes") || s.equals("1")) return true;
        if (s.equals("false") || s.equals("no") || s.equals("0")) return false;
        throw new IllegalArgumentException("config key '" + key + "' must be a boolean, got '" + v + "'");
    }
}
