package com.example.arena.config;

/**
 * Tunable constants for a match. Immutable; start from {@link #defaults()} and
 * replace sections with the {@code with*} methods, or load from YAML through
 * {@link ConfigLoader}.
 */
public class SimulationConfig {

    /** Match timeline thresholds, in seconds of match time. */
    public static class PhaseTimings {
        public final double warningAt;
        public final double collapseAt;
        public final double showdownAt;
        /** Deadline after which a showdown ends no matter who is standing. */
        public final double matchEndAt;

        public PhaseTimings(double warningAt, double collapseAt, double showdownAt, double matchEndAt) {
            if (warningAt < 0 || warningAt > collapseAt || collapseAt > showdownAt || showdownAt > matchEndAt) {
                throw new IllegalArgumentException(String.format(
                    "phase thresholds must satisfy 0 <= warning <= collapse <= showdown <= match_end, got %s/%s/%s/%s",
                    warningAt, collapseAt, showdownAt, matchEndAt));
            }
            this.warningAt = warningAt;
            this.collapseAt = collapseAt;
            this.showdownAt = showdownAt;
            this.matchEndAt = matchEndAt;
        }
    }

    /** Arena bounds and the showdown gathering point. */
    public static class ArenaSettings {
        public final double width;
        public final double height;
        public final double centerX;
        public final double centerY;
        public final double teleportRadius;

        public ArenaSettings(double width, double height, double centerX, double centerY, double teleportRadius) {
            if (teleportRadius < 0) throw new IllegalArgumentException("arena.teleport_radius must be >= 0");
            this.width = width;
            this.height = height;
            this.centerX = centerX;
            this.centerY = centerY;
            this.teleportRadius = teleportRadius;
        }
    }

    /** Baseline stats for spawned units. */
    public static class CombatSettings {
        public final double baseDamage;
        public final double baseRange;
        public final double baseAttackSpeed;
        public final double baseHealth;

        public CombatSettings(double baseDamage, double baseRange, double baseAttackSpeed, double baseHealth) {
            if (!(baseAttackSpeed > 0)) throw new IllegalArgumentException("combat.base_attack_speed must be > 0");
            if (!(baseHealth > 0)) throw new IllegalArgumentException("combat.base_health must be > 0");
            this.baseDamage = baseDamage;
            this.baseRange = baseRange;
            this.baseAttackSpeed = baseAttackSpeed;
            this.baseHealth = baseHealth;
        }
    }

    public static class DashSettings {
        public final double maxCooldown;
        public final double duration;
        public final double distance;
        public final double damage;
        public final double contactRadius;

        public DashSettings(double maxCooldown, double duration, double distance, double damage, double contactRadius) {
            this.maxCooldown = maxCooldown;
            this.duration = duration;
            this.distance = distance;
            this.damage = damage;
            this.contactRadius = contactRadius;
        }
    }

    public static class ShieldSettings {
        public final double maxCooldown;
        public final double duration;
        /** Fraction of incoming damage absorbed while active; 0 disables the reduction. */
        public final double damageReduction;

        public ShieldSettings(double maxCooldown, double duration, double damageReduction) {
            this.maxCooldown = maxCooldown;
            this.duration = duration;
            this.damageReduction = damageReduction;
        }
    }

    public static class RangedSettings {
        public final double maxCooldown;
        public final double duration;
        public final double range;
        public final double damage;
        public final double projectileSpeed;
        public final double hitRadius;

        public RangedSettings(double maxCooldown, double duration, double range, double damage,
                              double projectileSpeed, double hitRadius) {
            this.maxCooldown = maxCooldown;
            this.duration = duration;
            this.range = range;
            this.damage = damage;
            this.projectileSpeed = projectileSpeed;
            this.hitRadius = hitRadius;
        }
    }

    public static class MovementSettings {
        public final double speed;
        public final double arrivalThreshold;

        public MovementSettings(double speed, double arrivalThreshold) {
            if (speed < 0) throw new IllegalArgumentException("movement.speed must be >= 0");
            this.speed = speed;
            this.arrivalThreshold = arrivalThreshold;
        }
    }

    public static class SpatialSettings {
        public final boolean enabled;
        public final double cellSize;

        public SpatialSettings(boolean enabled, double cellSize) {
            if (!(cellSize > 0)) throw new IllegalArgumentException("spatial.cell_size must be > 0");
            this.enabled = enabled;
            this.cellSize = cellSize;
        }
    }

    public static class RuntimeSettings {
        public final double tickRate;
        public final long seed;
        public final boolean strictContracts;

        public RuntimeSettings(double tickRate, long seed, boolean strictContracts) {
            if (!(tickRate > 0)) throw new IllegalArgumentException("simulation.tick_rate must be > 0");
            this.tickRate = tickRate;
            this.seed = seed;
            this.strictContracts = strictContracts;
        }

        public double fixedDeltaSeconds() {
            return 1.0 / tickRate;
        }
    }

    public final PhaseTimings phases;
    public final ArenaSettings arena;
    public final CombatSettings combat;
    public final DashSettings dash;
    public final ShieldSettings shield;
    public final RangedSettings ranged;
    public final MovementSettings movement;
    public final SpatialSettings spatial;
    public final RuntimeSettings runtime;

    public SimulationConfig(PhaseTimings phases, ArenaSettings arena, CombatSettings combat,
                            DashSettings dash, ShieldSettings shield, RangedSettings ranged,
                            MovementSettings movement, SpatialSettings spatial, RuntimeSettings runtime) {
        this.phases = phases;
        this.arena = arena;
        this.combat = combat;
        this.dash = dash;
        this.shield = shield;
        this.ranged = ranged;
        this.movement = movement;
        this.spatial = spatial;
        this.runtime = runtime;
    }

    public static SimulationConfig defaults() {
        return new SimulationConfig(
            new PhaseTimings(120, 135, 150, 180),
            new ArenaSettings(1920, 1080, 960, 540, 200),
            new CombatSettings(10, 100, 1.0, 100),
            new DashSettings(10, 0.5, 150, 30, 20),
            new ShieldSettings(15, 3, 0.5),
            new RangedSettings(8, 2, 300, 40, 300, 15),
            new MovementSettings(100, 5),
            new SpatialSettings(true, 128),
            new RuntimeSettings(60, 42L, false));
    }

    /** Configured match duration: the moment the showdown begins. */
    public double matchDuration() {
        return phases.showdownAt;
    }

    public SimulationConfig withPhases(PhaseTimings p) {
        return new SimulationConfig(p, arena, combat, dash, shield, ranged, movement, spatial, runtime);
    }

    public SimulationConfig withArena(ArenaSettings a) {
        return new SimulationConfig(phases, a, combat, dash, shield, ranged, movement, spatial, runtime);
    }

    public SimulationConfig withCombat(CombatSettings c) {
        return new SimulationConfig(phases, arena, c, dash, shield, ranged, movement, spatial, runtime);
    }

    public SimulationConfig withDash(DashSettings d) {
        return new SimulationConfig(phases, arena, combat, d, shield, ranged, movement, spatial, runtime);
    }

    public SimulationConfig withShield(ShieldSettings s) {
        return new SimulationConfig(phases, arena, combat, dash, s, ranged, movement, spatial, runtime);
    }

    public SimulationConfig withRanged(RangedSettings r) {
        return new SimulationConfig(phases, arena, combat, dash, shield, r, movement, spatial, runtime);
    }

    public SimulationConfig withMovement(MovementSettings m) {
        return new SimulationConfig(phases, arena, combat, dash, shield, ranged, m, spatial, runtime);
    }

    public SimulationConfig withSpatial(SpatialSettings s) {
        return new SimulationConfig(phases, arena, combat, dash, shield, ranged, movement, s, runtime);
    }

    public SimulationConfig withRuntime(RuntimeSettings r) {
        return new SimulationConfig(phases, arena, combat, dash, shield, ranged, movement, spatial, r);
    }

    @Override
    public String toString() {
        return String.format("SimulationConfig{phases=%s/%s/%s/%s, center=(%s,%s) r=%s, tickRate=%s, seed=%d, strict=%s}",
            phases.warningAt, phases.collapseAt, phases.showdownAt, phases.matchEndAt,
            arena.centerX, arena.centerY, arena.teleportRadius,
            runtime.tickRate, runtime.seed, runtime.strictContracts);
    }
}
