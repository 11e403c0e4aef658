package com.example.arena.combat;

/**
 * Adjusts damage about to be applied to a target. Modifiers run in
 * registration order; each sees the previous one's output.
 */
@FunctionalInterface
public interface DefenseModifier {

    double modify(int target, double amount);
}
