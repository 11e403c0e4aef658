package com.example.arena.event;

import com.example.arena.model.AbilityKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Ordered queue of input events waiting for the next tick. The input layer may
 * submit from its own thread while the tick thread drains; each event is handed
 * out by exactly one drain.
 */
public class InputQueue {
    private final Queue<InputEvent> pending = new ConcurrentLinkedQueue<>();

    public void submit(InputEvent event) {
        if (event == null) return;
        pending.offer(event);
    }

    public void activate(int entityId, AbilityKind kind) {
        submit(new AbilityActivation(entityId, kind));
    }

    public void moveTo(int entityId, double x, double y) {
        submit(new MoveCommand(entityId, x, y));
    }

    /** Remove and return everything queued, in submission order. */
    public List<InputEvent> drain() {
        List<InputEvent> out = new ArrayList<>();
        InputEvent next;
        while ((next = pending.poll()) != null) {
            out.add(next);
        }
        return out;
    }

    /** Approximate while other threads are submitting. */
    public int size() {
        return pending.size();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }
}
