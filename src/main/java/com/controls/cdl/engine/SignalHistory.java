package com.controls.cdl.engine;

import com.controls.cdl.model.SignalKey;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Bounded per-signal record of written values, oldest first. */
final class SignalHistory {
    private final int limit;
    private final Map<SignalKey, Deque<SignalSample>> samples = new HashMap<>();

    SignalHistory(int limit) {
        this.limit = limit;
    }

    void record(SignalKey key, long step, Object value) {
        Deque<SignalSample> d = samples.computeIfAbsent(key, k -> new ArrayDeque<>());
        if (d.size() == limit)
            d.removeFirst();
        d.addLast(new SignalSample(step, value));
    }

    List<SignalSample> of(SignalKey key) {
        Deque<SignalSample> d = samples.get(key);
        return d == null ? List.of() : List.copyOf(d);
    }

    void clear() {
        samples.clear();
    }
}
