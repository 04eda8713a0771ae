package com.controls.cdl.util;

import com.controls.cdl.api.EvaluationListener;
import com.controls.cdl.model.InstancePath;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Aggregates evaluation time per instance to find the expensive ones. */
public class InstanceProfileListener implements EvaluationListener {

    public static class InstanceStats {
        public final InstancePath instance;
        public long count;
        public long errors;
        public long totalDurationNanos;
        public long minDurationNanos = Long.MAX_VALUE;
        public long maxDurationNanos = Long.MIN_VALUE;
        public long lastDurationNanos;

        public InstanceStats(InstancePath instance) {
            this.instance = instance;
        }

        void update(long duration) {
            count++;
            totalDurationNanos += duration;
            lastDurationNanos = duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        public double avgMicros() {
            return count == 0 ? 0 : totalDurationNanos / (double) count / 1000.0;
        }
    }

    // Keyed by path: nested contexts restart order indices at zero.
    private final Map<InstancePath, InstanceStats> stats = new LinkedHashMap<>();
    private long completedSteps;
    private long failedSteps;

    /** Stats of one instance, or null if it was never evaluated. */
    public synchronized InstanceStats stats(InstancePath instance) {
        return stats.get(instance);
    }

    public synchronized List<InstanceStats> all() {
        return new ArrayList<>(stats.values());
    }

    public synchronized long completedSteps() {
        return completedSteps;
    }

    public synchronized long failedSteps() {
        return failedSteps;
    }

    @Override
    public void onStepStart(InstancePath context, long step) {
        // No-op
    }

    @Override
    public synchronized void onInstanceEvaluated(long step, int orderIndex, InstancePath instance,
            long durationNanos) {
        stats.computeIfAbsent(instance, InstanceStats::new).update(durationNanos);
    }

    @Override
    public synchronized void onInstanceError(long step, int orderIndex, InstancePath instance, Throwable error) {
        stats.computeIfAbsent(instance, InstanceStats::new).errors++;
    }

    @Override
    public synchronized void onStepEnd(InstancePath context, long step, int evaluated, boolean completed) {
        // Count root steps only
        if (!context.isRoot())
            return;
        if (completed)
            completedSteps++;
        else
            failedSteps++;
    }

    /** Resets all collected statistics. */
    public synchronized void reset() {
        stats.clear();
        completedSteps = 0;
        failedSteps = 0;
    }

    /** Returns a formatted table of instance statistics, most expensive first. */
    public synchronized String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-40s | %10s | %6s | %10s | %10s | %10s | %10s%n", "Instance", "Count", "Errors",
                "Recent(us)", "Avg (us)", "Min (us)", "Max (us)"));
        sb.append("-".repeat(118)).append('\n');

        List<InstanceStats> sorted = new ArrayList<>();
        for (InstanceStats s : stats.values())
            if (s.count > 0)
                sorted.add(s);
        sorted.sort((s1, s2) -> Long.compare(s2.totalDurationNanos, s1.totalDurationNanos));

        for (InstanceStats s : sorted) {
            sb.append(String.format("%-40s | %10d | %6d | %10.2f | %10.2f | %10.2f | %10.2f%n",
                    truncate(s.instance.toString(), 40),
                    s.count,
                    s.errors,
                    s.lastDurationNanos / 1000.0,
                    s.avgMicros(),
                    s.minDurationNanos / 1000.0,
                    s.maxDurationNanos / 1000.0));
        }
        return sb.toString();
    }

    private String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return "..." + s.substring(s.length() - len + 3);
    }
}
