package com.mycelium.resilience.util;

import com.mycelium.resilience.api.EdgeKey;
import com.mycelium.resilience.api.ResilienceListener;
import com.mycelium.resilience.engine.FlowReport;
import com.mycelium.resilience.engine.RepairReport;

/**
 * Tracks repair latency and growth activity.
 *
 * Captures:
 * - Latency: min, max and average wall time per repair invocation.
 * - Workload: total damaged nodes, grown edges and budget exhaustions.
 * - Flow: number of distributions and total delivered quantity.
 */
public final class RepairLatencyListener implements ResilienceListener {
    private static final org.apache.logging.log4j.Logger log = org.apache.logging.log4j.LogManager
            .getLogger(RepairLatencyListener.class);

    private long totalRepairs, totalLatencyNanos, lastLatencyNanos;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;
    private long damagedNodes, grownEdges, exhaustedRepairs;
    private long flowRuns;
    private double delivered;

    @Override
    public void onNodeDamaged(String nodeId, int edgesDamaged) {
        damagedNodes++;
    }

    @Override
    public void onEdgeGrown(EdgeKey edge, double baseCost) {
        grownEdges++;
    }

    @Override
    public void onRepairEnd(RepairReport report) {
        lastLatencyNanos = report.elapsedNanos();
        totalRepairs++;
        totalLatencyNanos += lastLatencyNanos;
        if (lastLatencyNanos < minLatencyNanos)
            minLatencyNanos = lastLatencyNanos;
        if (lastLatencyNanos > maxLatencyNanos)
            maxLatencyNanos = lastLatencyNanos;
        if (report.budgetExhausted()) {
            exhaustedRepairs++;
            log.debug("Repair #{} ended with exhausted growth budget", totalRepairs);
        }
    }

    @Override
    public void onFlowRound(int round, double roundFlow) {
        // Per-round detail is not tracked
    }

    @Override
    public void onFlowEnd(FlowReport report) {
        flowRuns++;
        delivered += report.delivered();
    }

    public long lastLatencyNanos() {
        return lastLatencyNanos;
    }

    public long totalRepairs() {
        return totalRepairs;
    }

    public double avgLatencyNanos() {
        return totalRepairs > 0 ? (double) totalLatencyNanos / totalRepairs : 0;
    }

    public double avgLatencyMicros() {
        return avgLatencyNanos() / 1000.0;
    }

    public long minLatencyNanos() {
        return minLatencyNanos == Long.MAX_VALUE ? 0 : minLatencyNanos;
    }

    public long maxLatencyNanos() {
        return maxLatencyNanos == Long.MIN_VALUE ? 0 : maxLatencyNanos;
    }

    public long damagedNodes() {
        return damagedNodes;
    }

    public long grownEdges() {
        return grownEdges;
    }

    public long exhaustedRepairs() {
        return exhaustedRepairs;
    }

    public long flowRuns() {
        return flowRuns;
    }

    public double totalDelivered() {
        return delivered;
    }

    public void reset() {
        totalRepairs = 0;
        totalLatencyNanos = 0;
        lastLatencyNanos = 0;
        minLatencyNanos = Long.MAX_VALUE;
        maxLatencyNanos = Long.MIN_VALUE;
        damagedNodes = 0;
        grownEdges = 0;
        exhaustedRepairs = 0;
        flowRuns = 0;
        delivered = 0;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-20s | %10s | %10s | %10s | %10s\n", "Metric", "Value", "Avg (us)", "Min (us)",
                "Max (us)"));
        sb.append("------------------------------------------------------------------------------------------\n");
        sb.append(String.format("%-20s | %10d | %10.2f | %10.2f | %10.2f\n",
                "Total Repairs",
                totalRepairs,
                avgLatencyMicros(),
                minLatencyNanos() / 1000.0,
                maxLatencyNanos() / 1000.0));
        sb.append(String.format("%-20s | %10d |\n", "Damaged Nodes", damagedNodes));
        sb.append(String.format("%-20s | %10d |\n", "Grown Edges", grownEdges));
        sb.append(String.format("%-20s | %10d |\n", "Budget Exhausted", exhaustedRepairs));
        sb.append(String.format("%-20s | %10d |\n", "Flow Runs", flowRuns));
        return sb.toString();
    }
}
