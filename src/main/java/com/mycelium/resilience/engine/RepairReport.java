package com.mycelium.resilience.engine;

import com.mycelium.resilience.api.EdgeKey;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one damage-and-repair invocation.
 *
 * @param damagedNodes             Nodes that went from healthy to damaged in
 *                                 this invocation.
 * @param edgesDamaged             Incident edges that went from healthy to
 *                                 damaged.
 * @param grownEdges               Edges created (or regrown) by the repair, in
 *                                 growth order.
 * @param reconnectedPairs         Formerly connected node pairs that are
 *                                 connected again after repair.
 * @param unreconnectedPairs       Formerly connected node pairs that stay
 *                                 disconnected (budget or topology).
 * @param componentsBeforeDamage   Healthy component count before damage.
 * @param componentsAfterDamage    Healthy component count right after damage.
 * @param componentsAfterRepair    Healthy component count after repair.
 * @param largestRatioAfterDamage  Largest component over total nodes, after
 *                                 damage.
 * @param largestRatioAfterRepair  Largest component over total nodes, after
 *                                 repair.
 * @param budgetExhausted          True if a needed edge could not be grown.
 * @param redistributedResources   Resource moved from damaged nodes to
 *                                 neighbors.
 * @param elapsedNanos             Wall time of the invocation.
 */
public record RepairReport(
        List<String> damagedNodes,
        int edgesDamaged,
        List<EdgeKey> grownEdges,
        long reconnectedPairs,
        long unreconnectedPairs,
        int componentsBeforeDamage,
        int componentsAfterDamage,
        int componentsAfterRepair,
        double largestRatioAfterDamage,
        double largestRatioAfterRepair,
        boolean budgetExhausted,
        double redistributedResources,
        long elapsedNanos) {

    public RepairReport {
        damagedNodes = List.copyOf(damagedNodes);
        grownEdges = List.copyOf(grownEdges);
    }

    public Duration elapsed() {
        return Duration.ofNanos(elapsedNanos);
    }

    /** True when every formerly connected pair is connected again. */
    public boolean fullyReconnected() {
        return unreconnectedPairs == 0;
    }
}
