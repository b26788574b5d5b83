package com.mycelium.resilience.api;

import com.mycelium.resilience.engine.FlowReport;
import com.mycelium.resilience.engine.RepairReport;

/**
 * Observability interface for damage, repair and flow activity.
 *
 * Implementations are registered with the {@code MyceliumGraph} facade and are
 * called synchronously on the engine thread while an operation runs. They must
 * be lightweight: blocking I/O here stalls every repair and flow invocation.
 */
public interface ResilienceListener {

    /**
     * Called once per newly damaged node, after its incident edges were marked.
     *
     * @param nodeId       The damaged node.
     * @param edgesDamaged Number of incident edges that went from healthy to
     *                     damaged.
     */
    void onNodeDamaged(String nodeId, int edgesDamaged);

    /**
     * Called when a repair grows (or regrows) a compensating edge.
     *
     * @param edge     The new edge.
     * @param baseCost Its base cost.
     */
    void onEdgeGrown(EdgeKey edge, double baseCost);

    /**
     * Called when a repair invocation completes.
     *
     * @param report The repair outcome, including partial reconnection.
     */
    void onRepairEnd(RepairReport report);

    /**
     * Called after each flow round.
     *
     * @param round     1-based round number.
     * @param roundFlow Total amount pushed during the round.
     */
    void onFlowRound(int round, double roundFlow);

    /**
     * Called when a flow distribution invocation completes.
     *
     * @param report The distribution outcome.
     */
    void onFlowEnd(FlowReport report);
}
