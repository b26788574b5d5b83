package com.mycelium.resilience.util;

import com.mycelium.resilience.api.EdgeKey;
import com.mycelium.resilience.api.ResilienceListener;
import com.mycelium.resilience.engine.FlowReport;
import com.mycelium.resilience.engine.RepairReport;
import java.util.Arrays;

/**
 * Aggregates multiple {@link ResilienceListener} instances. Listeners are
 * called in registration order.
 */
public class CompositeResilienceListener implements ResilienceListener {
    private ResilienceListener[] listeners = new ResilienceListener[0];

    public void addForComposite(ResilienceListener listener) {
        ResilienceListener[] old = listeners;
        ResilienceListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onNodeDamaged(String nodeId, int edgesDamaged) {
        for (ResilienceListener l : listeners)
            l.onNodeDamaged(nodeId, edgesDamaged);
    }

    @Override
    public void onEdgeGrown(EdgeKey edge, double baseCost) {
        for (ResilienceListener l : listeners)
            l.onEdgeGrown(edge, baseCost);
    }

    @Override
    public void onRepairEnd(RepairReport report) {
        for (ResilienceListener l : listeners)
            l.onRepairEnd(report);
    }

    @Override
    public void onFlowRound(int round, double roundFlow) {
        for (ResilienceListener l : listeners)
            l.onFlowRound(round, roundFlow);
    }

    @Override
    public void onFlowEnd(FlowReport report) {
        for (ResilienceListener l : listeners)
            l.onFlowEnd(report);
    }
}
