package com.mycelium.resilience.util;

import com.mycelium.resilience.api.EdgeKey;
import com.mycelium.resilience.engine.FlowReport;
import com.mycelium.resilience.engine.RepairReport;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class RepairLatencyListenerTest {

    private static RepairReport report(long nanos, boolean exhausted) {
        return new RepairReport(List.of("B"), 2, List.of(new EdgeKey("A", "C")), 2, 0,
                1, 2, 1, 0.5, 0.75, exhausted, 100.0, nanos);
    }

    @Test
    public void testLatencyStatistics() {
        RepairLatencyListener listener = new RepairLatencyListener();
        assertEquals(0, listener.minLatencyNanos());
        assertEquals(0.0, listener.avgLatencyNanos(), 0.0);

        listener.onRepairEnd(report(1_000, false));
        listener.onRepairEnd(report(3_000, true));

        assertEquals(2, listener.totalRepairs());
        assertEquals(1_000, listener.minLatencyNanos());
        assertEquals(3_000, listener.maxLatencyNanos());
        assertEquals(2_000.0, listener.avgLatencyNanos(), 1e-9);
        assertEquals(3_000, listener.lastLatencyNanos());
        assertEquals(1, listener.exhaustedRepairs());
        assertTrue(listener.dump().contains("Total Repairs"));

        listener.reset();
        assertEquals(0, listener.totalRepairs());
        assertEquals(0, listener.maxLatencyNanos());
    }

    @Test
    public void testCompositeFansOutInOrder() {
        RepairLatencyListener first = new RepairLatencyListener();
        RepairLatencyListener second = new RepairLatencyListener();
        CompositeResilienceListener composite = new CompositeResilienceListener();
        composite.addForComposite(first);
        composite.addForComposite(second);
        assertEquals(2, composite.size());

        composite.onNodeDamaged("B", 2);
        composite.onEdgeGrown(new EdgeKey("A", "C"), 3.0);
        composite.onFlowEnd(new FlowReport(10, 10, 7.5, 2, true, Map.of(), Map.of()));

        for (RepairLatencyListener l : List.of(first, second)) {
            assertEquals(1, l.damagedNodes());
            assertEquals(1, l.grownEdges());
            assertEquals(1, l.flowRuns());
            assertEquals(7.5, l.totalDelivered(), 0.0);
        }
    }
}
