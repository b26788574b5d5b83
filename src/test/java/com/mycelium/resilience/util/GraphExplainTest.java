package com.mycelium.resilience.util;

import com.mycelium.resilience.api.Health;
import com.mycelium.resilience.api.NodeRole;
import com.mycelium.resilience.model.GraphModel;
import com.mycelium.resilience.model.UnknownNodeException;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class GraphExplainTest {

    private GraphModel graph;

    @Before
    public void setUp() {
        graph = new GraphModel(false);
        graph.addNode("root", 40, 100, NodeRole.SOURCE);
        graph.addNode("tip", 5, 10, NodeRole.SINK);
        graph.addNode("knot", 0, 10, NodeRole.INTERMEDIATE);
        graph.addEdge("root", "knot", 1.0, 4);
        graph.addEdge("knot", "tip", 2.0, 4);
        graph.growEdge("root", "tip", 3.5, 5);
    }

    @Test
    public void testExplainNode() {
        graph.setEdgeHealth(graph.key("knot", "tip"), Health.DAMAGED);
        String text = new GraphExplain(graph).explainNode("tip");
        assertTrue(text.startsWith("Node: tip"));
        assertTrue(text.contains("Role: SINK"));
        assertTrue(text.contains("Edges (2)"));
        assertTrue(text.contains("knot [damaged]"));
    }

    @Test
    public void testDumpTopology() {
        graph.setNodeHealth("knot", Health.DAMAGED);
        String text = new GraphExplain(graph).dumpTopology();
        assertTrue(text.startsWith("Graph (3 nodes, 3 edges)"));
        assertTrue(text.contains("knot (INTERMEDIATE) DAMAGED"));
        assertTrue(text.contains("root -- tip"));
        assertTrue(text.contains("(grown)"));
    }

    @Test(expected = UnknownNodeException.class)
    public void testUnknownNode() {
        new GraphExplain(graph).explainNode("ghost");
    }
}
