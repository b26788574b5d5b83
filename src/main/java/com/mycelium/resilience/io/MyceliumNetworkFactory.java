package com.mycelium.resilience.io;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.mycelium.resilience.api.NodeRole;

/**
 * Generates mycelium-like topologies for simulations and tests.
 *
 * Node {@code i} is named {@code node_i}. The first three nodes are sources,
 * the last three sinks, the rest intermediates (sources win when the two
 * ranges overlap in small networks). Resource levels are whole numbers in
 * [50, 150].
 *
 * Spatial clustering is simulated by index distance: nodes i and j connect with
 * probability {@code p * (1 - |i - j| / n)}, so neighbors in index order are
 * likely to connect and far-apart nodes rarely do. Edge cost is uniform in
 * [0.5, 1.5], capacity a whole number in [5, 15].
 *
 * The same (nodes, p, seed) always yields the same definition.
 */
public final class MyceliumNetworkFactory {
    private static final int ROLE_BAND = 3;

    private MyceliumNetworkFactory() {
    }

    /**
     * @param nodes                 Number of nodes, at least 1.
     * @param connectionProbability Base connection probability in [0, 1].
     * @param seed                  Random seed.
     */
    public static GraphDefinition generate(int nodes, double connectionProbability, long seed) {
        if (nodes < 1)
            throw new IllegalArgumentException("Node count must be positive: " + nodes);
        if (!(connectionProbability >= 0) || connectionProbability > 1.0)
            throw new IllegalArgumentException("Connection probability out of [0, 1]: " + connectionProbability);

        Random random = new Random(seed);
        List<GraphDefinition.NodeDef> nodeDefs = new ArrayList<>(nodes);
        for (int i = 0; i < nodes; i++) {
            GraphDefinition.NodeDef nd = new GraphDefinition.NodeDef();
            nd.setId(name(i));
            nd.setResources(50 + random.nextInt(101));
            nd.setRole(role(i, nodes).name());
            nodeDefs.add(nd);
        }

        List<GraphDefinition.EdgeDef> edgeDefs = new ArrayList<>();
        for (int i = 0; i < nodes; i++) {
            for (int j = i + 1; j < nodes; j++) {
                double distanceFactor = (double) (j - i) / nodes;
                if (random.nextDouble() < connectionProbability * (1 - distanceFactor)) {
                    GraphDefinition.EdgeDef ed = new GraphDefinition.EdgeDef();
                    ed.setFrom(name(i));
                    ed.setTo(name(j));
                    ed.setCost(0.5 + random.nextDouble());
                    ed.setCapacity(5 + random.nextInt(11));
                    edgeDefs.add(ed);
                }
            }
        }

        GraphDefinition.GraphInfo info = new GraphDefinition.GraphInfo();
        info.setName("mycelium-" + nodes + "-" + seed);
        info.setNodes(nodeDefs);
        info.setEdges(edgeDefs);
        GraphDefinition def = new GraphDefinition();
        def.setGraph(info);
        return def;
    }

    public static String name(int index) {
        return "node_" + index;
    }

    static NodeRole role(int index, int nodes) {
        if (index < ROLE_BAND)
            return NodeRole.SOURCE;
        if (index < nodes - ROLE_BAND)
            return NodeRole.INTERMEDIATE;
        return NodeRole.SINK;
    }
}
