package com.mycelium.resilience.engine;

import com.mycelium.resilience.api.EdgeKey;
import com.mycelium.resilience.model.GraphModel;
import com.mycelium.resilience.model.MycelialEdge;
import com.mycelium.resilience.model.MycelialNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Weakly connected components of the healthy subgraph.
 *
 * Only healthy nodes are members; an edge links two members when the edge
 * itself is healthy. Direction is ignored, so in a directed deployment two
 * nodes joined by a single one-way edge still share a component.
 *
 * Component indices are assigned in node insertion order of the first member,
 * and members of a component are listed in discovery (BFS) order.
 */
public final class ConnectedComponents {
    private final Map<String, Integer> componentOf;
    private final List<List<String>> members;

    private ConnectedComponents(Map<String, Integer> componentOf, List<List<String>> members) {
        this.componentOf = componentOf;
        this.members = members;
    }

    /** Components of the current healthy subgraph. */
    public static ConnectedComponents of(GraphModel graph) {
        return of(graph, Set.of());
    }

    /**
     * Components of the healthy subgraph with {@code excluded} nodes treated as
     * damaged. The graph itself is not modified.
     */
    public static ConnectedComponents of(GraphModel graph, Set<String> excluded) {
        Map<String, Integer> componentOf = new HashMap<>();
        List<List<String>> members = new ArrayList<>();
        ArrayDeque<String> queue = new ArrayDeque<>();

        for (MycelialNode node : graph.nodes()) {
            if (!alive(node, excluded) || componentOf.containsKey(node.id()))
                continue;
            int index = members.size();
            List<String> component = new ArrayList<>();
            componentOf.put(node.id(), index);
            queue.add(node.id());
            while (!queue.isEmpty()) {
                String current = queue.poll();
                component.add(current);
                for (MycelialEdge edge : graph.incidentEdges(current)) {
                    if (!edge.isHealthy())
                        continue;
                    EdgeKey key = edge.key();
                    String next = key.other(current);
                    if (componentOf.containsKey(next) || !alive(graph.node(next), excluded))
                        continue;
                    componentOf.put(next, index);
                    queue.add(next);
                }
            }
            members.add(Collections.unmodifiableList(component));
        }
        return new ConnectedComponents(componentOf, members);
    }

    private static boolean alive(MycelialNode node, Set<String> excluded) {
        return node.isHealthy() && !excluded.contains(node.id());
    }

    public int count() {
        return members.size();
    }

    /** @return The component index of a node, or -1 if it is damaged or unknown. */
    public int componentOf(String nodeId) {
        return componentOf.getOrDefault(nodeId, -1);
    }

    public List<String> members(int index) {
        return members.get(index);
    }

    public int largestSize() {
        int largest = 0;
        for (List<String> c : members)
            largest = Math.max(largest, c.size());
        return largest;
    }

    /** Index of the largest component (first one on ties), or -1 when there is none. */
    public int largestIndex() {
        int best = -1;
        for (int i = 0; i < members.size(); i++)
            if (best < 0 || members.get(i).size() > members.get(best).size())
                best = i;
        return best;
    }

    public boolean sameComponent(String a, String b) {
        int ca = componentOf(a);
        return ca >= 0 && ca == componentOf(b);
    }
}
