package com.mycelium.resilience;

import com.mycelium.resilience.api.GraphStore;
import com.mycelium.resilience.api.NodeRole;
import com.mycelium.resilience.api.ResilienceListener;
import com.mycelium.resilience.engine.EngineConfig;
import com.mycelium.resilience.engine.FlowReport;
import com.mycelium.resilience.engine.GraphMetrics;
import com.mycelium.resilience.engine.HyphalPath;
import com.mycelium.resilience.engine.HyphalPathDiscovery;
import com.mycelium.resilience.engine.MetricsSnapshot;
import com.mycelium.resilience.engine.NutrientFlowDistributor;
import com.mycelium.resilience.engine.RepairReport;
import com.mycelium.resilience.engine.SelfHealingController;
import com.mycelium.resilience.io.GraphCompiler;
import com.mycelium.resilience.io.GraphDefinition;
import com.mycelium.resilience.io.GraphDefinitionLoader;
import com.mycelium.resilience.model.GraphModel;
import com.mycelium.resilience.model.MycelialEdge;
import com.mycelium.resilience.model.MycelialNode;
import com.mycelium.resilience.util.CompositeResilienceListener;
import com.mycelium.resilience.util.GraphExplain;
import com.mycelium.resilience.util.RepairLatencyListener;
import com.mycelium.resilience.wiring.DisruptorStorageMirror;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * The engine facade: one graph, its configuration, and the four entry points
 * ({@link #discoverPaths}, {@link #distributeFlow}, {@link #applyDamage},
 * {@link #metricsSnapshot}).
 *
 * This class handles:
 * - Compiling a topology definition (JSON file, JSON string or builder) into
 * a {@link GraphModel}.
 * - Wiring discovery, flow and repair to the same model and configuration.
 * - Fanning engine events out to registered listeners.
 * - Mirroring mutations to an external store through a Disruptor ring buffer.
 *
 * Every public method is synchronized: entry points run to completion one at a
 * time and always observe a consistent graph.
 */
public class MyceliumGraph implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(MyceliumGraph.class);

    private final String name;
    private final EngineConfig config;
    private final GraphModel model;
    private final HyphalPathDiscovery discovery;
    private final NutrientFlowDistributor flow;
    private final SelfHealingController repair;
    private final CompositeResilienceListener compositeListener = new CompositeResilienceListener();

    private DisruptorStorageMirror mirror;
    private long lastRepairNanos;

    public MyceliumGraph(String name, GraphModel model, EngineConfig config) {
        this.name = name;
        this.model = model;
        this.config = config.validate();
        if (model.isDirected() != config.isDirected())
            throw new IllegalArgumentException("Model direction does not match config.directed=" + config.isDirected());
        this.discovery = new HyphalPathDiscovery(model, config);
        this.flow = new NutrientFlowDistributor(model, config);
        this.repair = new SelfHealingController(model, config, discovery);
        flow.setListener(compositeListener);
        repair.setListener(compositeListener);
    }

    /** Loads and compiles a JSON topology definition. */
    public static MyceliumGraph fromJson(Path jsonPath) {
        return fromDefinition(GraphDefinitionLoader.load(jsonPath));
    }

    /** Compiles a JSON topology definition held in memory. */
    public static MyceliumGraph fromJson(String json) {
        return fromDefinition(GraphDefinitionLoader.parse(json));
    }

    public static MyceliumGraph fromDefinition(GraphDefinition def) {
        GraphCompiler.CompiledGraph compiled = new GraphCompiler().compile(def);
        return new MyceliumGraph(compiled.name(), compiled.model(), compiled.config());
    }

    public static GraphBuilder builder(String name) {
        return GraphBuilder.create(name);
    }

    public String name() {
        return name;
    }

    public EngineConfig config() {
        return config;
    }

    /** The underlying model. Callers must not mutate it concurrently with the facade. */
    public GraphModel model() {
        return model;
    }

    // ── Entry points ────────────────────────────────────────────────────

    /**
     * Discovers up to {@code k} diverse paths and counts one usage on every edge
     * of every returned path.
     */
    public synchronized List<HyphalPath> discoverPaths(String source, String target, int k) {
        List<HyphalPath> paths = discovery.discover(source, target, k);
        discovery.recordSelection(paths);
        return paths;
    }

    public synchronized FlowReport distributeFlow(Map<String, Double> supplies, Map<String, Double> demands) {
        return flow.distribute(supplies, demands);
    }

    public synchronized RepairReport applyDamage(Collection<String> nodeIds) {
        RepairReport report = repair.apply(nodeIds);
        lastRepairNanos = report.elapsedNanos();
        return report;
    }

    public RepairReport applyDamage(String... nodeIds) {
        return applyDamage(Arrays.asList(nodeIds));
    }

    public synchronized MetricsSnapshot metricsSnapshot() {
        return GraphMetrics.snapshot(model, lastRepairNanos);
    }

    // ── Topology mutation ───────────────────────────────────────────────

    public synchronized MycelialNode addNode(String id, double resourceLevel, double capacity, NodeRole role) {
        return model.addNode(id, resourceLevel, capacity, role);
    }

    public synchronized void removeNode(String id) {
        model.removeNode(id);
    }

    public synchronized MycelialEdge addEdge(String a, String b, double baseCost, double capacity) {
        return model.addEdge(a, b, baseCost, capacity);
    }

    public synchronized void removeEdge(String a, String b) {
        model.removeEdge(a, b);
    }

    // ── Observability ───────────────────────────────────────────────────

    /**
     * Registers a listener. Adds to the composite rather than replacing existing
     * listeners.
     */
    public synchronized void addListener(ResilienceListener listener) {
        compositeListener.addForComposite(listener);
    }

    public synchronized RepairLatencyListener enableRepairLatencyTracking() {
        var latencyListener = new RepairLatencyListener();
        compositeListener.addForComposite(latencyListener);
        return latencyListener;
    }

    public synchronized GraphExplain explain() {
        return new GraphExplain(model);
    }

    // ── Storage ─────────────────────────────────────────────────────────

    /**
     * Mirrors every later mutation to {@code store}, after replaying the current
     * nodes and edges into it. Replaces (and closes) a previously attached mirror.
     */
    public synchronized DisruptorStorageMirror attachStore(GraphStore store) {
        if (mirror != null)
            mirror.close();
        mirror = new DisruptorStorageMirror(store, config.getMirrorBufferSize());
        for (MycelialNode n : model.nodes())
            mirror.upsertNode(n.id(), n.attributes());
        for (MycelialEdge e : model.edges())
            mirror.upsertEdge(e.key(), e.attributes());
        model.attachStore(mirror);
        log.info("Graph '{}' mirrored to {}", name, store.getClass().getSimpleName());
        return mirror;
    }

    /** Detaches and drains the storage mirror, if any. */
    @Override
    public synchronized void close() {
        model.attachStore(null);
        if (mirror != null) {
            mirror.close();
            mirror = null;
        }
    }
}
