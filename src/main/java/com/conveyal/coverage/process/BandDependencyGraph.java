package com.conveyal.coverage.process;

import com.conveyal.coverage.CoverageProcessException;
import com.google.common.collect.ImmutableList;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.ImmutableGraph;
import com.google.common.graph.MutableGraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependencies between the output bands of one process. There is an edge from a band to every other output band its
 * script reads. Built once at registration, where it rejects cycles (a band reading itself included) and fixes the
 * order in which bands are evaluated: dependencies first, otherwise in declared order.
 */
public class BandDependencyGraph {

    private final ImmutableGraph<String> graph;

    private final List<String> evaluationOrder;

    /**
     * @param dependencies for each output band in declared order, the output bands its script reads.
     * @throws CoverageProcessException of type CYCLIC_DEFINITION if any band depends on itself, directly or not.
     */
    public BandDependencyGraph (Map<String, Set<String>> dependencies) {
        MutableGraph<String> mutable = GraphBuilder.directed().allowsSelfLoops(true).build();
        dependencies.keySet().forEach(mutable::addNode);
        dependencies.forEach((band, uses) -> uses.forEach(used -> mutable.putEdge(band, used)));
        this.graph = ImmutableGraph.copyOf(mutable);
        if (Graphs.hasCycle(graph)) {
            throw CoverageProcessException.cyclicDefinition(
                    "Output bands depend on each other in a cycle: " + String.join(", ", bandsOnCycles()));
        }
        this.evaluationOrder = topologicalOrder(new ArrayList<>(dependencies.keySet()));
    }

    private List<String> bandsOnCycles () {
        List<String> cyclic = new ArrayList<>();
        for (String band : graph.nodes()) {
            for (String successor : graph.successors(band)) {
                if (Graphs.reachableNodes(graph, successor).contains(band)) {
                    cyclic.add(band);
                    break;
                }
            }
        }
        return cyclic;
    }

    /** Repeatedly take the first band in declared order whose dependencies have all been taken. */
    private List<String> topologicalOrder (List<String> declared) {
        List<String> order = new ArrayList<>(declared.size());
        Set<String> done = new LinkedHashSet<>();
        while (order.size() < declared.size()) {
            for (String band : declared) {
                if (!done.contains(band) && done.containsAll(graph.successors(band))) {
                    done.add(band);
                    order.add(band);
                    break;
                }
            }
        }
        return ImmutableList.copyOf(order);
    }

    /** Every output band in the order it must be evaluated. */
    public List<String> evaluationOrder () {
        return evaluationOrder;
    }

    /**
     * The requested bands plus everything they depend on transitively, in evaluation order. Bands nobody asked for
     * and nobody needs are left out.
     */
    public List<String> evaluationOrderFor (Collection<String> requested) {
        Set<String> needed = new LinkedHashSet<>();
        for (String band : requested) {
            if (graph.nodes().contains(band)) {
                needed.addAll(Graphs.reachableNodes(graph, band));
            }
        }
        List<String> order = new ArrayList<>();
        for (String band : evaluationOrder) {
            if (needed.contains(band)) order.add(band);
        }
        return order;
    }

    /** Output bands the given band reads directly. */
    public Set<String> dependenciesOf (String band) {
        return graph.successors(band);
    }

}
