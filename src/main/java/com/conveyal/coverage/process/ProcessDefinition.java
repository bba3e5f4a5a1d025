package com.conveyal.coverage.process;

import com.conveyal.coverage.CoverageProcessException;
import com.conveyal.coverage.expression.BandScript;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A validated, compiled process: its source bands, the scripts defining its output bands, and the evaluation order
 * worked out at registration. Instances are immutable and only ever created through compile(), so holding one means
 * all of its scripts parse, read only declared names, and are free of cycles.
 */
public class ProcessDefinition {

    /** Process ids double as storage keys, so they are kept to a safe set of characters. */
    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]*");

    public final String id;

    public final List<String> sourceBands;

    /** Output band name to script source, in declared order. */
    public final Map<String, String> bandFunctions;

    /** Collections to read from when a request names none. */
    public final List<String> collections;

    private final Map<String, BandScript> scripts;

    private final BandDependencyGraph dependencyGraph;

    /** For each output band, the source bands its script reads directly. */
    private final Map<String, Set<String>> sourceDependencies;

    private ProcessDefinition (ProcessDocument document, Map<String, BandScript> scripts,
                               BandDependencyGraph dependencyGraph, Map<String, Set<String>> sourceDependencies) {
        this.id = document.id;
        this.sourceBands = ImmutableList.copyOf(document.sourceBands);
        this.bandFunctions = ImmutableMap.copyOf(document.bandFunctions);
        this.collections = ImmutableList.copyOf(document.collections);
        this.scripts = ImmutableMap.copyOf(scripts);
        this.dependencyGraph = dependencyGraph;
        this.sourceDependencies = ImmutableMap.copyOf(sourceDependencies);
    }

    /**
     * Validate and compile a process. Fails with INVALID_DEFINITION for structural problems (missing id or functions,
     * bad or duplicate names, reads of undeclared names), EXPRESSION_SYNTAX_ERROR for scripts that do not parse, and
     * CYCLIC_DEFINITION when output bands depend on each other in a cycle.
     */
    public static ProcessDefinition compile (ProcessDocument document) {
        if (document.id == null || !VALID_ID.matcher(document.id).matches()) {
            throw CoverageProcessException.invalidDefinition("Invalid process id: " + document.id);
        }
        if (document.bandFunctions == null || document.bandFunctions.isEmpty()) {
            throw CoverageProcessException.invalidDefinition("Process " + document.id + " defines no band functions.");
        }
        Set<String> sources = new HashSet<>();
        for (String source : document.sourceBands) {
            checkName(document.id, source);
            if (!sources.add(source)) {
                throw CoverageProcessException.invalidDefinition("Source band " + source + " is declared twice.");
            }
        }
        for (String output : document.bandFunctions.keySet()) {
            checkName(document.id, output);
            if (sources.contains(output)) {
                throw CoverageProcessException.invalidDefinition(
                        "Output band " + output + " has the same name as a source band.");
            }
        }
        Map<String, BandScript> scripts = new LinkedHashMap<>();
        Map<String, Set<String>> outputDependencies = new LinkedHashMap<>();
        Map<String, Set<String>> sourceDependencies = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : document.bandFunctions.entrySet()) {
            String output = entry.getKey();
            if (entry.getValue() == null) {
                throw CoverageProcessException.invalidDefinition("Band " + output + " has no function.");
            }
            BandScript script = BandScript.compile(output, entry.getValue());
            Set<String> usesOutputs = new LinkedHashSet<>();
            Set<String> usesSources = new LinkedHashSet<>();
            for (String identifier : script.freeIdentifiers()) {
                if (document.bandFunctions.containsKey(identifier)) {
                    usesOutputs.add(identifier);
                } else if (sources.contains(identifier)) {
                    usesSources.add(identifier);
                } else {
                    throw CoverageProcessException.invalidDefinition(String.format(
                            "Band %s refers to %s, which is neither a source band nor an output band.",
                            output, identifier));
                }
            }
            scripts.put(output, script);
            outputDependencies.put(output, usesOutputs);
            sourceDependencies.put(output, usesSources);
        }
        BandDependencyGraph graph = new BandDependencyGraph(outputDependencies);
        return new ProcessDefinition(document, scripts, graph, sourceDependencies);
    }

    private static void checkName (String processId, String name) {
        if (name == null || name.isBlank()) {
            throw CoverageProcessException.invalidDefinition("Process " + processId + " has an empty band name.");
        }
    }

    public List<String> outputBands () {
        return ImmutableList.copyOf(bandFunctions.keySet());
    }

    public BandScript script (String band) {
        return scripts.get(band);
    }

    public List<String> evaluationOrder () {
        return dependencyGraph.evaluationOrder();
    }

    /** The requested output bands and their transitive dependencies, in evaluation order. */
    public List<String> evaluationOrderFor (Collection<String> requestedOutputs) {
        return dependencyGraph.evaluationOrderFor(requestedOutputs);
    }

    /** Source bands read by the given output bands, in declared source order. */
    public List<String> sourceBandsFor (Collection<String> outputBands) {
        Set<String> needed = new HashSet<>();
        for (String band : outputBands) {
            needed.addAll(sourceDependencies.getOrDefault(band, Set.of()));
        }
        ImmutableList.Builder<String> result = ImmutableList.builder();
        for (String source : sourceBands) {
            if (needed.contains(source)) result.add(source);
        }
        return result.build();
    }

    public ProcessDocument toDocument () {
        return new ProcessDocument(id, sourceBands, bandFunctions, collections);
    }

    /** Two definitions are equal when they were registered from the same content. */
    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProcessDefinition that = (ProcessDefinition) o;
        return id.equals(that.id) && sourceBands.equals(that.sourceBands)
                && bandFunctions.equals(that.bandFunctions) && collections.equals(that.collections);
    }

    @Override
    public int hashCode () {
        return Objects.hash(id, sourceBands, bandFunctions, collections);
    }

    @Override
    public String toString () {
        return String.format("Process %s sources=%s outputs=%s", id, sourceBands, bandFunctions.keySet());
    }

}
