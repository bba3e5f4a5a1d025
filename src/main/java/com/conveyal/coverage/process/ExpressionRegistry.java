package com.conveyal.coverage.process;

import com.conveyal.coverage.CoverageProcessException;
import com.conveyal.coverage.components.Component;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the registered process definitions. A definition is validated and compiled in full, then persisted, and only
 * then published by a single map put, so readers see either the old definition or the new one and never a mix.
 * Registrations are serialized with one another; resolve never takes a lock.
 */
public class ExpressionRegistry implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionRegistry.class);

    private final ProcessDefinitionStore store;

    private final Map<String, ProcessDefinition> definitions = new ConcurrentHashMap<>();

    private final Object registrationLock = new Object();

    public ExpressionRegistry (ProcessDefinitionStore store) {
        this.store = store;
    }

    /** Reload every stored definition. Any stored definition that no longer validates is logged and left out. */
    public int loadStored () {
        int loaded = 0;
        for (ProcessDocument document : store.loadAll()) {
            try {
                ProcessDefinition definition = ProcessDefinition.compile(normalize(document));
                definitions.put(definition.id, definition);
                loaded += 1;
            } catch (CoverageProcessException e) {
                LOG.error("Stored process {} is invalid and was not loaded: {}", document.id, e.toString());
            }
        }
        LOG.info("Loaded {} stored process definitions.", loaded);
        return loaded;
    }

    public ProcessDefinition register (String processId, List<String> sourceBands, Map<String, String> bandFunctions) {
        return register(processId, sourceBands, bandFunctions, null);
    }

    public ProcessDefinition register (String processId, List<String> sourceBands, Map<String, String> bandFunctions,
                                       List<String> collections) {
        return register(new ProcessDocument(processId, sourceBands, bandFunctions, collections));
    }

    /**
     * Validate, persist and publish a definition, replacing any previous one with the same id. On failure nothing
     * changes: the previous definition (if any) stays both stored and visible.
     */
    public ProcessDefinition register (ProcessDocument document) {
        ProcessDefinition definition = ProcessDefinition.compile(normalize(document));
        synchronized (registrationLock) {
            store.save(definition.toDocument());
            ProcessDefinition previous = definitions.put(definition.id, definition);
            LOG.info("{} process {} with output bands {}.", previous == null ? "Registered" : "Replaced",
                    definition.id, definition.outputBands());
        }
        return definition;
    }

    public ProcessDefinition resolve (String processId) {
        ProcessDefinition definition = processId == null ? null : definitions.get(processId);
        if (definition == null) {
            throw CoverageProcessException.unknownProcess(processId);
        }
        return definition;
    }

    public Set<String> processIds () {
        return new TreeSet<>(definitions.keySet());
    }

    /** Copy the document, replacing absent lists and maps with empty ones and dropping blank collection ids. */
    private static ProcessDocument normalize (ProcessDocument document) {
        List<String> collections = new ArrayList<>();
        if (document.collections != null) {
            document.collections.stream().filter(c -> c != null && !c.isBlank()).forEach(collections::add);
        }
        return new ProcessDocument(
                document.id,
                document.sourceBands == null ? new ArrayList<>() : new ArrayList<>(document.sourceBands),
                document.bandFunctions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(document.bandFunctions),
                collections
        );
    }

}
