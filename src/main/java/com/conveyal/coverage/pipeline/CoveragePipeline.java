package com.conveyal.coverage.pipeline;

import com.conveyal.coverage.CoverageProcessException;
import com.conveyal.coverage.components.Component;
import com.conveyal.coverage.expression.BandEvaluator;
import com.conveyal.coverage.fetch.CoverageFetcher;
import com.conveyal.coverage.fetch.CoverageRequest;
import com.conveyal.coverage.process.ExpressionRegistry;
import com.conveyal.coverage.process.ProcessDefinition;
import com.conveyal.coverage.progress.ProgressListener;
import com.conveyal.coverage.raster.Dataset;
import com.conveyal.coverage.raster.RasterArray;
import com.conveyal.coverage.util.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one invocation of a process from end to end: fetch the source bands, evaluate the output bands in dependency
 * order, assemble the requested bands and write them to storage. The invocation either completes with an artifact or
 * fails as a whole with one CoverageProcessException; nothing is retried here and nothing partial is stored.
 *
 * Invocations share no mutable state. Every array belongs to the invocation that created it.
 */
public class CoveragePipeline implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(CoveragePipeline.class);

    private final ExpressionRegistry registry;
    private final CoverageFetcher fetcher;
    private final BandEvaluator evaluator;
    private final RasterAssembler assembler;

    public CoveragePipeline (ExpressionRegistry registry, CoverageFetcher fetcher, BandEvaluator evaluator,
                             RasterAssembler assembler) {
        this.registry = registry;
        this.fetcher = fetcher;
        this.evaluator = evaluator;
        this.assembler = assembler;
    }

    /**
     * Run the process and store the result.
     *
     * @param rangeSubset output bands to include, in file order. Null or empty means all output bands in declared order.
     * @param format an output format identifier such as "GeoTIFF".
     */
    public OutputArtifact run (Invocation invocation, CoverageRequest request, Collection<String> rangeSubset,
                               String format, ProgressListener progressListener) {
        try {
            Dataset output = evaluate(invocation, request, rangeSubset, progressListener);
            progressListener.beginTask("Writing " + output.size() + " bands", 1);
            OutputArtifact artifact = assembler.serialize(output, format, invocation.processId + "/" + invocation.id);
            progressListener.increment();
            invocation.advanceTo(PipelineState.COMPLETED);
            return artifact;
        } catch (Throwable t) {
            throw failed(invocation, t);
        }
    }

    public OutputArtifact run (CoverageRequest request, String processId, Collection<String> rangeSubset,
                               String format, ProgressListener progressListener) {
        return run(new Invocation(processId), request, rangeSubset, format, progressListener);
    }

    /** Run the process up to and including assembly, without writing anything. */
    public Dataset compute (Invocation invocation, CoverageRequest request, Collection<String> rangeSubset,
                            ProgressListener progressListener) {
        try {
            Dataset output = evaluate(invocation, request, rangeSubset, progressListener);
            invocation.advanceTo(PipelineState.COMPLETED);
            return output;
        } catch (Throwable t) {
            throw failed(invocation, t);
        }
    }

    /** Everything up to and including assembly. Leaves the invocation in ASSEMBLING. */
    private Dataset evaluate (Invocation invocation, CoverageRequest request, Collection<String> rangeSubset,
                              ProgressListener progressListener) {
        ProcessDefinition definition = registry.resolve(invocation.processId);
        List<String> outputBands = selectOutputBands(definition, rangeSubset);
        List<String> evaluationOrder = definition.evaluationOrderFor(outputBands);

        invocation.advanceTo(PipelineState.FETCHING);
        Set<String> fetchBands = new LinkedHashSet<>(request.bands);
        fetchBands.addAll(definition.sourceBandsFor(evaluationOrder));
        CoverageRequest fetchRequest = request.withBands(new ArrayList<>(fetchBands));
        if (fetchRequest.collections.isEmpty() && !definition.collections.isEmpty()) {
            fetchRequest = fetchRequest.withCollections(definition.collections);
        }
        Dataset sources = fetcher.fetch(fetchRequest, progressListener);

        invocation.advanceTo(PipelineState.EVALUATING);
        progressListener.beginTask("Evaluating " + evaluationOrder.size() + " bands", evaluationOrder.size());
        Map<String, RasterArray> available = new HashMap<>(sources.asMap());
        Map<String, RasterArray> evaluated = new LinkedHashMap<>();
        for (String band : evaluationOrder) {
            if (Thread.currentThread().isInterrupted()) {
                throw CoverageProcessException.evaluationTimeout("Interrupted before evaluating band " + band);
            }
            RasterArray result = evaluator.evaluate(definition.script(band), available);
            LOG.debug("Invocation {} evaluated band {}.", invocation.id, band);
            available.put(band, result);
            evaluated.put(band, result);
            progressListener.increment();
        }

        invocation.advanceTo(PipelineState.ASSEMBLING);
        return assembler.assemble(sources, evaluated, outputBands);
    }

    /**
     * The output bands to produce, in order. Every entry of the range subset must be an output band of the process,
     * which is checked before anything is fetched.
     */
    static List<String> selectOutputBands (ProcessDefinition definition, Collection<String> rangeSubset) {
        if (rangeSubset == null || rangeSubset.isEmpty()) {
            return definition.outputBands();
        }
        List<String> selected = new ArrayList<>(new LinkedHashSet<>(rangeSubset));
        for (String band : selected) {
            if (!definition.bandFunctions.containsKey(band)) {
                throw CoverageProcessException.bandNotFound(String.format(
                        "Process %s has no output band %s. Its output bands are %s.",
                        definition.id, band, definition.outputBands()));
            }
        }
        return selected;
    }

    private static CoverageProcessException failed (Invocation invocation, Throwable t) {
        CoverageProcessException exception = invocation.getState().isTerminal()
                ? CoverageProcessException.wrap(t, CoverageProcessException.Type.SERIALIZATION_ERROR)
                : invocation.fail(t);
        LOG.warn("Invocation {} of process {} failed: {}", invocation.id, invocation.processId,
                ExceptionUtils.shortCauseString(exception));
        return exception;
    }

}
