package com.conveyal.coverage.jobs;

import com.conveyal.coverage.fetch.CoverageRequest;
import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/** Everything needed to run one invocation of a process in the background. */
public class JobDefinition {

    public final String processId;

    public final CoverageRequest request;

    /** Output bands to include, empty for all of them. */
    public final List<String> rangeSubset;

    public final String format;

    public JobDefinition (String processId, CoverageRequest request, List<String> rangeSubset, String format) {
        this.processId = checkNotNull(processId);
        this.request = checkNotNull(request);
        this.rangeSubset = rangeSubset == null ? List.of() : ImmutableList.copyOf(rangeSubset);
        this.format = checkNotNull(format);
    }

}
