package com.conveyal.coverage.components;

/**
 * The top-level modules of the coverage processor, instantiated and wired to one another when the application starts.
 * There is typically only one instance of each component, and all references to a component are final.
 *
 * Currently this is a marker interface with no methods, indicating the role of certain classes in the project.
 * Different implementations of a component allow running against different storage or upstream data sources.
 *
 * All Components must be threadsafe: they are used concurrently by every invocation in flight.
 */
public interface Component {

}
