package com.conveyal.coverage.process;

import java.util.List;

/** Durable storage behind the ExpressionRegistry. */
public interface ProcessDefinitionStore {

    /** Persist the document, replacing any earlier one with the same id. When this returns the write is durable. */
    void save (ProcessDocument document);

    /** All stored documents, unvalidated. */
    List<ProcessDocument> loadAll ();

}
