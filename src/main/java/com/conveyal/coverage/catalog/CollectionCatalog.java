package com.conveyal.coverage.catalog;

import com.conveyal.coverage.components.Component;

import java.util.List;

/**
 * Read-only access to the collections that coverage requests may name. The catalog itself lives in an external
 * metadata service; implementations of this interface only mirror what it publishes.
 */
public interface CollectionCatalog extends Component {

    /** Return the collection with the given id, failing with DATA_UNAVAILABLE if there is none. */
    Collection get (String collectionId);

    List<Collection> list ();

}
