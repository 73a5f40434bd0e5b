package com.skyreader.sync.ingest;

/**
 * What applying one commit did to the cache.
 */
public enum CommitOutcome {
    /** Row inserted or replaced. */
    UPSERTED,
    /** Delete applied; includes deletes of rows that were already absent. */
    DELETED,
    /** Nothing to do: unknown operation, or a create/update without a record. */
    IGNORED
}
