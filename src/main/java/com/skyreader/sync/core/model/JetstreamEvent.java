package com.skyreader.sync.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * One decoded firehose frame.
 *
 * <p>{@code timeUs} is the upstream stream time in microseconds and doubles as the resume token. It is
 * {@code null} only for {@link EventKind#MALFORMED} frames or frames that omitted it.</p>
 *
 * @param did    repository the frame belongs to
 * @param timeUs stream time (microseconds), may be null
 * @param kind   frame kind
 * @param commit commit body, present only for {@link EventKind#COMMIT}
 */
public record JetstreamEvent(String did, Long timeUs, EventKind kind, Commit commit) {

    public static JetstreamEvent malformed() {
        return new JetstreamEvent(null, null, EventKind.MALFORMED, null);
    }

    public boolean isCommit() {
        return kind == EventKind.COMMIT && commit != null;
    }

    /**
     * @return the watched collection this commit touches, empty for non-commits and foreign collections
     */
    public Optional<WatchedCollection> watchedCollection() {
        return isCommit() ? WatchedCollection.fromNsid(commit.collection()) : Optional.empty();
    }

    public RecordUri recordUri() {
        if (!isCommit()) {
            throw new IllegalStateException("Not a commit frame: kind=" + kind);
        }
        return new RecordUri(did, commit.collection(), commit.rkey());
    }

    /**
     * Commit body.
     *
     * @param operation  create / update / delete
     * @param collection record collection NSID
     * @param rkey       record key inside the collection
     * @param record     record value (absent on delete)
     * @param cid        content identifier of the record (absent on delete)
     * @param rev        repository revision
     */
    public record Commit(CommitOperation operation, String collection, String rkey, JsonNode record, String cid,
            String rev) {

        public boolean hasRecord() {
            return record != null && !record.isNull() && record.isObject();
        }
    }
}
