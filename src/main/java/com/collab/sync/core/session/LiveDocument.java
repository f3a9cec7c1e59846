package com.collab.sync.core.session;

import com.collab.sync.core.model.Operation;
import com.collab.sync.core.transform.TransformEngine;

/**
 * =====================================================================
 * LiveDocument
 * =====================================================================
 *
 * PURPOSE
 * -------
 * The in-memory buffer of one document while at least one editor is connected.
 * Every mutation goes through this object's monitor, which is the single-writer
 * discipline for the document.
 *
 * CONCURRENCY RULE
 * ----------------
 * An incoming operation is transformed against the last applied operation only
 * when both hold:
 *
 *   - the client's {@code revision} is older than the current revision
 *   - the last operation was made by a different user
 *
 * Operations without a revision are applied as sent. Only the single most
 * recent operation is considered; there is no version vector.
 */
public class LiveDocument {

    private final String documentId;
    private String content;
    private long revision;
    private Operation lastOperation;
    private String lastAuthor;
    private boolean dirty;

    public LiveDocument(String documentId, String content, long revision) {
        this.documentId = documentId;
        this.content = content == null ? "" : content;
        this.revision = revision;
    }

    public String documentId() {
        return documentId;
    }

    /**
     * Transforms (if concurrent) and applies {@code op} on behalf of {@code userId}.
     */
    public synchronized AppliedEdit apply(String userId, Operation op, TransformEngine engine) {
        Operation effective = op;
        if (lastOperation != null
                && op.revision() != null
                && op.revision() < revision
                && !userId.equals(lastAuthor)) {
            effective = engine.transform(op, lastOperation);
        }
        content = engine.apply(content, effective);
        revision++;
        effective = effective.withRevision(revision);
        lastOperation = effective;
        lastAuthor = userId;
        dirty = true;
        return new AppliedEdit(effective, revision, content);
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(content, revision, dirty);
    }

    /**
     * Result of {@link #apply}: the operation as actually applied, the new revision and the new content.
     */
    public record AppliedEdit(Operation operation, long revision, String content) {
    }

    public record Snapshot(String content, long revision, boolean dirty) {
    }
}
