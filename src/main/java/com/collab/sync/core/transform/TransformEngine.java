package com.collab.sync.core.transform;

import com.collab.sync.core.model.Operation;

/**
 * =====================================================================
 * TransformEngine
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Stateless position adjustment and application of edit {@link Operation}s.
 *
 * TRANSFORM RULES
 * ---------------
 * Given an incoming operation A and an operation B already applied:
 *
 *   B insert, B.pos <= A.pos   → A.pos += len(B)
 *   B delete, B.pos <  A.pos   → A.pos -= min(len(B), A.pos - B.pos), floor 0
 *   otherwise                  → A unchanged
 *
 * LIMITS
 * ------
 * Operations are adjusted pairwise against a single prior operation. There is
 * no version vector, so three or more concurrent editors are not guaranteed to
 * converge. This is a known gap of the last-writer offset policy.
 */
public final class TransformEngine {

    /**
     * Adjusts {@code incoming} so it can be applied after {@code concurrent}.
     */
    public Operation transform(Operation incoming, Operation concurrent) {
        if (concurrent == null) {
            return incoming;
        }
        int pos = incoming.position();

        if (concurrent.isInsert() && concurrent.position() <= pos) {
            return incoming.withPosition(pos + concurrent.length());
        }
        if (concurrent.isDelete() && concurrent.position() < pos) {
            int shift = Math.min(concurrent.length(), pos - concurrent.position());
            return incoming.withPosition(Math.max(0, pos - shift));
        }
        return incoming;
    }

    /**
     * Applies {@code op} to {@code content}.
     *
     * <p>Positions past the end are clamped: an insert appends, a delete removes nothing.
     * Deleting past the end truncates at the end of the content.</p>
     */
    public String apply(String content, Operation op) {
        String base = content == null ? "" : content;
        int at = Math.min(op.position(), base.length());

        if (op.isInsert()) {
            return base.substring(0, at) + op.text() + base.substring(at);
        }
        int end = (int) Math.min((long) at + op.length(), base.length());
        return base.substring(0, at) + base.substring(end);
    }
}
