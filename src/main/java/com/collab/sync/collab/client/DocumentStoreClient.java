package com.collab.sync.collab.client;

import reactor.core.publisher.Mono;

/**
 * Narrow view of the external document persistence service.
 *
 * <p>The collaboration core never owns durable document text; it loads content when the first
 * editor joins and hands the buffer back on save.</p>
 */
public interface DocumentStoreClient {

    /**
     * Loads the current content. A document unknown to the store yields an empty snapshot.
     */
    Mono<DocumentSnapshot> load(String documentId);

    Mono<Void> save(String documentId, String content);
}
