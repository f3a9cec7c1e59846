package com.collab.sync.collab.service;

import com.collab.sync.collab.client.DocumentSnapshot;
import com.collab.sync.collab.client.DocumentStoreClient;
import com.collab.sync.core.session.LiveDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;

/**
 * =====================================================================
 * LiveDocumentRegistry
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Live buffers of the documents that currently have editors. A buffer is loaded
 * from the document store when the first editor joins and saved back when the
 * last editor leaves, if it changed.
 *
 * SAVE ON RELEASE
 * ---------------
 * The save runs asynchronously. Until it completes the released buffer stays
 * parked, and an editor rejoining in that window gets the parked buffer back
 * instead of the store's older copy. Saves of one document are chained, so a
 * later save never lands before an earlier one. A buffer whose save failed
 * stays parked for the next rejoin.
 *
 * FAILED LOADS
 * ------------
 * When the store is unavailable the buffer starts from empty content and is
 * never written back. Edits made to it are dropped on release.
 *
 * Loading and releasing run inside the map's per-key compute, so they are
 * serialized per document.
 */
public class LiveDocumentRegistry {

    private static final Logger log = LoggerFactory.getLogger(LiveDocumentRegistry.class);

    private final Map<String, LiveDocument> documents = new ConcurrentHashMap<>();
    private final Map<String, PendingSave> saving = new ConcurrentHashMap<>();
    private final Set<LiveDocument> unloaded = ConcurrentHashMap.newKeySet();
    private final DocumentStoreClient store;
    private final Duration loadTimeout;

    public LiveDocumentRegistry(DocumentStoreClient store, Duration loadTimeout) {
        this.store = store;
        this.loadTimeout = loadTimeout;
    }

    /**
     * Returns the live buffer of a document, loading it on first use. Blocks while loading.
     */
    public LiveDocument acquire(String documentId) {
        return documents.computeIfAbsent(documentId, this::revive);
    }

    public Optional<LiveDocument> get(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    /**
     * Drops the buffer when {@code idle} reports no remaining editors, saving it if dirty.
     *
     * @return {@code true} if the buffer was released
     */
    public boolean releaseIfIdle(String documentId, BooleanSupplier idle) {
        LiveDocument[] released = new LiveDocument[1];
        documents.computeIfPresent(documentId, (id, doc) -> {
            if (!idle.getAsBoolean()) {
                return doc;
            }
            released[0] = doc;
            return null;
        });
        LiveDocument doc = released[0];
        if (doc == null) {
            return false;
        }
        LiveDocument.Snapshot snapshot = doc.snapshot();
        if (unloaded.remove(doc)) {
            if (snapshot.dirty()) {
                log.warn("Discarding edits to document={} revision={}: its stored content was never loaded",
                        documentId, snapshot.revision());
            }
        } else if (snapshot.dirty()) {
            save(documentId, doc, snapshot);
        }
        log.info("Released live document={} revision={}", documentId, snapshot.revision());
        return true;
    }

    /**
     * Waits for in-flight saves to finish, up to {@code timeout}.
     *
     * @return {@code true} if nothing was left in flight
     */
    public boolean awaitPendingSaves(Duration timeout) {
        List<Mono<Void>> inFlight = saving.values().stream()
                .filter(p -> !p.isDone())
                .map(PendingSave::completion)
                .toList();
        if (inFlight.isEmpty()) {
            return true;
        }
        try {
            Mono.when(inFlight).block(timeout);
            return true;
        } catch (RuntimeException e) {
            log.warn("{} document saves still in flight after {}: {}", inFlight.size(), timeout, e.toString());
            return false;
        }
    }

    public int size() {
        return documents.size();
    }

    private void save(String documentId, LiveDocument doc, LiveDocument.Snapshot snapshot) {
        PendingSave pending = new PendingSave(doc);
        PendingSave previous = saving.put(documentId, pending);
        Mono<Void> after = previous == null ? Mono.empty() : previous.completion();

        after.then(Mono.defer(() -> store.save(documentId, snapshot.content())))
                .doFinally(signal -> pending.finish())
                .subscribe(
                        v -> { },
                        err -> {
                            pending.failed = true;
                            log.warn("Save on last leave failed document={} revision={}; buffer kept for rejoin: {}",
                                    documentId, snapshot.revision(), err.toString());
                        },
                        () -> {
                            saving.remove(documentId, pending);
                            log.info("Saved document={} revision={} on last leave", documentId, snapshot.revision());
                        });
    }

    private LiveDocument revive(String documentId) {
        PendingSave parked = saving.get(documentId);
        if (parked != null) {
            log.info("Rejoin of document={} served from the buffer awaiting save (failed={})",
                    documentId, parked.failed);
            return parked.document;
        }
        return load(documentId);
    }

    private LiveDocument load(String documentId) {
        DocumentSnapshot snapshot;
        try {
            snapshot = store.load(documentId).block(loadTimeout);
        } catch (RuntimeException e) {
            log.warn("Loading document={} failed; editing from empty content, which will not be saved: {}",
                    documentId, e.toString());
            LiveDocument blank = new LiveDocument(documentId, "", 0);
            unloaded.add(blank);
            return blank;
        }
        if (snapshot == null) {
            snapshot = DocumentSnapshot.empty(documentId);
        }
        log.info("Loaded live document={} version={} length={}", documentId, snapshot.version(), snapshot.content().length());
        return new LiveDocument(documentId, snapshot.content(), snapshot.version());
    }

    private static final class PendingSave {

        private final LiveDocument document;
        private final Sinks.Empty<Void> done = Sinks.empty();
        private volatile boolean failed;
        private volatile boolean finished;

        private PendingSave(LiveDocument document) {
            this.document = document;
        }

        Mono<Void> completion() {
            return done.asMono();
        }

        boolean isDone() {
            return finished;
        }

        void finish() {
            finished = true;
            done.tryEmitEmpty();
        }
    }
}
