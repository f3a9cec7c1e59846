package com.collab.sync.collab.worker;

import com.collab.sync.collab.client.DocumentStoreClient;
import com.collab.sync.core.consumer.EventHandler;
import com.collab.sync.core.consumer.HandlerFailureException;
import com.collab.sync.core.model.Event;
import com.collab.sync.core.model.StreamEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Writes the content carried by a {@code document_saved} event to the document store.
 *
 * <p>A missing {@code content} field is a permanent failure; it goes to the dead-letter
 * topic after the configured attempts like any other failure.</p>
 */
public class DocumentPersistenceHandler implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(DocumentPersistenceHandler.class);

    private final DocumentStoreClient store;
    private final Duration timeout;

    public DocumentPersistenceHandler(DocumentStoreClient store, Duration timeout) {
        this.store = store;
        this.timeout = timeout;
    }

    @Override
    public void handle(StreamEntry entry) {
        Event event = entry.event();
        Object content = event.payload() == null ? null : event.payload().get("content");
        if (!(content instanceof String text)) {
            throw new HandlerFailureException(
                    "document_saved at " + entry.topic() + "#" + entry.position() + " carries no content");
        }
        store.save(event.subjectId(), text).block(timeout);
        log.info("Persisted document={} from {}#{} ({} chars)",
                event.subjectId(), entry.topic(), entry.position(), text.length());
    }
}
