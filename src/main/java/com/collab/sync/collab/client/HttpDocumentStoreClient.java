package com.collab.sync.collab.client;

import com.collab.sync.core.resilience.CircuitBreaker;
import com.collab.sync.core.resilience.CircuitOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.Map;

/**
 * =====================================================================
 * HttpDocumentStoreClient
 * =====================================================================
 *
 * PURPOSE
 * -------
 * {@link DocumentStoreClient} over the document service REST API:
 *
 *   GET /documents/{id}   → {@link DocumentSnapshot}
 *   PUT /documents/{id}   body {"content": "..."}
 *
 * RESILIENCE
 * ----------
 * Each call is guarded by a {@link CircuitBreaker}. While the circuit is open
 * calls fail fast with {@link CircuitOpenException}. Otherwise a call gets a
 * timeout and a bounded exponential retry; 4xx responses are not retried.
 * The breaker records one outcome per call, after retries.
 */
public class HttpDocumentStoreClient implements DocumentStoreClient {

    private static final Logger log = LoggerFactory.getLogger(HttpDocumentStoreClient.class);

    private final WebClient webClient;
    private final CircuitBreaker breaker;
    private final DocumentStoreProperties props;

    public HttpDocumentStoreClient(WebClient webClient, CircuitBreaker breaker, DocumentStoreProperties props) {
        this.webClient = webClient;
        this.breaker = breaker;
        this.props = props;
    }

    @Override
    public Mono<DocumentSnapshot> load(String documentId) {
        Mono<DocumentSnapshot> call = webClient.get()
                .uri("/documents/{id}", documentId)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(DocumentSnapshot.class)
                .onErrorResume(WebClientResponseException.NotFound.class,
                        e -> Mono.just(DocumentSnapshot.empty(documentId)))
                .map(s -> s.content() == null ? new DocumentSnapshot(documentId, "", s.version()) : s);
        return guarded("load " + documentId, call);
    }

    @Override
    public Mono<Void> save(String documentId, String content) {
        Mono<Void> call = webClient.put()
                .uri("/documents/{id}", documentId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("content", content == null ? "" : content))
                .retrieve()
                .toBodilessEntity()
                .then();
        return guarded("save " + documentId, call);
    }

    private <T> Mono<T> guarded(String what, Mono<T> call) {
        return Mono.defer(() -> {
            if (!breaker.allowRequest()) {
                return Mono.error(new CircuitOpenException(breaker.name()));
            }
            return call
                    .timeout(props.getTimeout())
                    .retryWhen(Retry.backoff(props.getMaxRetries(), props.getRetryBackoff())
                            .filter(HttpDocumentStoreClient::isRetryable)
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .doOnSuccess(v -> breaker.recordSuccess())
                    .doOnError(e -> {
                        if (isClientError(e)) {
                            breaker.recordSuccess();
                        } else {
                            breaker.recordFailure();
                        }
                        log.warn("Document store {} failed: {}", what, e.toString());
                    });
        });
    }

    private static boolean isRetryable(Throwable e) {
        return !isClientError(e);
    }

    private static boolean isClientError(Throwable e) {
        return e instanceof WebClientResponseException w
                && w.getStatusCode().is4xxClientError();
    }
}
