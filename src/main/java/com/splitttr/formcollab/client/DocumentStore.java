package com.splitttr.formcollab.client;

import com.splitttr.formcollab.config.CollabConfig;
import com.splitttr.formcollab.error.StoreUnavailableException;
import com.splitttr.formcollab.message.FieldOperation;
import com.splitttr.formcollab.message.FormField;
import com.splitttr.formcollab.security.FormAccess;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.WebApplicationException;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Access to the form document store. Reads happen once per room; writes are
 * pushed through a background executor and retried with exponential backoff,
 * never blocking the caller.
 */
@ApplicationScoped
public class DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(DocumentStore.class);

    public record LoadedDocument(List<FormField> fields, long version, FormAccess access) {}

    @Inject
    @RestClient
    DocumentClient documentClient;

    @Inject
    CollabConfig config;

    ScheduledExecutorService executor;

    @PostConstruct
    void start() {
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "form-store-writer");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void stop() {
        executor.shutdown();
    }

    /**
     * Reads the form once for a new room.
     *
     * @return empty when the store does not know the form
     * @throws StoreUnavailableException when the store cannot be reached
     */
    public Optional<LoadedDocument> loadFields(String documentId) {
        DocumentResponse doc;
        try {
            doc = documentClient.getById(documentId);
        } catch (WebApplicationException e) {
            if (e.getResponse() != null && e.getResponse().getStatus() == 404) {
                return Optional.empty();
            }
            log.warn("Could not load form {} from the document store: {}", documentId, e.getMessage());
            throw new StoreUnavailableException(documentId, e);
        } catch (RuntimeException e) {
            log.warn("Could not load form {} from the document store: {}", documentId, e.getMessage());
            throw new StoreUnavailableException(documentId, e);
        }
        if (doc == null) {
            return Optional.empty();
        }
        List<FormField> ordered = doc.fields() == null ? List.of() : doc.fields().stream()
            .sorted(Comparator.comparingInt(FormField::position))
            .toList();
        var editors = doc.editorIds() == null ? Set.<String>of() : Set.copyOf(doc.editorIds());
        return Optional.of(new LoadedDocument(ordered, doc.version(), new FormAccess(doc.ownerId(), editors)));
    }

    public void applyOperation(String documentId, FieldOperation operation) {
        submit(() -> write(documentId, operation, 1), 0);
    }

    void write(String documentId, FieldOperation operation, int attempt) {
        try {
            documentClient.applyOperation(documentId, operation);
            if (attempt > 1) {
                log.info("Stored operation {} on form {} after {} attempts", operation.id(), documentId, attempt);
            }
        } catch (RuntimeException e) {
            if (attempt >= config.storeRetryMaxAttempts()) {
                log.error("Store write failed for operation {} on form {} after {} attempts; live session keeps it",
                    operation.id(), documentId, attempt, e);
                return;
            }
            Duration delay = backoff(attempt);
            log.warn("Store write failed for operation {} on form {} (attempt {}), retrying in {} ms: {}",
                operation.id(), documentId, attempt, delay.toMillis(), e.getMessage());
            submit(() -> write(documentId, operation, attempt + 1), delay.toMillis());
        }
    }

    Duration backoff(int attempt) {
        Duration initial = config.storeRetryInitialBackoff();
        Duration max = config.storeRetryMaxBackoff();
        int shift = Math.min(attempt - 1, 30);
        Duration delay = initial.multipliedBy(1L << shift);
        return delay.compareTo(max) > 0 ? max : delay;
    }

    private void submit(Runnable task, long delayMillis) {
        try {
            executor.schedule(task, delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.error("Store writer is shut down, dropping write", e);
        }
    }
}
