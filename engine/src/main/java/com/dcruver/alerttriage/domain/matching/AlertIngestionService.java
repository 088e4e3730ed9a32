package com.dcruver.alerttriage.domain.matching;

import com.dcruver.alerttriage.domain.Alert;
import com.dcruver.alerttriage.domain.AlertThread;
import com.dcruver.alerttriage.domain.AlertTriageException;
import com.dcruver.alerttriage.io.AlertRepository;
import com.dcruver.alerttriage.io.AlertThreadPoster;
import com.dcruver.alerttriage.nlp.AlertEmbeddingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Ingests a new alert: embeds it, joins the thread of a duplicate or opens a new
 * thread, and stores it.
 */
@Service
@Slf4j
public class AlertIngestionService {

    private final AlertRepository alertRepository;
    private final DuplicateAlertMatcher duplicateMatcher;
    private final AlertThreadPoster threadPoster;
    private final AlertEmbeddingService embeddingService;  // null when no embedding model is configured

    public AlertIngestionService(
        AlertRepository alertRepository,
        DuplicateAlertMatcher duplicateMatcher,
        AlertThreadPoster threadPoster,
        ObjectProvider<AlertEmbeddingService> embeddingService
    ) {
        this.alertRepository = alertRepository;
        this.duplicateMatcher = duplicateMatcher;
        this.threadPoster = threadPoster;
        this.embeddingService = embeddingService.getIfAvailable();
    }

    public IngestionResult ingest(Alert alert) {
        if (!alert.hasEmbedding() && embeddingService != null) {
            alert = alert.withEmbedding(embeddingService.embed(alert));
            log.debug("Embedded alert {} ({} dimensions)", alert.getId(), alert.getEmbedding().length);
        }

        Optional<Alert> duplicate = duplicateMatcher.findDuplicate(alert);
        Optional<AlertThread> existingThread = duplicate.map(Alert::getThread);

        Alert stored;
        try {
            if (existingThread.isPresent()) {
                threadPoster.replyToThread(existingThread.get(), alert);
                stored = alert.withThread(existingThread.get());
            } else {
                stored = alert.withThread(threadPoster.postAlert(alert));
            }
        } catch (AlertTriageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AlertTriageException("Failed to post alert " + alert.getId(), e);
        }

        alertRepository.putAlert(stored);

        // A duplicate without a thread still gets its own thread
        Optional<String> mergedInto = existingThread.isPresent()
            ? duplicate.map(Alert::getId)
            : Optional.empty();

        log.info("Alert {} ingested ({})", stored.getId(),
            mergedInto.map(id -> "merged into thread of " + id).orElse("new thread"));
        return new IngestionResult(stored, mergedInto);
    }
}
