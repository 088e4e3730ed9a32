package com.dcruver.alerttriage.io;

import com.dcruver.alerttriage.domain.Alert;
import com.dcruver.alerttriage.domain.AlertThread;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Stand-in poster used when no chat integration is configured.
 * Logs the decision and mints a thread id so the thread binding can still be stored.
 */
@Component
@Slf4j
public class LoggingAlertThreadPoster implements AlertThreadPoster {

    private final String channelId;

    public LoggingAlertThreadPoster(@Value("${triage.chat.channel-id:alerts}") String channelId) {
        this.channelId = channelId;
    }

    @Override
    public AlertThread postAlert(Alert alert) {
        AlertThread thread = new AlertThread(channelId, UUID.randomUUID().toString());
        log.info("New thread {} for alert {} ({})", thread.threadId(), alert.getId(), alert.getTitle());
        return thread;
    }

    @Override
    public void replyToThread(AlertThread thread, Alert alert) {
        log.info("Alert {} ({}) posted into thread {}", alert.getId(), alert.getTitle(), thread.threadId());
    }
}
