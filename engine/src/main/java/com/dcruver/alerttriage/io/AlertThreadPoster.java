package com.dcruver.alerttriage.io;

import com.dcruver.alerttriage.domain.Alert;
import com.dcruver.alerttriage.domain.AlertThread;

/**
 * Chat side of alert ingestion: a new alert either opens a thread or joins one.
 */
public interface AlertThreadPoster {

    AlertThread postAlert(Alert alert);

    void replyToThread(AlertThread thread, Alert alert);
}
