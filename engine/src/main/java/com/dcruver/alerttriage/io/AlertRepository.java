package com.dcruver.alerttriage.io;

import com.dcruver.alerttriage.domain.Alert;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Alert persistence as seen by matching and clustering.
 * Lists are ordered by creation time, then id.
 */
public interface AlertRepository {

    Optional<Alert> getAlert(String alertId);

    /**
     * Alerts created in [begin, end].
     */
    List<Alert> getAlertsBySpan(Instant begin, Instant end);

    /**
     * Alerts not bound to a ticket. A limit of zero or less returns all of them.
     */
    List<Alert> getAlertWithoutTicket(int offset, int limit);

    /**
     * Alerts with the given ids; unknown ids are skipped.
     */
    List<Alert> batchGetAlerts(Collection<String> alertIds);

    void putAlert(Alert alert);
}
