package com.dcruver.alerttriage.io;

import com.dcruver.alerttriage.domain.Alert;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed repository for service tests. Counts full scans of unbound alerts.
 */
public class InMemoryAlertRepository implements AlertRepository {

    private final Map<String, Alert> alerts = new LinkedHashMap<>();
    private final AtomicInteger unboundScans = new AtomicInteger();

    public InMemoryAlertRepository(Alert... initial) {
        for (Alert alert : initial) {
            putAlert(alert);
        }
    }

    public int getUnboundScans() {
        return unboundScans.get();
    }

    @Override
    public Optional<Alert> getAlert(String alertId) {
        return Optional.ofNullable(alerts.get(alertId));
    }

    @Override
    public List<Alert> getAlertsBySpan(Instant begin, Instant end) {
        return alerts.values().stream()
            .filter(a -> !a.getCreatedAt().isBefore(begin) && !a.getCreatedAt().isAfter(end))
            .toList();
    }

    @Override
    public List<Alert> getAlertWithoutTicket(int offset, int limit) {
        unboundScans.incrementAndGet();
        return alerts.values().stream()
            .filter(a -> !a.isBound())
            .sorted(Comparator.comparing(Alert::getCreatedAt).thenComparing(Alert::getId))
            .skip(Math.max(0, offset))
            .limit(limit > 0 ? limit : Long.MAX_VALUE)
            .toList();
    }

    @Override
    public List<Alert> batchGetAlerts(Collection<String> alertIds) {
        return alertIds.stream().map(alerts::get).filter(a -> a != null).toList();
    }

    @Override
    public void putAlert(Alert alert) {
        alerts.put(alert.getId(), alert);
    }
}
