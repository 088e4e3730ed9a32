package com.dcruver.alerttriage.domain.matching;

import com.dcruver.alerttriage.domain.Alert;

import java.util.Optional;

/**
 * Outcome of ingesting one alert.
 *
 * @param alert            the alert as stored, thread included
 * @param duplicateOfAlertId the alert whose thread it joined, if any
 */
public record IngestionResult(Alert alert, Optional<String> duplicateOfAlertId) {

    public boolean isMerged() {
        return duplicateOfAlertId.isPresent();
    }
}
