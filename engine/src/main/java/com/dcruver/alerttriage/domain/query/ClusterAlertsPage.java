package com.dcruver.alerttriage.domain.query;

import com.dcruver.alerttriage.domain.Alert;

import java.util.List;

/**
 * One page of a cluster's alerts.
 *
 * @param totalCount matching alerts before pagination
 */
public record ClusterAlertsPage(List<Alert> alerts, int totalCount) {
}
