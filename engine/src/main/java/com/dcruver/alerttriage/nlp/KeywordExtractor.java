package com.dcruver.alerttriage.nlp;

import com.dcruver.alerttriage.domain.Alert;

import java.util.List;

/**
 * Summarizes a group of alerts as a few representative terms.
 */
public interface KeywordExtractor {

    List<String> extract(List<Alert> alerts, int limit);
}
