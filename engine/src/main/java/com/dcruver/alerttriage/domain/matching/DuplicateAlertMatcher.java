package com.dcruver.alerttriage.domain.matching;

import com.dcruver.alerttriage.domain.Alert;
import com.dcruver.alerttriage.domain.AlertTriageException;
import com.dcruver.alerttriage.io.AlertRepository;
import com.dcruver.alerttriage.nlp.VectorSimilarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the open alert a new alert duplicates, so it can join that alert's thread.
 *
 * Candidates are alerts from the last 24 hours that are not bound to a ticket and
 * have an embedding. The winner is the first candidate, in (createdAt, id) order,
 * with the strictly highest similarity at or above 0.99. Always reads the repository;
 * nothing here is cached.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DuplicateAlertMatcher {

    public static final double SIMILARITY_THRESHOLD = 0.99;
    public static final Duration LOOKBACK_WINDOW = Duration.ofHours(24);

    private static final Comparator<Alert> CANDIDATE_ORDER = Comparator
        .comparing(Alert::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(Alert::getId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final AlertRepository alertRepository;
    private final Clock clock;

    public Optional<Alert> findDuplicate(Alert newAlert) {
        if (!newAlert.hasEmbedding()) {
            log.debug("Alert {} has no embedding, skipping duplicate check", newAlert.getId());
            return Optional.empty();
        }

        Instant end = clock.instant();
        Instant begin = end.minus(LOOKBACK_WINDOW);

        List<Alert> window;
        try {
            window = alertRepository.getAlertsBySpan(begin, end);
        } catch (RuntimeException e) {
            throw new AlertTriageException(String.format(
                "Failed to fetch candidate alerts between %s and %s for alert %s", begin, end, newAlert.getId()), e);
        }

        List<Alert> candidates = window.stream()
            .filter(a -> !a.isBound())
            .filter(Alert::hasEmbedding)
            .filter(a -> !Objects.equals(a.getId(), newAlert.getId()))
            .sorted(CANDIDATE_ORDER)
            .toList();

        Alert best = null;
        double bestSimilarity = SIMILARITY_THRESHOLD;
        for (Alert candidate : candidates) {
            double similarity = VectorSimilarity.cosineSimilarity(newAlert.getEmbedding(), candidate.getEmbedding());
            if (similarity >= SIMILARITY_THRESHOLD && (best == null || similarity > bestSimilarity)) {
                best = candidate;
                bestSimilarity = similarity;
            }
        }

        if (best == null) {
            log.debug("No duplicate for alert {} among {} candidates", newAlert.getId(), candidates.size());
            return Optional.empty();
        }

        log.info("Alert {} duplicates alert {} (similarity {})",
            newAlert.getId(), best.getId(), String.format("%.4f", bestSimilarity));
        return Optional.of(best);
    }
}
