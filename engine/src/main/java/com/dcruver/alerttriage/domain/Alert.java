package com.dcruver.alerttriage.domain;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * A security alert as stored by the alert repository.
 * Read-only to matching and clustering; ingestion produces new copies via @With.
 */
@Value
@Builder
@With
public class Alert {
    String id;
    String title;
    Instant createdAt;

    // Empty or null until the embedding model has run
    float[] embedding;

    // Null or blank means the alert is not bound to a ticket
    String ticketId;

    // Opaque payload, only used for keyword search and keyword extraction
    JsonNode data;

    AlertThread thread;

    public boolean isBound() {
        return ticketId != null && !ticketId.isBlank();
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}
