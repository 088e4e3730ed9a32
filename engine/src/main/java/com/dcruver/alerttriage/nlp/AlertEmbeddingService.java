package com.dcruver.alerttriage.nlp;

import com.dcruver.alerttriage.domain.Alert;
import com.dcruver.alerttriage.domain.AlertTriageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Embeds alert payloads with the configured Spring AI EmbeddingModel (Ollama).
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "triage.embedding.enabled", havingValue = "true", matchIfMissing = true)
public class AlertEmbeddingService {

    private final EmbeddingModel embeddingModel;
    private final ObjectMapper objectMapper;

    public AlertEmbeddingService(EmbeddingModel embeddingModel, ObjectMapper objectMapper) {
        this.embeddingModel = embeddingModel;
        this.objectMapper = objectMapper;
        log.info("AlertEmbeddingService initialized with EmbeddingModel: {}", embeddingModel.getClass().getSimpleName());
    }

    /**
     * Embed the serialized data of an alert. An alert without data gets an empty vector.
     */
    public float[] embed(Alert alert) {
        if (alert.getData() == null || alert.getData().isNull()) {
            log.warn("Alert {} has no data to embed", alert.getId());
            return new float[0];
        }

        try {
            return embed(objectMapper.writeValueAsString(alert.getData()));
        } catch (JsonProcessingException e) {
            throw new AlertTriageException("Failed to serialize data of alert " + alert.getId(), e);
        }
    }

    /**
     * Generate embedding for a single text
     */
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            log.warn("Cannot generate embedding for empty text");
            return new float[0];
        }

        try {
            EmbeddingResponse response = embeddingModel.embedForResponse(List.of(text));
            if (response.getResults().isEmpty()) {
                throw new AlertTriageException("Embedding model returned no result");
            }
            return response.getResults().get(0).getOutput();
        } catch (AlertTriageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AlertTriageException("Failed to generate embedding", e);
        }
    }
}
