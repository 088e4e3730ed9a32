package com.dcruver.alerttriage.io;

import com.dcruver.alerttriage.domain.Alert;
import com.dcruver.alerttriage.domain.AlertThread;
import com.dcruver.alerttriage.domain.AlertTriageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Stores alerts in SQLite. Embeddings and payloads are kept as JSON text.
 */
@Repository
@Slf4j
public class JdbcAlertRepository implements AlertRepository {

    private static final String COLUMNS =
        "id, title, created_at, ticket_id, data_json, embedding_json, thread_channel, thread_id";

    // SQLite caps bound parameters per statement
    private static final int BATCH_SIZE = 500;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final AlertRowMapper rowMapper = new AlertRowMapper();

    public JdbcAlertRepository(DataSource dataSource, ObjectMapper objectMapper) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS alerts (
                id TEXT PRIMARY KEY,
                title TEXT,
                created_at INTEGER NOT NULL,
                ticket_id TEXT,
                data_json TEXT,
                embedding_json TEXT,
                thread_channel TEXT,
                thread_id TEXT
            )
            """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_alerts_created
            ON alerts(created_at, id)
            """);

        log.info("Initialized alert store");
    }

    @Override
    public Optional<Alert> getAlert(String alertId) {
        try {
            List<Alert> results = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM alerts WHERE id = ?",
                rowMapper,
                alertId
            );
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (DataAccessException e) {
            throw new AlertTriageException("Failed to get alert " + alertId, e);
        }
    }

    @Override
    public List<Alert> getAlertsBySpan(Instant begin, Instant end) {
        try {
            return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM alerts WHERE created_at >= ? AND created_at <= ? ORDER BY created_at, id",
                rowMapper,
                begin.toEpochMilli(), end.toEpochMilli()
            );
        } catch (DataAccessException e) {
            throw new AlertTriageException(String.format("Failed to get alerts between %s and %s", begin, end), e);
        }
    }

    @Override
    public List<Alert> getAlertWithoutTicket(int offset, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM alerts WHERE ticket_id IS NULL OR ticket_id = '' ORDER BY created_at, id";
        try {
            if (limit <= 0) {
                return offset > 0
                    ? jdbcTemplate.query(sql + " LIMIT -1 OFFSET ?", rowMapper, offset)
                    : jdbcTemplate.query(sql, rowMapper);
            }
            return jdbcTemplate.query(sql + " LIMIT ? OFFSET ?", rowMapper, limit, Math.max(0, offset));
        } catch (DataAccessException e) {
            throw new AlertTriageException(String.format(
                "Failed to get alerts without ticket (offset %d, limit %d)", offset, limit), e);
        }
    }

    @Override
    public List<Alert> batchGetAlerts(Collection<String> alertIds) {
        if (alertIds == null || alertIds.isEmpty()) {
            return List.of();
        }

        List<String> ids = List.copyOf(alertIds);
        List<Alert> alerts = new ArrayList<>(ids.size());
        try {
            for (int from = 0; from < ids.size(); from += BATCH_SIZE) {
                List<String> chunk = ids.subList(from, Math.min(ids.size(), from + BATCH_SIZE));
                String placeholders = String.join(",", Collections.nCopies(chunk.size(), "?"));
                alerts.addAll(jdbcTemplate.query(
                    "SELECT " + COLUMNS + " FROM alerts WHERE id IN (" + placeholders + ") ORDER BY created_at, id",
                    rowMapper,
                    chunk.toArray()
                ));
            }
        } catch (DataAccessException e) {
            throw new AlertTriageException("Failed to batch get " + ids.size() + " alerts", e);
        }
        return alerts;
    }

    @Override
    public void putAlert(Alert alert) {
        try {
            AlertThread thread = alert.getThread();
            jdbcTemplate.update(
                "INSERT OR REPLACE INTO alerts (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                alert.getId(),
                alert.getTitle(),
                alert.getCreatedAt().toEpochMilli(),
                alert.getTicketId(),
                alert.getData() == null ? null : objectMapper.writeValueAsString(alert.getData()),
                alert.hasEmbedding() ? objectMapper.writeValueAsString(alert.getEmbedding()) : null,
                thread == null ? null : thread.channelId(),
                thread == null ? null : thread.threadId()
            );
            log.debug("Stored alert {}", alert.getId());
        } catch (JsonProcessingException | DataAccessException e) {
            throw new AlertTriageException("Failed to put alert " + alert.getId(), e);
        }
    }

    /**
     * Row mapper for Alert
     */
    private class AlertRowMapper implements RowMapper<Alert> {
        @Override
        public Alert mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                String dataJson = rs.getString("data_json");
                String embeddingJson = rs.getString("embedding_json");
                String threadChannel = rs.getString("thread_channel");

                return Alert.builder()
                    .id(rs.getString("id"))
                    .title(rs.getString("title"))
                    .createdAt(Instant.ofEpochMilli(rs.getLong("created_at")))
                    .ticketId(rs.getString("ticket_id"))
                    .data(dataJson == null ? null : objectMapper.readTree(dataJson))
                    .embedding(embeddingJson == null ? new float[0] : objectMapper.readValue(embeddingJson, float[].class))
                    .thread(threadChannel == null ? null : new AlertThread(threadChannel, rs.getString("thread_id")))
                    .build();
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to deserialize alert " + rs.getString("id"), e);
            }
        }
    }
}
