package com.dcruver.alerttriage.app;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testCreatesParentDirectoriesAndDatabase() throws Exception {
        Path dbPath = tempDir.resolve("nested/dir/alerts.db");

        DataSource dataSource = new DataSourceConfig().dataSource(dbPath.toString());
        new JdbcTemplate(dataSource).execute("CREATE TABLE marker (id TEXT)");

        assertTrue(Files.isDirectory(dbPath.getParent()));
        assertTrue(Files.exists(dbPath));
    }

    @Test
    void testConnectionsUseWalAndBusyTimeout() throws Exception {
        DataSource dataSource = new DataSourceConfig().dataSource(tempDir.resolve("alerts.db").toString());
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);

        assertEquals("wal", jdbcTemplate.queryForObject("PRAGMA journal_mode", String.class).toLowerCase());
        assertEquals(Integer.parseInt(DataSourceConfig.BUSY_TIMEOUT_MS),
            jdbcTemplate.queryForObject("PRAGMA busy_timeout", Integer.class));
    }
}
