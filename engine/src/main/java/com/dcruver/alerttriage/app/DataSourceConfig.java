package com.dcruver.alerttriage.app;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * SQLite alert store. The path arrives with placeholders such as ${user.home}
 * already resolved by Spring.
 *
 * Every connection uses WAL journaling and a busy timeout, so shell commands
 * can read clusters while an ingest is writing.
 */
@Configuration
@Slf4j
public class DataSourceConfig {

    static final String BUSY_TIMEOUT_MS = "5000";

    @Bean
    public DataSource dataSource(@Value("${triage.alerts-db}") String alertsDb) throws IOException {
        Path dbPath = Path.of(alertsDb).toAbsolutePath();
        Files.createDirectories(dbPath.getParent());

        Properties sqlite = new Properties();
        sqlite.setProperty("journal_mode", "WAL");
        sqlite.setProperty("busy_timeout", BUSY_TIMEOUT_MS);

        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + dbPath);
        dataSource.setConnectionProperties(sqlite);

        log.info("Alert store at {}", dbPath);
        return dataSource;
    }
}
