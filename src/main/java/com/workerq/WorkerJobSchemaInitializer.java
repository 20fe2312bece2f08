package com.workerq;

import com.workerq.config.WorkerQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the versioned scripts under {@code workerq/migration} before anything touches
 * {@code worker_jobs}. Applied versions and their checksums are recorded, and on PostgreSQL a
 * session advisory lock makes concurrently starting processes migrate one at a time.
 */
@Component
@ConditionalOnProperty(prefix = "workerq.database", name = "skip-create", havingValue = "false",
        matchIfMissing = true)
public class WorkerJobSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(WorkerJobSchemaInitializer.class);

    static final String MIGRATION_LOCATION = "classpath*:workerq/migration/V*__*.sql";
    static final String HISTORY_TABLE = "worker_jobs_schema_history";
    private static final Pattern FILE_NAME = Pattern.compile("^V(\\d+(?:_\\d+)*)__([A-Za-z0-9_\\-]+)\\.sql$");
    private static final long ADVISORY_LOCK_KEY = 0x576f726b65725150L;

    private final DataSource dataSource;
    private final boolean failOnMigrationError;
    private final ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();

    public WorkerJobSchemaInitializer(DataSource dataSource, WorkerQProperties properties) {
        this.dataSource = dataSource;
        this.failOnMigrationError = properties.getDatabase().isFailOnMigrationError();
    }

    @Override
    public void afterPropertiesSet() {
        try (Connection connection = dataSource.getConnection()) {
            boolean locked = lock(connection);
            try {
                migrate(connection);
            } finally {
                if (locked) {
                    unlock(connection);
                }
            }
        } catch (SQLException | IOException | RuntimeException e) {
            if (failOnMigrationError) {
                throw new IllegalStateException("Worker job schema migration failed", e);
            }
            log.error("Worker job schema migration failed, continuing because "
                    + "workerq.database.fail-on-migration-error=false", e);
        }
    }

    private void migrate(Connection connection) throws SQLException, IOException {
        createHistoryTable(connection);
        List<Migration> available = findMigrations();
        if (available.isEmpty()) {
            throw new IllegalStateException("No worker job migrations found at " + MIGRATION_LOCATION);
        }
        Map<String, String> appliedChecksums = appliedChecksums(connection);
        verify(available, appliedChecksums);

        int applied = 0;
        for (Migration migration : available) {
            if (!appliedChecksums.containsKey(migration.version())) {
                apply(connection, migration);
                applied++;
            }
        }
        if (applied == 0) {
            log.info("Worker job schema is up to date ({} migration(s))", appliedChecksums.size());
        } else {
            log.info("Applied {} worker job migration(s)", applied);
        }
    }

    private void createHistoryTable(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        version VARCHAR(50) PRIMARY KEY,
                        description VARCHAR(200) NOT NULL,
                        checksum CHAR(64) NOT NULL,
                        applied_at TIMESTAMPTZ NOT NULL DEFAULT now()
                    )
                    """.formatted(HISTORY_TABLE));
        }
    }

    List<Migration> findMigrations() throws IOException {
        Map<String, Migration> byVersion = new LinkedHashMap<>();
        for (Resource resource : resolver.getResources(MIGRATION_LOCATION)) {
            String fileName = resource.getFilename();
            if (fileName == null) {
                continue;
            }
            Matcher matcher = FILE_NAME.matcher(fileName);
            if (!matcher.matches()) {
                throw new IllegalStateException("Migration file '" + fileName
                        + "' does not follow V<version>__<description>.sql");
            }
            String sql = StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
            Migration migration = new Migration(matcher.group(1), matcher.group(2).replace('_', ' '), fileName, sql,
                    checksum(sql));
            Migration clash = byVersion.putIfAbsent(migration.version(), migration);
            if (clash != null) {
                throw new IllegalStateException("Migration version " + migration.version() + " is defined by both "
                        + clash.fileName() + " and " + fileName);
            }
        }
        List<Migration> sorted = new ArrayList<>(byVersion.values());
        sorted.sort(Comparator.comparing(Migration::version, WorkerJobSchemaInitializer::compareVersions));
        return sorted;
    }

    private Map<String, String> appliedChecksums(Connection connection) throws SQLException {
        Map<String, String> applied = new LinkedHashMap<>();
        try (Statement statement = connection.createStatement();
                ResultSet rows = statement.executeQuery("SELECT version, checksum FROM " + HISTORY_TABLE)) {
            while (rows.next()) {
                applied.put(rows.getString("version"), rows.getString("checksum").trim());
            }
        }
        return applied;
    }

    private void verify(List<Migration> available, Map<String, String> appliedChecksums) {
        Map<String, Migration> byVersion = new LinkedHashMap<>();
        available.forEach(migration -> byVersion.put(migration.version(), migration));
        appliedChecksums.forEach((version, checksum) -> {
            Migration migration = byVersion.get(version);
            if (migration == null) {
                throw new IllegalStateException("Migration V" + version + " is applied but missing from the classpath");
            }
            if (!migration.checksum().equals(checksum)) {
                throw new IllegalStateException("Migration " + migration.fileName() + " changed after it was applied");
            }
        });
    }

    private void apply(Connection connection, Migration migration) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            ScriptUtils.executeSqlScript(connection, new EncodedResource(
                    new ByteArrayResource(migration.sql().getBytes(StandardCharsets.UTF_8), migration.fileName()),
                    StandardCharsets.UTF_8));
            try (PreparedStatement insert = connection.prepareStatement(
                    "INSERT INTO " + HISTORY_TABLE + " (version, description, checksum) VALUES (?, ?, ?)")) {
                insert.setString(1, migration.version());
                insert.setString(2, migration.description());
                insert.setString(3, migration.checksum());
                insert.executeUpdate();
            }
            connection.commit();
            log.info("Applied worker job migration {}", migration.fileName());
        } catch (SQLException | RuntimeException e) {
            connection.rollback();
            throw new IllegalStateException("Failed to apply migration " + migration.fileName(), e);
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    private boolean lock(Connection connection) throws SQLException {
        String product = connection.getMetaData().getDatabaseProductName();
        if (product == null || !product.toLowerCase(Locale.ROOT).contains("postgresql")) {
            return false;
        }
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_lock(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        }
        return true;
    }

    private void unlock(Connection connection) {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        } catch (SQLException e) {
            log.warn("Could not release the worker job migration lock", e);
        }
    }

    static int compareVersions(String left, String right) {
        String[] l = left.split("_");
        String[] r = right.split("_");
        for (int i = 0; i < Math.max(l.length, r.length); i++) {
            long a = i < l.length ? Long.parseLong(l[i]) : 0L;
            long b = i < r.length ? Long.parseLong(r[i]) : 0L;
            if (a != b) {
                return Long.compare(a, b);
            }
        }
        return 0;
    }

    private static String checksum(String sql) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(sql.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    record Migration(String version, String description, String fileName, String sql, String checksum) {
    }
}
