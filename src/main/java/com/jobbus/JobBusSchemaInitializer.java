package com.jobbus;

import com.jobbus.config.JobBusProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
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
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the versioned SQL scripts under {@code jobbus/migration} once per database.
 * <p>
 * Applied versions and their SHA-256 checksums are recorded in {@code jobbus_schema_migrations};
 * a script that changed after being applied, or an applied version missing from the classpath,
 * stops startup. Concurrent starters serialize on a PostgreSQL advisory lock.
 */
@Component
@ConditionalOnProperty(prefix = "jobbus.database", name = "skip-create", havingValue = "false", matchIfMissing = true)
public class JobBusSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(JobBusSchemaInitializer.class);

    private static final String MIGRATION_LOCATION = "classpath*:jobbus/migration/V*__*.sql";
    private static final Pattern SCRIPT_NAME = Pattern.compile("^V(\\d+(?:_\\d+)*)__([A-Za-z0-9_\\-]+)\\.sql$");
    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern PREFIXED_IDENTIFIER =
            Pattern.compile("\\b(idx_jobbus_|jobbus_(?:topics|subscriptions|messages)\\b)");
    private static final long ADVISORY_LOCK_KEY = 5_106_734_228_910_347_119L;

    private final DataSource dataSource;
    private final PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
    private final String tablePrefix;
    private final boolean failOnMigrationError;

    public JobBusSchemaInitializer(
            DataSource dataSource,
            ObjectProvider<JobBusProperties> propertiesProvider,
            Environment environment) {
        this.dataSource = dataSource;
        JobBusProperties properties = propertiesProvider.getIfAvailable();
        this.tablePrefix = normalizePrefix(properties != null
                ? properties.getDatabase().getTablePrefix()
                : environment.getProperty("jobbus.database.table-prefix", ""));
        this.failOnMigrationError = properties != null
                ? properties.getDatabase().isFailOnMigrationError()
                : environment.getProperty("jobbus.database.fail-on-migration-error", Boolean.class, true);
    }

    @Override
    public void afterPropertiesSet() {
        String historyTable = tablePrefix + "jobbus_schema_migrations";
        log.info("Initializing JobBus database schema using {}", historyTable);

        try (Connection connection = dataSource.getConnection()) {
            boolean locked = lock(connection);
            try {
                migrate(connection, historyTable);
            } finally {
                if (locked) {
                    unlock(connection);
                }
            }
        } catch (Exception e) {
            String message = "Failed to initialize JobBus database schema";
            if (failOnMigrationError) {
                throw new IllegalStateException(message, e);
            }
            log.error("{} (continuing because jobbus.database.fail-on-migration-error=false)", message, e);
        }
    }

    private void migrate(Connection connection, String historyTable) throws SQLException, IOException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        version VARCHAR(64) PRIMARY KEY,
                        description VARCHAR(255) NOT NULL,
                        checksum VARCHAR(64) NOT NULL,
                        installed_on TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,
                        execution_time_ms BIGINT NOT NULL
                    )
                    """.formatted(historyTable));
        }

        List<Script> scripts = loadScripts();
        if (scripts.isEmpty()) {
            throw new IllegalStateException("No JobBus migrations found at " + MIGRATION_LOCATION);
        }
        Map<String, String> appliedChecksums = loadAppliedChecksums(connection, historyTable);
        verifyHistory(scripts, appliedChecksums);

        int applied = 0;
        for (Script script : scripts) {
            if (!appliedChecksums.containsKey(script.version())) {
                apply(connection, historyTable, script);
                applied++;
            }
        }
        if (applied == 0) {
            log.info("JobBus schema is up to date ({} migration(s) applied earlier)", appliedChecksums.size());
        } else {
            log.info("Applied {} JobBus migration(s)", applied);
        }
    }

    private List<Script> loadScripts() throws IOException {
        List<Script> scripts = new ArrayList<>();
        Map<String, String> fileByVersion = new LinkedHashMap<>();
        for (Resource resource : resolver.getResources(MIGRATION_LOCATION)) {
            String fileName = resource.getFilename();
            if (fileName == null) {
                continue;
            }
            Matcher matcher = SCRIPT_NAME.matcher(fileName);
            if (!matcher.matches()) {
                throw new IllegalStateException("Invalid JobBus migration file name '" + fileName
                        + "', expected V{version}__{description}.sql");
            }
            String version = matcher.group(1);
            String duplicate = fileByVersion.putIfAbsent(version, fileName);
            if (duplicate != null) {
                throw new IllegalStateException("JobBus migration version V" + version + " is defined by both "
                        + duplicate + " and " + fileName);
            }
            String sql = StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
            scripts.add(new Script(version, matcher.group(2).replace('_', ' '), fileName, sql, sha256(sql)));
        }
        scripts.sort(Comparator.comparing(Script::version, JobBusSchemaInitializer::compareVersions));
        return scripts;
    }

    private Map<String, String> loadAppliedChecksums(Connection connection, String historyTable) throws SQLException {
        Map<String, String> applied = new LinkedHashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT version, checksum FROM " + historyTable);
                ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                applied.put(rs.getString("version"), rs.getString("checksum"));
            }
        }
        return applied;
    }

    private void verifyHistory(List<Script> scripts, Map<String, String> appliedChecksums) {
        Map<String, Script> byVersion = new LinkedHashMap<>();
        for (Script script : scripts) {
            byVersion.put(script.version(), script);
        }
        for (Map.Entry<String, String> applied : appliedChecksums.entrySet()) {
            Script script = byVersion.get(applied.getKey());
            if (script == null) {
                throw new IllegalStateException("JobBus migration V" + applied.getKey()
                        + " is recorded as applied but missing from the classpath");
            }
            if (!script.checksum().equals(applied.getValue())) {
                throw new IllegalStateException("JobBus migration V" + applied.getKey()
                        + " changed after it was applied (checksum mismatch)");
            }
        }
    }

    private void apply(Connection connection, String historyTable, Script script) {
        long started = System.nanoTime();
        boolean autoCommit = true;
        try {
            autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);

            byte[] rendered = renderMigrationSql(script.sql()).getBytes(StandardCharsets.UTF_8);
            ScriptUtils.executeSqlScript(connection,
                    new EncodedResource(new ByteArrayResource(rendered, script.fileName()), StandardCharsets.UTF_8));

            long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
            try (PreparedStatement statement = connection.prepareStatement("INSERT INTO " + historyTable
                    + " (version, description, checksum, execution_time_ms) VALUES (?, ?, ?, ?)")) {
                statement.setString(1, script.version());
                statement.setString(2, script.description());
                statement.setString(3, script.checksum());
                statement.setLong(4, elapsedMs);
                statement.executeUpdate();
            }
            connection.commit();
            log.info("Applied JobBus migration V{} ({}) in {} ms", script.version(), script.description(), elapsedMs);
        } catch (Exception e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw new IllegalStateException("Failed to apply JobBus migration V" + script.version()
                    + " (" + script.description() + ")", e);
        } finally {
            try {
                connection.setAutoCommit(autoCommit);
            } catch (SQLException e) {
                log.warn("Could not restore auto-commit after JobBus migration", e);
            }
        }
    }

    String renderMigrationSql(String sql) {
        if (tablePrefix.isEmpty()) {
            return sql;
        }
        return PREFIXED_IDENTIFIER.matcher(sql).replaceAll(match -> tablePrefix + match.group(1));
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
            log.warn("Failed to release JobBus schema migration lock", e);
        }
    }

    private static String normalizePrefix(String configuredPrefix) {
        String trimmed = configuredPrefix == null ? "" : configuredPrefix.trim();
        if (!trimmed.isEmpty() && !SAFE_IDENTIFIER.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Unsupported JobBus table-prefix: " + trimmed);
        }
        return trimmed;
    }

    private static int compareVersions(String left, String right) {
        int[] l = Arrays.stream(left.split("_")).mapToInt(Integer::parseInt).toArray();
        int[] r = Arrays.stream(right.split("_")).mapToInt(Integer::parseInt).toArray();
        for (int i = 0; i < Math.max(l.length, r.length); i++) {
            int a = i < l.length ? l[i] : 0;
            int b = i < r.length ? r[i] : 0;
            if (a != b) {
                return Integer.compare(a, b);
            }
        }
        return 0;
    }

    private static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private record Script(String version, String description, String fileName, String sql, String checksum) {
    }
}
