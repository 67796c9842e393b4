package com.shipdata.service;

import com.shipdata.error.StoreException;
import com.shipdata.error.ValidationException;
import com.shipdata.model.ColumnType;
import com.shipdata.model.DataSourceInfo;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One caller's ingestion state: a private in-memory DuckDB database, the active DataSource and
 * its type overrides.
 *
 * <p>Sessions share nothing, so independent sessions may be driven in parallel. Work against a
 * single session is serialized through {@link #withLock(SessionWork)}.
 */
@Slf4j
public class IngestSession implements AutoCloseable {
    private final String sessionId;
    private final Connection connection;
    private final ReentrantLock lock = new ReentrantLock();
    private final OffsetDateTime createdAt;
    private final OffsetDateTime expiresAt;
    private volatile OffsetDateTime lastAccessedAt;

    private DataSourceInfo source;
    private final Map<String, ColumnType> overrides = new LinkedHashMap<>();

    IngestSession(String sessionId, Connection connection, OffsetDateTime createdAt, OffsetDateTime expiresAt) {
        this.sessionId = sessionId;
        this.connection = connection;
        this.createdAt = createdAt;
        this.lastAccessedAt = createdAt;
        this.expiresAt = expiresAt;
    }

    /**
     * Open a session backed by a fresh in-memory DuckDB database.
     *
     * @param sessionId session id
     * @param maxLifetime hard lifetime
     * @return open session
     */
    public static IngestSession open(String sessionId, Duration maxLifetime) {
        try {
            Connection connection = DriverManager.getConnection("jdbc:duckdb:");
            OffsetDateTime now = OffsetDateTime.now();
            return new IngestSession(sessionId, connection, now, now.plus(maxLifetime));
        } catch (SQLException e) {
            throw new StoreException("Failed to open the session store: " + e.getMessage(), e);
        }
    }

    /**
     * Run {@code work} while holding the session lock. {@link SQLException}s escaping the work are
     * local store failures and surface as {@link StoreException}.
     *
     * @param work work to run
     * @param <T> result type
     * @return work result
     */
    public <T> T withLock(SessionWork<T> work) {
        lock.lock();
        try {
            return work.run();
        } catch (SQLException e) {
            throw new StoreException("Session store operation failed: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    public Connection getConnection() {
        return connection;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public OffsetDateTime getLastAccessedAt() {
        return lastAccessedAt;
    }

    void touch() {
        lastAccessedAt = OffsetDateTime.now();
    }

    public Optional<DataSourceInfo> getSource() {
        return Optional.ofNullable(source);
    }

    /**
     * The active DataSource.
     *
     * @return source
     * @throws ValidationException when nothing has been imported
     */
    public DataSourceInfo requireSource() {
        if (source == null) {
            throw new ValidationException("No data source has been imported in this session",
                    "Import a delimited file, spreadsheet or database table first");
        }
        return source;
    }

    /**
     * Replace the active DataSource. Overrides belong to the replaced source and are dropped.
     *
     * @param replacement new source
     */
    void replaceSource(DataSourceInfo replacement) {
        source = replacement;
        overrides.clear();
    }

    void clearSource() {
        source = null;
        overrides.clear();
    }

    public Map<String, ColumnType> getOverrides() {
        return Collections.unmodifiableMap(overrides);
    }

    void putOverride(String column, ColumnType type) {
        overrides.put(column, type);
    }

    void clearOverrides() {
        overrides.clear();
    }

    @Override
    public void close() {
        lock.lock();
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close store for session {}: {}", sessionId, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Work run under the session lock.
     *
     * @param <T> result type
     */
    @FunctionalInterface
    public interface SessionWork<T> {
        T run() throws SQLException;
    }
}
