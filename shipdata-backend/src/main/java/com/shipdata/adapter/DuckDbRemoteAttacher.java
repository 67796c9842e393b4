package com.shipdata.adapter;

import com.shipdata.error.RemoteConnectionException;
import com.shipdata.util.ConnectionStringParser.ParsedConnectionString;
import com.shipdata.util.DatabaseFamily;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import static com.shipdata.util.SqlIdentifiers.literal;

/**
 * Attaches Postgres and MySQL databases through DuckDB's {@code postgres} and {@code mysql}
 * extensions.
 */
@Slf4j
@Component
public class DuckDbRemoteAttacher implements RemoteAttacher {

    @Override
    public RemoteAttachment attach(Connection connection, ParsedConnectionString target) {
        DatabaseFamily family = target.getFamily();
        String alias = "remote_" + StagingTable.randomHex(6);

        try (Statement st = connection.createStatement()) {
            loadExtension(st, family);
        } catch (SQLException e) {
            log.warn("Failed to load the {} extension: {}", family.getAttachType(), target.scrub(e.getMessage()));
            throw new RemoteConnectionException(family.getDisplayName(),
                    "Could not load the " + family.getAttachType() + " extension: " + target.scrub(e.getMessage()));
        }

        try (Statement st = connection.createStatement()) {
            st.execute(attachStatement(alias, target));
        } catch (SQLException e) {
            String reason = target.scrub(e.getMessage());
            log.warn("Attach failed for {}: {}", target, reason);
            throw new RemoteConnectionException(family.getDisplayName(),
                    "Could not connect to " + target.describe() + ": " + reason);
        }
        log.info("Attached {} read-only as {}", target, alias);
        return new RemoteAttachment(connection, alias, family);
    }

    /**
     * Make the scanner extension for {@code family} available.
     *
     * @param st statement on the session connection
     * @param family database family
     * @throws SQLException when install or load fails
     */
    protected void loadExtension(Statement st, DatabaseFamily family) throws SQLException {
        st.execute("INSTALL " + family.getAttachType());
        st.execute("LOAD " + family.getAttachType());
    }

    /**
     * The {@code ATTACH} statement. Contains credentials: never log the result.
     *
     * @param alias local alias
     * @param target parsed connection string
     * @return statement text
     */
    protected String attachStatement(String alias, ParsedConnectionString target) {
        return "ATTACH " + literal(target.toAttachTarget()) + " AS " + alias
                + " (TYPE " + target.getFamily().getAttachType() + ", READ_ONLY)";
    }
}
