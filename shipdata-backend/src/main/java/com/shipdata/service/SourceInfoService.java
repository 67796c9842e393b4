package com.shipdata.service;

import com.shipdata.adapter.SourceAdapter;
import com.shipdata.adapter.StoreLayout;
import com.shipdata.api.SourceInfoResponse;
import com.shipdata.error.StoreException;
import com.shipdata.model.DataSourceInfo;
import com.shipdata.model.SchemaColumn;
import com.shipdata.model.SourceMetadata;
import com.shipdata.model.SourceType;
import com.shipdata.util.RowChecksums;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Statement;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Describes, measures and clears the active DataSource of a session.
 */
@Slf4j
@Service
public class SourceInfoService {

    private final Map<SourceType, SourceAdapter<?>> adapters = new EnumMap<>(SourceType.class);

    public SourceInfoService(List<SourceAdapter<?>> adapters) {
        for (SourceAdapter<?> adapter : adapters) {
            this.adapters.put(adapter.sourceType(), adapter);
        }
    }

    public SourceInfoResponse getSourceInfo(IngestSession session) {
        return session.withLock(() -> {
            Optional<DataSourceInfo> current = session.getSource();
            if (current.isEmpty()) {
                return SourceInfoResponse.builder().active(false).build();
            }
            DataSourceInfo source = current.get();
            return SourceInfoResponse.builder()
                    .active(true)
                    .sourceType(source.getSourceType())
                    .provenance(source.getProvenance())
                    .rowCount(source.getRowCount())
                    .columnCount(source.getColumnCount())
                    .createdAt(source.getCreatedAt())
                    .columns(source.getColumns())
                    .signature(signature(source.getColumns()))
                    .build();
        });
    }

    /**
     * Row count, column count and source type read back from the store by the adapter that
     * produced the source.
     *
     * @param session session
     * @return metadata
     */
    public SourceMetadata getMetadata(IngestSession session) {
        return session.withLock(() -> {
            DataSourceInfo source = session.requireSource();
            SourceAdapter<?> adapter = adapters.get(source.getSourceType());
            if (adapter == null) {
                throw new StoreException("No adapter registered for " + source.getSourceType(), null);
            }
            return adapter.getMetadata(session.getConnection());
        });
    }

    /**
     * Drop the active DataSource and its overrides. A session without a source is left as is.
     *
     * @param session session
     * @return {@code active=false}
     */
    public SourceInfoResponse clearSource(IngestSession session) {
        return session.withLock(() -> {
            if (session.getSource().isPresent()) {
                try (Statement st = session.getConnection().createStatement()) {
                    st.execute("DROP VIEW IF EXISTS " + StoreLayout.VIEW);
                    st.execute("DROP TABLE IF EXISTS " + StoreLayout.RAW_TABLE);
                }
                session.clearSource();
                log.info("Cleared data source: session_id={}", session.getSessionId());
            }
            return SourceInfoResponse.builder().active(false).build();
        });
    }

    /**
     * Fingerprint of a schema: name, storage type and nullability of every column in order.
     *
     * @param columns columns
     * @return 64 lowercase hex characters
     */
    static String signature(List<SchemaColumn> columns) {
        String canonical = columns.stream()
                .map(c -> c.getName() + ":" + c.getStorageType() + ":" + (c.isNullable() ? 1 : 0))
                .collect(Collectors.joining("|"));
        return RowChecksums.sha256Hex(canonical);
    }
}
