package com.shipdata.service;

import com.shipdata.api.ChecksumVerifyResponse;
import com.shipdata.api.ChecksumsResponse;
import com.shipdata.error.SourceNotFoundException;
import com.shipdata.error.ValidationException;
import com.shipdata.model.DataSourceInfo;
import com.shipdata.model.RowChecksum;
import com.shipdata.util.RowChecksums;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Per-row SHA-256 digests over stored values. Type overrides do not change a row's checksum.
 */
@Slf4j
@Service
public class ChecksumService {

    /**
     * Checksums for an inclusive ordinal range, clamped to the rows that exist.
     *
     * @param session session
     * @param startRow first ordinal, 1 when null
     * @param endRow last ordinal, the row count when null
     * @return checksums in ordinal order
     * @throws ValidationException when the clamped range is empty
     */
    public ChecksumsResponse computeChecksums(IngestSession session, Long startRow, Long endRow) {
        return session.withLock(() -> {
            DataSourceInfo source = session.requireSource();
            long start = startRow == null ? 1 : Math.max(1, startRow);
            long end = endRow == null ? source.getRowCount() : Math.min(source.getRowCount(), endRow);
            if (start > end) {
                throw new ValidationException(
                        String.format("Empty row range %d..%d; the source has %d rows", start, end, source.getRowCount()),
                        "Use a start_row not greater than end_row, within 1.." + source.getRowCount());
            }

            RowProjection projection = new RowProjection(source.getColumns(), Map.of());
            List<RowChecksum> checksums = new ArrayList<>();
            try (PreparedStatement ps = session.getConnection().prepareStatement(projection.fromRaw()
                    + " WHERE src._row_num BETWEEN ? AND ? ORDER BY src._row_num")) {
                ps.setLong(1, start);
                ps.setLong(2, end);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        checksums.add(new RowChecksum(rs.getLong(1), projection.read(rs).getChecksum()));
                    }
                }
            }
            return ChecksumsResponse.builder()
                    .startRow(start)
                    .endRow(end)
                    .checksums(checksums)
                    .build();
        });
    }

    /**
     * Compare a caller supplied checksum with the current digest of one row.
     *
     * @param session session
     * @param rowNumber ordinal
     * @param expectedChecksum hex digest, compared ignoring case and surrounding whitespace
     * @return verification outcome carrying the actual digest
     * @throws SourceNotFoundException when the ordinal is out of range
     */
    public ChecksumVerifyResponse verifyChecksum(IngestSession session, long rowNumber, String expectedChecksum) {
        if (expectedChecksum == null || expectedChecksum.isBlank()) {
            throw new ValidationException("expected_checksum is required",
                    "Pass the " + RowChecksums.HEX_LENGTH + "-character hex digest previously returned for the row");
        }
        return session.withLock(() -> {
            DataSourceInfo source = session.requireSource();
            QueryService.requireRowInRange(source, rowNumber);
            RowProjection projection = new RowProjection(source.getColumns(), Map.of());
            String actual;
            try (PreparedStatement ps = session.getConnection().prepareStatement(
                    projection.fromRaw() + " WHERE src._row_num = ?")) {
                ps.setLong(1, rowNumber);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw new SourceNotFoundException("Row " + rowNumber + " not found");
                    }
                    actual = projection.read(rs).getChecksum();
                }
            }
            boolean matches = RowChecksums.matches(expectedChecksum, actual);
            if (!matches) {
                log.info("Checksum mismatch: session_id={}, row={}", session.getSessionId(), rowNumber);
            }
            return ChecksumVerifyResponse.builder()
                    .rowNumber(rowNumber)
                    .matches(matches)
                    .expectedChecksum(expectedChecksum.trim())
                    .actualChecksum(actual)
                    .build();
        });
    }
}
