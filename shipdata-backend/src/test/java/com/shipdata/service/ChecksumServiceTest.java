package com.shipdata.service;

import com.shipdata.api.ChecksumVerifyResponse;
import com.shipdata.api.ChecksumsResponse;
import com.shipdata.error.SourceNotFoundException;
import com.shipdata.error.ValidationException;
import com.shipdata.model.RowChecksum;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import static org.assertj.core.api.Assertions.*;

class ChecksumServiceTest {

    private static final String ROW_ONE =
            "74a985cfdf5c9f5bd539f5d012370534bb89c3dcc11e913b65b1d730475f51d4";

    @TempDir
    Path tempDir;

    private final ChecksumService checksumService = new ChecksumService();
    private IngestSession session;

    @BeforeEach
    void setUp() throws IOException {
        session = ServiceFixtures.sessionWithShipments(tempDir);
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    @Test
    void computeChecksums_coversEveryRowByDefault() {
        ChecksumsResponse response = checksumService.computeChecksums(session, null, null);

        assertThat(response.getStartRow()).isEqualTo(1);
        assertThat(response.getEndRow()).isEqualTo(4);
        assertThat(response.getChecksums()).extracting(RowChecksum::getRowNumber).containsExactly(1L, 2L, 3L, 4L);
        assertThat(response.getChecksums().get(0).getChecksum()).isEqualTo(ROW_ONE);
        assertThat(response.getChecksums()).extracting(RowChecksum::getChecksum)
                .allMatch(c -> c.matches("[0-9a-f]{64}"))
                .doesNotHaveDuplicates();
    }

    @Test
    void computeChecksums_clampsRange() {
        ChecksumsResponse response = checksumService.computeChecksums(session, -5L, 99L);

        assertThat(response.getStartRow()).isEqualTo(1);
        assertThat(response.getEndRow()).isEqualTo(4);
        assertThat(response.getChecksums()).hasSize(4);

        assertThat(checksumService.computeChecksums(session, 2L, 3L).getChecksums())
                .extracting(RowChecksum::getRowNumber).containsExactly(2L, 3L);
    }

    @Test
    void computeChecksums_rejectsEmptyRange() {
        assertThatThrownBy(() -> checksumService.computeChecksums(session, 3L, 2L))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> checksumService.computeChecksums(session, 10L, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void verify_acceptsMatchIgnoringCaseAndWhitespace() {
        ChecksumVerifyResponse response = checksumService.verifyChecksum(session, 1,
                "  " + ROW_ONE.toUpperCase(Locale.ROOT) + " ");

        assertThat(response.isMatches()).isTrue();
        assertThat(response.getActualChecksum()).isEqualTo(ROW_ONE);
        assertThat(response.getExpectedChecksum()).isEqualTo(ROW_ONE.toUpperCase(Locale.ROOT));
    }

    @Test
    void verify_reportsMismatchWithActualDigest() {
        ChecksumVerifyResponse response = checksumService.verifyChecksum(session, 2, ROW_ONE);

        assertThat(response.isMatches()).isFalse();
        assertThat(response.getRowNumber()).isEqualTo(2);
        assertThat(response.getActualChecksum()).isNotEqualTo(ROW_ONE);
    }

    @Test
    void verify_rejectsBlankAndOutOfRange() {
        assertThatThrownBy(() -> checksumService.verifyChecksum(session, 1, " "))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> checksumService.verifyChecksum(session, 5, ROW_ONE))
                .isInstanceOf(SourceNotFoundException.class);
    }

    @Test
    void checksums_doNotChangeWithOverrides() {
        ChecksumsResponse before = checksumService.computeChecksums(session, null, null);

        new SchemaService().overrideColumnType(session, "code", "integer");

        assertThat(checksumService.computeChecksums(session, null, null)).isEqualTo(before);
        assertThat(new QueryService(1000, 100).getRow(session, 1).getChecksum()).isEqualTo(ROW_ONE);
    }

    @Test
    void checksums_areDeterministicAcrossSessions() throws IOException {
        Path copy = Files.createDirectory(tempDir.resolve("copy"));
        try (IngestSession other = ServiceFixtures.sessionWithShipments(copy)) {
            assertThat(checksumService.computeChecksums(other, null, null))
                    .isEqualTo(checksumService.computeChecksums(session, null, null));
        }
    }
}
