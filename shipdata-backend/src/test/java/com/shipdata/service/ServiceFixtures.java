package com.shipdata.service;

import com.shipdata.adapter.DelimitedFileAdapter;
import com.shipdata.adapter.DelimitedImportParameters;
import com.shipdata.adapter.LocalFileAttacher;
import com.shipdata.adapter.RemoteDatabaseAdapter;
import com.shipdata.adapter.SpreadsheetAdapter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;

/**
 * Shared sessions and files for service tests.
 */
final class ServiceFixtures {

    /**
     * Four shipments; {@code code} mixes numbers with one text value, row 3 has no amount and no note.
     */
    static final String SHIPMENTS_CSV = "id,code,amount,shipped,note\n"
            + "1,100,10.5,2026-01-15,alpha\n"
            + "2,200,20.25,2026-01-16,beta\n"
            + "3,ABC,,2026-01-17,\n"
            + "4,400,40,2026-01-18,delta\n";

    private ServiceFixtures() {
    }

    static IngestSession openSession() {
        return IngestSession.open(UUID.randomUUID().toString(), Duration.ofHours(1));
    }

    static ImportService importService() {
        return importService(Path.of("no-remote.duckdb"));
    }

    static ImportService importService(Path remoteFile) {
        return new ImportService(
                new DelimitedFileAdapter(),
                new SpreadsheetAdapter(),
                new RemoteDatabaseAdapter(new LocalFileAttacher(remoteFile), 10_000));
    }

    static Path writeShipments(Path dir) throws IOException {
        return write(dir, "shipments.csv", SHIPMENTS_CSV);
    }

    static Path write(Path dir, String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    static IngestSession sessionWithShipments(Path dir) throws IOException {
        IngestSession session = openSession();
        importService().importDelimited(session, DelimitedImportParameters.builder()
                .path(writeShipments(dir).toString())
                .build());
        return session;
    }
}
