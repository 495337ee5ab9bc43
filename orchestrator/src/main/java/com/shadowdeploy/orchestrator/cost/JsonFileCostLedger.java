package com.shadowdeploy.orchestrator.cost;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Cost ledger kept as a single JSON document.
 *
 * Appends are read-modify-write under the write lock and land on disk via a
 * temp file plus atomic rename, so readers never see a half-written file.
 */
@Component
public class JsonFileCostLedger implements CostLedger {

    private static final Logger log = LoggerFactory.getLogger(JsonFileCostLedger.class);

    private final Path          file;
    private final ObjectMapper  json;
    private final Clock         clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public JsonFileCostLedger(@Value("${shadowdeploy.cost.ledger-path}") Path file,
                              ObjectMapper objectMapper,
                              Clock clock) {
        this.file  = file;
        this.json  = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    public Path file() {
        return file;
    }

    @Override
    public LedgerDocument append(ExecutionRecord record) {
        lock.writeLock().lock();
        try {
            LedgerDocument updated = read().append(record, clock.instant());
            write(updated);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public LedgerDocument load() {
        lock.readLock().lock();
        try {
            return read();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            write(LedgerDocument.empty(clock.instant()));
            log.info("Cost metrics cleared");
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ------------------------------------------------------------------
    // File I/O (callers hold the lock)
    // ------------------------------------------------------------------

    private LedgerDocument read() {
        if (!Files.exists(file)) {
            return LedgerDocument.empty(clock.instant());
        }
        try {
            return json.readValue(file.toFile(), LedgerDocument.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read cost ledger " + file, e);
        }
    }

    private void write(LedgerDocument document) {
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try {
                json.writeValue(tmp.toFile(), document);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write cost ledger " + file, e);
        }
    }
}
