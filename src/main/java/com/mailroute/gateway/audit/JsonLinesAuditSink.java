package com.mailroute.gateway.audit;

import com.mailroute.gateway.model.AuditRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends one JSON object per line to a local file. Writes are serialised
 * so lines never interleave.
 */
public class JsonLinesAuditSink implements AuditSink {

    private final Path file;

    public JsonLinesAuditSink(final Path file) {
        this.file = file;
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialise audit file: " + file, e);
        }
    }

    @Override
    public synchronized void append(final AuditRecord record) {
        final String line = AuditRecordJson.toJson(record) + System.lineSeparator();
        try {
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write audit record to " + file, e);
        }
    }

    public Path getFile() { return file; }
}
