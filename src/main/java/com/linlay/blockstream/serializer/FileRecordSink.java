package com.linlay.blockstream.serializer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends to a file. Blocking writes, so the sink is always ready.
 */
public class FileRecordSink implements RecordSink {

    private static final Logger log = LoggerFactory.getLogger(FileRecordSink.class);

    private final Path path;
    private final OutputStream out;
    private boolean closed;

    public FileRecordSink(Path path, boolean append) {
        this.path = path;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.out = append
                    ? Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)
                    : Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot open " + path, ex);
        }
    }

    @Override
    public boolean isReady() {
        return true;
    }

    @Override
    public Mono<Void> onReady() {
        return Mono.empty();
    }

    @Override
    public synchronized void write(byte[] bytes) {
        try {
            out.write(bytes);
            out.flush();
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot write " + path, ex);
        }
    }

    @Override
    public synchronized void complete() {
        close();
    }

    @Override
    public synchronized void fail(Throwable error) {
        log.warn("Write to {} aborted: {}", path, error.getMessage());
        close();
    }

    private void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            out.close();
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot close " + path, ex);
        }
    }
}
