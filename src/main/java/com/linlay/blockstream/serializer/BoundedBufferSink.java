package com.linlay.blockstream.serializer;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory sink that reports itself full once {@code capacityBytes} are buffered.
 * A single write is always accepted, so the buffer overshoots by at most one batch.
 * {@link #drain()} empties it and wakes waiting writers.
 */
public class BoundedBufferSink extends AbstractRecordSink {

    private final int capacityBytes;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final List<Integer> writeLineCounts = new ArrayList<>();
    private final StringBuilder drained = new StringBuilder();
    private boolean completed;
    private Throwable failure;

    public BoundedBufferSink(int capacityBytes) {
        if (capacityBytes <= 0) {
            throw new IllegalArgumentException("capacityBytes must be positive");
        }
        this.capacityBytes = capacityBytes;
    }

    @Override
    public synchronized boolean isReady() {
        return !completed && failure == null && buffer.size() < capacityBytes;
    }

    @Override
    public synchronized void write(byte[] bytes) {
        if (completed || failure != null) {
            throw new IllegalStateException("sink already closed");
        }
        buffer.writeBytes(bytes);
        int lines = 0;
        for (byte b : bytes) {
            if (b == '\n') {
                lines++;
            }
        }
        writeLineCounts.add(lines);
    }

    public String drain() {
        String content;
        synchronized (this) {
            content = buffer.toString(StandardCharsets.UTF_8);
            drained.append(content);
            buffer.reset();
        }
        signalReady();
        return content;
    }

    @Override
    public synchronized void complete() {
        completed = true;
    }

    @Override
    public synchronized void fail(Throwable error) {
        failure = error;
    }

    public synchronized int bufferedBytes() {
        return buffer.size();
    }

    /**
     * Everything ever written, drained or not.
     */
    public synchronized String contents() {
        return drained + buffer.toString(StandardCharsets.UTF_8);
    }

    /**
     * Number of NDJSON lines carried by each write, in order.
     */
    public synchronized List<Integer> writeLineCounts() {
        return List.copyOf(writeLineCounts);
    }

    public synchronized boolean isCompleted() {
        return completed;
    }

    public synchronized Throwable failure() {
        return failure;
    }
}
