package com.linlay.blockstream.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * NDJSON 写出器：逐批从记录迭代器拉取、编码并写入 {@link RecordSink}。
 * <p>
 * Records are pulled lazily, one batch at a time, and only after the sink reports ready, so
 * at most one encoded batch is held in memory. A batch is encoded completely before any of it
 * reaches the sink: an unencodable record aborts the write without a partial line, leaving
 * earlier batches intact. The sink always receives {@code complete} or {@code fail}.
 */
public class NdjsonStreamSerializer {

    private static final Logger log = LoggerFactory.getLogger(NdjsonStreamSerializer.class);
    private static final byte NEWLINE = '\n';

    private final ObjectMapper objectMapper;
    private final SerializerOptions defaultOptions;

    public NdjsonStreamSerializer(ObjectMapper objectMapper) {
        this(objectMapper, SerializerOptions.defaults());
    }

    public NdjsonStreamSerializer(ObjectMapper objectMapper, SerializerOptions defaultOptions) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.defaultOptions = defaultOptions == null ? SerializerOptions.defaults() : defaultOptions;
    }

    public Mono<WriteReport> writeAll(RecordSink sink, Iterable<?> records) {
        return write(sink, records, 1, defaultOptions);
    }

    public Mono<WriteReport> writeBatched(RecordSink sink, Iterable<?> records, int batchSize) {
        return write(sink, records, batchSize, defaultOptions);
    }

    public Mono<WriteReport> write(RecordSink sink, Iterable<?> records, int batchSize, SerializerOptions options) {
        Objects.requireNonNull(sink, "sink must not be null");
        Objects.requireNonNull(records, "records must not be null");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        SerializerOptions effective = options == null ? defaultOptions : options;
        return Mono.defer(() -> {
            Iterator<?> iterator = records.iterator();
            Progress progress = new Progress();
            return Mono.defer(() -> awaitReady(sink, effective, progress)
                            .then(Mono.fromCallable(() -> writeNextBatch(sink, iterator, batchSize, progress))))
                    .repeat()
                    .takeUntil(more -> !more)
                    .then(Mono.fromCallable(() -> {
                        sink.complete();
                        return progress.toReport();
                    }))
                    .doOnError(ex -> failQuietly(sink, ex))
                    .doOnCancel(() -> failQuietly(sink, new CancellationException("write cancelled")));
        });
    }

    /**
     * Streams the records as a demand-driven byte flux, one NDJSON batch per element.
     */
    public Flux<byte[]> toFlux(Iterable<?> records, int batchSize) {
        return Flux.create(emitter -> {
            FluxRecordSink sink = new FluxRecordSink(emitter);
            emitter.onDispose(write(sink, records, batchSize, SerializerOptions.defaults())
                    .subscribe(
                            report -> log.debug("Streamed {} records in {} batches", report.records(), report.batches()),
                            ex -> log.debug("Streaming write ended with {}", ex.toString())
                    ));
        });
    }

    public byte[] encodeLine(Object record) throws JsonProcessingException {
        byte[] json = objectMapper.writeValueAsBytes(record);
        byte[] line = new byte[json.length + 1];
        System.arraycopy(json, 0, line, 0, json.length);
        line[json.length] = NEWLINE;
        return line;
    }

    private Mono<Void> awaitReady(RecordSink sink, SerializerOptions options, Progress progress) {
        if (sink.isReady()) {
            return Mono.empty();
        }
        if (!options.waitForDrain()) {
            return Mono.error(new BackpressureException("sink is full after " + progress.records + " records"));
        }
        progress.waits++;
        Mono<Void> ready = sink.onReady();
        if (options.drainTimeout() != null && !options.drainTimeout().isZero()) {
            ready = ready.timeout(options.drainTimeout())
                    .onErrorMap(TimeoutException.class, ex -> new BackpressureException(
                            "sink not drained within " + options.drainTimeout().toMillis() + " ms"));
        }
        return ready;
    }

    private boolean writeNextBatch(RecordSink sink, Iterator<?> iterator, int batchSize, Progress progress) {
        ByteArrayOutputStream batch = new ByteArrayOutputStream();
        int count = 0;
        while (count < batchSize && iterator.hasNext()) {
            Object record = iterator.next();
            long index = progress.records + count;
            try {
                batch.writeBytes(encodeLine(record));
            } catch (JsonProcessingException | RuntimeException ex) {
                throw new SerializationException(index, ex);
            }
            count++;
        }
        if (count > 0) {
            sink.write(batch.toByteArray());
            progress.records += count;
            progress.batches++;
            progress.bytes += batch.size();
        }
        return iterator.hasNext();
    }

    private void failQuietly(RecordSink sink, Throwable error) {
        try {
            sink.fail(error);
        } catch (RuntimeException ex) {
            log.warn("Sink failed to close after {}", error.toString(), ex);
        }
    }

    private static final class Progress {
        private long records;
        private int batches;
        private long bytes;
        private int waits;

        private WriteReport toReport() {
            return new WriteReport(records, batches, bytes, waits);
        }
    }
}
