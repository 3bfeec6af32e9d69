package com.linlay.blockstream.serializer;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NdjsonStreamSerializerTest {

    private final NdjsonStreamSerializer serializer = new NdjsonStreamSerializer(new ObjectMapper());

    @TempDir
    Path tempDir;

    @Test
    void writeAllShouldEmitOneLinePerRecord() {
        BoundedBufferSink sink = new BoundedBufferSink(1024);

        WriteReport report = serializer.writeAll(sink, records(3)).block();

        assertThat(sink.contents()).isEqualTo("{\"n\":0}\n{\"n\":1}\n{\"n\":2}\n");
        assertThat(sink.writeLineCounts()).containsExactly(1, 1, 1);
        assertThat(sink.isCompleted()).isTrue();
        assertThat(report).isEqualTo(new WriteReport(3, 3, 24, 0));
    }

    @Test
    void writeBatchedShouldGroupRecordsPerSinkWrite() {
        BoundedBufferSink sink = new BoundedBufferSink(1024);

        WriteReport report = serializer.writeBatched(sink, records(5), 2).block();

        assertThat(sink.writeLineCounts()).containsExactly(2, 2, 1);
        assertThat(sink.contents().lines()).hasSize(5);
        assertThat(report.batches()).isEqualTo(3);
        assertThat(report.records()).isEqualTo(5);
    }

    @Test
    void emptyInputShouldOnlyComplete() {
        BoundedBufferSink sink = new BoundedBufferSink(16);

        WriteReport report = serializer.writeAll(sink, List.of()).block();

        assertThat(sink.contents()).isEmpty();
        assertThat(sink.isCompleted()).isTrue();
        assertThat(report.records()).isZero();
    }

    @Test
    void fullSinkShouldSuspendWriterUntilDrained() {
        BoundedBufferSink sink = new BoundedBufferSink(10);

        CompletableFuture<WriteReport> future = serializer.writeAll(sink, records(5)).toFuture();
        assertThat(future).isNotDone();
        assertThat(sink.bufferedBytes()).isEqualTo(16);

        assertThat(sink.drain()).isEqualTo("{\"n\":0}\n{\"n\":1}\n");
        assertThat(future).isNotDone();
        assertThat(sink.drain()).isEqualTo("{\"n\":2}\n{\"n\":3}\n");

        assertThat(future).isCompleted();
        WriteReport report = future.join();
        assertThat(report.records()).isEqualTo(5);
        assertThat(report.waits()).isEqualTo(2);
        assertThat(sink.contents().lines()).hasSize(5);
    }

    @Test
    void recordsShouldBePulledLazilyWhileSuspended() {
        BoundedBufferSink sink = new BoundedBufferSink(10);
        AtomicInteger pulled = new AtomicInteger();
        Iterable<Object> lazy = () -> records(100).stream().peek(r -> pulled.incrementAndGet()).iterator();

        serializer.writeAll(sink, lazy).subscribe();

        assertThat(pulled.get()).isLessThanOrEqualTo(3);
    }

    @Test
    void failFastShouldRaiseBackpressureException() {
        BoundedBufferSink sink = new BoundedBufferSink(10);

        assertThatThrownBy(() -> serializer.write(sink, records(5), 1, SerializerOptions.failFast()).block())
                .isInstanceOf(BackpressureException.class);
        assertThat(sink.failure()).isInstanceOf(BackpressureException.class);
        assertThat(sink.isCompleted()).isFalse();
    }

    @Test
    void drainTimeoutShouldRaiseBackpressureException() {
        BoundedBufferSink sink = new BoundedBufferSink(10);
        SerializerOptions options = new SerializerOptions(true, Duration.ofMillis(50));

        StepVerifier.create(serializer.write(sink, records(5), 1, options))
                .expectError(BackpressureException.class)
                .verify(Duration.ofSeconds(5));
        assertThat(sink.failure()).isInstanceOf(BackpressureException.class);
    }

    @Test
    void unserializableRecordShouldFailWithoutPartialBatch() {
        BoundedBufferSink sink = new BoundedBufferSink(1024);
        List<Object> records = new ArrayList<>(records(2));
        records.add(Map.of("n", 2));
        records.add(new Object());

        assertThatThrownBy(() -> serializer.writeBatched(sink, records, 2).block())
                .isInstanceOf(SerializationException.class)
                .satisfies(ex -> assertThat(((SerializationException) ex).recordIndex()).isEqualTo(3));
        assertThat(sink.contents()).isEqualTo("{\"n\":0}\n{\"n\":1}\n");
        assertThat(sink.failure()).isInstanceOf(SerializationException.class);
    }

    @Test
    void toFluxShouldFollowDownstreamDemand() {
        StepVerifier.create(serializer.toFlux(records(3), 2).map(bytes -> new String(bytes, StandardCharsets.UTF_8)), 1)
                .expectNext("{\"n\":0}\n{\"n\":1}\n")
                .thenRequest(1)
                .expectNext("{\"n\":2}\n")
                .verifyComplete();
    }

    @Test
    void fileSinkShouldPersistLines() throws Exception {
        Path target = tempDir.resolve("out/records.jsonl");

        serializer.writeBatched(new FileRecordSink(target, false), records(3), 2).block();

        assertThat(Files.readAllLines(target)).containsExactly("{\"n\":0}", "{\"n\":1}", "{\"n\":2}");
    }

    private static List<Object> records(int count) {
        List<Object> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            records.add(Map.of("n", i));
        }
        return records;
    }
}
