package com.linlay.blockstream.stream.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.blockstream.cache.ContinuationCache;
import com.linlay.blockstream.cache.ThoughtSignatureCapture;
import com.linlay.blockstream.cancel.CancelReason;
import com.linlay.blockstream.cancel.CancellationSignal;
import com.linlay.blockstream.cancel.IdleAbortTimer;
import com.linlay.blockstream.stream.model.Chunk;
import com.linlay.blockstream.stream.model.ErrorKind;
import com.linlay.blockstream.stream.model.IdleTimeoutMessage;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class ChunkAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
    private final CancellationSignal signal = new CancellationSignal();

    @Test
    void shouldEmitDeltasThenProviderFinish() {
        List<Chunk> chunks = adapter(0).processStream(
                reader(part("text-delta", "Hel"), part("text-delta", "lo"), finish("stop")),
                Mono.just("Hello")
        ).collectList().block(Duration.ofSeconds(1));

        assertThat(chunks).containsExactly(
                new Chunk.TextDelta("Hel"),
                new Chunk.TextDelta("lo"),
                new Chunk.Finish("stop")
        );
    }

    @Test
    void consistencyPassShouldAppendMissingSuffixBeforeFinish() {
        List<Chunk> chunks = adapter(0).processStream(
                reader(part("text-delta", "Hel"), finish("stop")),
                Mono.just("Hello")
        ).collectList().block(Duration.ofSeconds(1));

        assertThat(chunks).containsExactly(
                new Chunk.TextDelta("Hel"),
                new Chunk.TextDelta("lo"),
                new Chunk.Finish("stop")
        );
    }

    @Test
    void divergingFinalTextShouldBeIgnored() {
        List<Chunk> chunks = adapter(0).processStream(
                reader(part("text-delta", "abc")),
                Mono.just("xyz")
        ).collectList().block(Duration.ofSeconds(1));

        assertThat(chunks).containsExactly(
                new Chunk.TextDelta("abc"),
                new Chunk.Finish(Chunk.Finish.STOP)
        );
    }

    @Test
    void idleTimeoutShouldEmitTimeoutErrorThenAbortedFinish() {
        Sinks.Many<JsonNode> source = Sinks.many().unicast().onBackpressureBuffer();
        List<Chunk> chunks = new CopyOnWriteArrayList<>();
        AtomicBoolean completed = new AtomicBoolean();

        adapter(1_000).processStream(new FluxStreamReader<>(source.asFlux()), Mono.never())
                .subscribe(chunks::add, error -> { }, () -> completed.set(true));
        source.tryEmitNext(part("text-delta", "A"));

        scheduler.advanceTimeBy(Duration.ofMillis(999));
        assertThat(signal.isCancelled()).isFalse();

        scheduler.advanceTimeBy(Duration.ofMillis(1));
        assertThat(signal.isCancelled()).isTrue();
        assertThat(signal.reason()).isEqualTo(CancelReason.IDLE_TIMEOUT);
        assertThat(completed.get()).isTrue();
        assertThat(chunks).containsExactly(
                new Chunk.TextDelta("A"),
                new Chunk.Error(ErrorKind.TIMEOUT, "SSE idle timeout after 0.02 minutes", 1_000L),
                new Chunk.Finish(Chunk.Finish.ABORTED)
        );
        assertThat(source.currentSubscriberCount()).isZero();
    }

    @Test
    void eventsShouldKeepStreamAlivePastTimeout() {
        Sinks.Many<JsonNode> source = Sinks.many().unicast().onBackpressureBuffer();
        List<Chunk> chunks = new CopyOnWriteArrayList<>();

        adapter(1_000).processStream(new FluxStreamReader<>(source.asFlux()), Mono.empty())
                .subscribe(chunks::add);
        for (int i = 0; i < 5; i++) {
            scheduler.advanceTimeBy(Duration.ofMillis(800));
            source.tryEmitNext(part("text-delta", String.valueOf(i)));
        }
        source.tryEmitComplete();

        assertThat(signal.isCancelled()).isFalse();
        assertThat(chunks).hasSize(6);
        assertThat(chunks.get(5)).isEqualTo(new Chunk.Finish(Chunk.Finish.STOP));
    }

    @Test
    void malformedEventShouldNotStopTheStream() {
        List<Chunk> chunks = adapter(0).processStream(
                reader(part("text-delta", "A"), json("{\"type\":\"mystery\"}"), part("text-delta", "B"), finish("stop")),
                null
        ).collectList().block(Duration.ofSeconds(1));

        assertThat(chunks).hasSize(4);
        assertThat(chunks.get(0)).isEqualTo(new Chunk.TextDelta("A"));
        assertThat(chunks.get(1)).isInstanceOfSatisfying(Chunk.Error.class,
                error -> assertThat(error.kind()).isEqualTo(ErrorKind.PROTOCOL));
        assertThat(chunks.get(2)).isEqualTo(new Chunk.TextDelta("B"));
        assertThat(chunks.get(3)).isEqualTo(new Chunk.Finish("stop"));
    }

    @Test
    void malformedFinishShouldEndStreamWithError() {
        List<Chunk> chunks = adapter(0).processStream(
                reader(part("text-delta", "A"), json("{\"type\":\"finish\",\"finishReason\":42}"), part("text-delta", "B")),
                Mono.just("AB")
        ).collectList().block(Duration.ofSeconds(1));

        assertThat(chunks).hasSize(3);
        assertThat(chunks.get(1)).isInstanceOfSatisfying(Chunk.Error.class,
                error -> assertThat(error.kind()).isEqualTo(ErrorKind.PROTOCOL));
        assertThat(chunks.get(2)).isEqualTo(new Chunk.Finish(Chunk.Finish.ERROR));
    }

    @Test
    void providerAbortShouldShortCircuit() {
        List<Chunk> chunks = adapter(0).processStream(
                reader(part("text-delta", "A"), json("{\"type\":\"abort\"}"), part("text-delta", "B")),
                Mono.just("AB")
        ).collectList().block(Duration.ofSeconds(1));

        assertThat(chunks).containsExactly(new Chunk.TextDelta("A"), new Chunk.Finish(Chunk.Finish.ABORTED));
        assertThat(signal.reason()).isEqualTo(CancelReason.PROVIDER_ABORT);
    }

    @Test
    void callerCancelShouldStopReadingAndReleaseReader() {
        Sinks.Many<JsonNode> source = Sinks.many().unicast().onBackpressureBuffer();
        List<Chunk> chunks = new CopyOnWriteArrayList<>();

        adapter(1_000).processStream(new FluxStreamReader<>(source.asFlux()), Mono.never())
                .subscribe(chunks::add);
        source.tryEmitNext(part("text-delta", "A"));
        signal.cancel(CancelReason.CALLER);
        signal.cancel(CancelReason.CALLER);
        scheduler.advanceTimeBy(Duration.ofSeconds(5));

        assertThat(chunks).containsExactly(new Chunk.TextDelta("A"), new Chunk.Finish(Chunk.Finish.ABORTED));
        assertThat(source.currentSubscriberCount()).isZero();
    }

    @Test
    void readerFailureShouldEmitProviderErrorThenErrorFinish() {
        Flux<JsonNode> failing = Flux.concat(
                Flux.just(part("text-delta", "A")),
                Flux.error(new IllegalStateException("connection reset"))
        );

        List<Chunk> chunks = adapter(0).processStream(new FluxStreamReader<>(failing), Mono.just("A"))
                .collectList().block(Duration.ofSeconds(1));

        assertThat(chunks).containsExactly(
                new Chunk.TextDelta("A"),
                new Chunk.Error(ErrorKind.PROVIDER, "connection reset"),
                new Chunk.Finish(Chunk.Finish.ERROR)
        );
    }

    @Test
    void rawContinuationShouldBeCapturedWithoutAlteringChunks() {
        ContinuationCache<String> cache = new ContinuationCache<>("google");
        ChunkAdapter<JsonNode> adapter = new ChunkAdapter<>(
                new StreamPartTranslator(objectMapper, "google"),
                signal,
                new IdleAbortTimer(scheduler),
                List.of(new ThoughtSignatureCapture(cache)),
                new ChunkAdapter.Settings("msg_1", "conv_1", 0, IdleTimeoutMessage.DEFAULT_TEMPLATE)
        );

        List<Chunk> chunks = adapter.processStream(
                reader(json("{\"type\":\"raw\",\"providerMetadata\":{\"google\":{\"thoughtSignature\":\"sig_1\"}}}")),
                null
        ).collectList().block(Duration.ofSeconds(1));

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(0)).isInstanceOf(Chunk.Raw.class);
        assertThat(cache.get("conv_1")).contains("sig_1");
    }

    private ChunkAdapter<JsonNode> adapter(long idleTimeoutMs) {
        return new ChunkAdapter<>(
                new StreamPartTranslator(objectMapper, "google"),
                signal,
                new IdleAbortTimer(scheduler),
                List.of(),
                new ChunkAdapter.Settings("msg_1", "conv_1", idleTimeoutMs, IdleTimeoutMessage.DEFAULT_TEMPLATE)
        );
    }

    private FluxStreamReader<JsonNode> reader(JsonNode... parts) {
        return new FluxStreamReader<>(Flux.just(parts));
    }

    private JsonNode part(String type, String text) {
        return objectMapper.createObjectNode().put("type", type).put("text", text);
    }

    private JsonNode finish(String reason) {
        return objectMapper.createObjectNode().put("type", "finish").put("finishReason", reason);
    }

    private JsonNode json(String raw) {
        try {
            return objectMapper.readTree(raw);
        } catch (Exception ex) {
            throw new IllegalArgumentException(raw, ex);
        }
    }
}
