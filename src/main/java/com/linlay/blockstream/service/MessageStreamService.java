package com.linlay.blockstream.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.blockstream.block.BlockManager;
import com.linlay.blockstream.block.BlockManagerOptions;
import com.linlay.blockstream.block.BlockTransitionPolicy;
import com.linlay.blockstream.block.Message;
import com.linlay.blockstream.block.StreamTermination;
import com.linlay.blockstream.cache.ContinuationCapture;
import com.linlay.blockstream.cancel.CancelReason;
import com.linlay.blockstream.cancel.CancellationSignal;
import com.linlay.blockstream.cancel.IdleAbortTimer;
import com.linlay.blockstream.config.StreamEngineConfiguration;
import com.linlay.blockstream.config.StreamEngineProperties;
import com.linlay.blockstream.persistence.BlockStoreProperties;
import com.linlay.blockstream.persistence.JsonlBlockStore;
import com.linlay.blockstream.stream.adapter.ChunkAdapter;
import com.linlay.blockstream.stream.adapter.FluxStreamReader;
import com.linlay.blockstream.stream.adapter.ProviderStreamReader;
import com.linlay.blockstream.stream.adapter.RawEventTranslator;
import com.linlay.blockstream.stream.adapter.StreamPartTranslator;
import com.linlay.blockstream.stream.adapter.openai.OpenAiChatCompletionTranslator;
import com.linlay.blockstream.stream.model.Chunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 单条助手消息的流式物化入口：provider 流 → ChunkAdapter → BlockManager → 存储。
 * <p>
 * The returned Mono completes with the persisted message on a clean finish. Timeout, abort and
 * provider failure are reported as {@link StreamException} subclasses after the message has been
 * finalized; a failed finalize write surfaces as
 * {@link com.linlay.blockstream.block.PersistenceException}.
 */
@Service
public class MessageStreamService {

    private static final Logger log = LoggerFactory.getLogger(MessageStreamService.class);

    private final JsonlBlockStore store;
    private final StreamEngineProperties engineProperties;
    private final BlockStoreProperties storeProperties;
    private final ActiveStreamRegistry registry;
    private final List<ContinuationCapture> captures;
    private final BlockTransitionPolicy policy;
    private final ObjectMapper objectMapper;
    private final Scheduler timerScheduler;
    private final Clock clock;

    public MessageStreamService(
            JsonlBlockStore store,
            StreamEngineProperties engineProperties,
            BlockStoreProperties storeProperties,
            ActiveStreamRegistry registry,
            List<ContinuationCapture> captures,
            BlockTransitionPolicy policy,
            ObjectMapper objectMapper,
            @Qualifier(StreamEngineConfiguration.TIMER_SCHEDULER) Scheduler timerScheduler,
            Clock clock
    ) {
        this.store = store;
        this.engineProperties = engineProperties;
        this.storeProperties = storeProperties;
        this.registry = registry;
        this.captures = captures == null ? List.of() : List.copyOf(captures);
        this.policy = policy;
        this.objectMapper = objectMapper;
        this.timerScheduler = timerScheduler;
        this.clock = clock;
    }

    /**
     * OpenAI-compatible chat completion SSE, one {@code data:} line per element.
     */
    public Mono<Message> streamChatCompletion(StreamRequest request, Flux<String> sseLines, Mono<String> finalText) {
        return stream(request, new OpenAiChatCompletionTranslator(objectMapper), new FluxStreamReader<>(sseLines), finalText);
    }

    /**
     * Generic discriminated stream parts tagged with {@code providerTag}.
     */
    public Mono<Message> streamParts(StreamRequest request, String providerTag, Flux<JsonNode> parts, Mono<String> finalText) {
        return stream(request, new StreamPartTranslator(objectMapper, providerTag), new FluxStreamReader<>(parts), finalText);
    }

    public <R> Mono<Message> stream(
            StreamRequest request,
            RawEventTranslator<R> translator,
            ProviderStreamReader<R> reader,
            Mono<String> finalText
    ) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(translator, "translator must not be null");
        Objects.requireNonNull(reader, "reader must not be null");
        return Mono.defer(() -> {
            String messageId = request.messageId();
            CancellationSignal signal = registry.register(messageId);
            long idleTimeoutMs = request.idleTimeoutMs() != null
                    ? request.idleTimeoutMs()
                    : engineProperties.getIdleTimeoutMs();

            ChunkAdapter<R> adapter = new ChunkAdapter<>(
                    translator,
                    signal,
                    new IdleAbortTimer(timerScheduler),
                    captures,
                    new ChunkAdapter.Settings(messageId, request.conversationId(), idleTimeoutMs,
                            engineProperties.getIdleTimeoutMessage())
            );
            BlockManager manager = new BlockManager(
                    Message.start(messageId, request.conversationId(), clock.instant()),
                    store,
                    policy,
                    new BlockManagerOptions(Duration.ofMillis(engineProperties.getThrottleMs()),
                            engineProperties.isAbortVisible(), engineProperties.getAbortMessage()),
                    timerScheduler,
                    clock
            );
            log.info("[{}] stream started conversationId={}, idleTimeoutMs={}", messageId, request.conversationId(), idleTimeoutMs);

            return adapter.processStream(reader, finalText)
                    .concatMap(manager::onChunk)
                    // the adapter always ends with a finish chunk, so this returns the cached result
                    .then(Mono.defer(() -> manager.finalize(Chunk.Finish.ABORTED)))
                    .flatMap(this::compactIfEnabled)
                    .flatMap(message -> outcome(manager, signal, message))
                    .doFinally(signalType -> {
                        if (signalType == SignalType.CANCEL) {
                            signal.cancel(CancelReason.CALLER);
                            manager.finalize(Chunk.Finish.ABORTED).subscribe(
                                    message -> log.info("[{}] finalized after subscriber cancel", messageId),
                                    ex -> log.error("[{}] finalize after subscriber cancel failed", messageId, ex)
                            );
                        }
                        manager.cleanup();
                        registry.unregister(messageId, signal);
                    });
        });
    }

    private Mono<Message> compactIfEnabled(Message message) {
        if (!storeProperties.isCompactOnFinalize()) {
            return Mono.just(message);
        }
        return store.compact(message.id())
                .onErrorResume(ex -> {
                    log.warn("[{}] compaction failed, keeping append log", message.id(), ex);
                    return Mono.empty();
                })
                .thenReturn(message);
    }

    private Mono<Message> outcome(BlockManager manager, CancellationSignal signal, Message message) {
        StreamTermination termination = manager.termination();
        Chunk.Error failure = manager.failure();
        log.info("[{}] stream finished termination={}, blocks={}", message.id(), termination, message.blockIds().size());
        return switch (termination) {
            case COMPLETED -> Mono.just(message);
            case TIMEOUT -> Mono.error(new StreamTimeoutException(
                    failure.message(),
                    failure.timeoutMs() == null ? 0L : failure.timeoutMs(),
                    message));
            case ABORTED -> Mono.error(new StreamAbortedException(signal.reason(), message));
            case FAILED -> Mono.error(new ProviderStreamException(
                    failure == null ? "Provider stream ended with error" : failure.message(),
                    message));
        };
    }
}
