package com.linlay.blockstream.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.blockstream.block.Block;
import com.linlay.blockstream.block.BlockKind;
import com.linlay.blockstream.block.BlockStatus;
import com.linlay.blockstream.block.BlockTransitionPolicy;
import com.linlay.blockstream.block.Message;
import com.linlay.blockstream.block.MessageStatus;
import com.linlay.blockstream.cache.ContinuationCache;
import com.linlay.blockstream.cache.ThoughtSignatureCapture;
import com.linlay.blockstream.cancel.CancelReason;
import com.linlay.blockstream.config.StreamEngineProperties;
import com.linlay.blockstream.persistence.BlockStoreProperties;
import com.linlay.blockstream.persistence.JsonlBlockStore;
import com.linlay.blockstream.persistence.StoredMessage;
import com.linlay.blockstream.serializer.NdjsonStreamSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageStreamServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
    private final ActiveStreamRegistry registry = new ActiveStreamRegistry();
    private final ContinuationCache<String> signatures = new ContinuationCache<>("google-thought-signature");
    private JsonlBlockStore store;
    private MessageStreamService service;

    @BeforeEach
    void setUp() {
        BlockStoreProperties storeProperties = new BlockStoreProperties();
        storeProperties.setDir(tempDir.toString());
        store = new JsonlBlockStore(objectMapper, storeProperties, new NdjsonStreamSerializer(objectMapper));
        service = new MessageStreamService(
                store,
                new StreamEngineProperties(),
                storeProperties,
                registry,
                List.of(new ThoughtSignatureCapture(signatures)),
                new BlockTransitionPolicy(),
                objectMapper,
                scheduler,
                Clock.fixed(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC)
        );
    }

    @Test
    void chatCompletionStreamShouldPersistCompactedMessage() throws Exception {
        Flux<String> sse = Flux.just(
                "data: {\"choices\":[{\"delta\":{\"reasoning_content\":\"先想想\"}}]}",
                "data: {\"choices\":[{\"delta\":{\"content\":\"Hel\"}}]}",
                "data: {\"choices\":[{\"delta\":{\"content\":\"lo\"}}]}",
                "data: {\"choices\":[{\"delta\":{},\"finish_reason\":\"stop\"}]}",
                "data: [DONE]"
        );

        Message message = service.streamChatCompletion(new StreamRequest("msg_ok", "conv_1"), sse, Mono.just("Hello"))
                .block(Duration.ofSeconds(5));

        assertThat(message.status()).isEqualTo(MessageStatus.SUCCESS);
        StoredMessage stored = store.requireMessage("msg_ok");
        assertThat(stored.blocks()).extracting(Block::kind).containsExactly(BlockKind.REASONING, BlockKind.TEXT);
        assertThat(stored.blocks().get(1).content()).isEqualTo("Hello");
        assertThat(stored.blocks()).extracting(Block::status).containsOnly(BlockStatus.SUCCESS);
        assertThat(Files.readAllLines(tempDir.resolve("msg_ok.jsonl"))).hasSize(3);
        assertThat(registry.isStreaming("msg_ok")).isFalse();
    }

    @Test
    void continuationSideDataShouldBeCachedAndPersisted() {
        Flux<JsonNode> parts = Flux.just(
                json("{\"type\":\"text-delta\",\"text\":\"hi\"}"),
                json("{\"type\":\"raw\",\"providerMetadata\":{\"google\":{\"thoughtSignature\":\"sig_1\"}}}"),
                json("{\"type\":\"finish\",\"finishReason\":\"stop\"}")
        );

        Message message = service.streamParts(new StreamRequest("msg_sig", "conv_9"), "google", parts, Mono.empty())
                .block(Duration.ofSeconds(5));

        assertThat(signatures.size()).isEqualTo(1);
        assertThat(message.metadata()).containsKey(Message.META_PROVIDER);
    }

    @Test
    void idleProviderShouldTimeOutWithPersistedErrorBlock() {
        Flux<JsonNode> parts = Flux.concat(
                Flux.just(json("{\"type\":\"text-delta\",\"text\":\"A\"}")),
                Flux.never()
        );

        CompletableFuture<Message> future = service
                .streamParts(new StreamRequest("msg_idle", "conv_1", 1_000L), "test", parts, Mono.just("A"))
                .toFuture();
        assertThat(future).isNotDone();
        assertThat(registry.isStreaming("msg_idle")).isTrue();

        scheduler.advanceTimeBy(Duration.ofMillis(1_000));

        assertThatThrownBy(future::join)
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOf(StreamTimeoutException.class)
                .hasMessageContaining("0.02");
        StoredMessage stored = store.requireMessage("msg_idle");
        assertThat(stored.message().status()).isEqualTo(MessageStatus.ERROR);
        assertThat(stored.blocks()).extracting(Block::kind).containsExactly(BlockKind.TEXT, BlockKind.ERROR);
        assertThat(stored.blocks().get(0).content()).isEqualTo("A");
        assertThat(stored.blocks().get(1).attributes()).containsEntry(Block.ATTR_ERROR_KIND, "timeout");
        assertThat(registry.isStreaming("msg_idle")).isFalse();
    }

    @Test
    void callerCancelShouldAbortAndPersistPartialContent() {
        Flux<JsonNode> parts = Flux.concat(
                Flux.just(json("{\"type\":\"text-delta\",\"text\":\"partial\"}")),
                Flux.never()
        );

        CompletableFuture<Message> future = service
                .streamParts(new StreamRequest("msg_cancel", "conv_1", 0L), "test", parts, Mono.empty())
                .toFuture();
        assertThat(registry.cancel("msg_cancel").accepted()).isTrue();

        assertThatThrownBy(future::join)
                .cause()
                .isInstanceOfSatisfying(StreamAbortedException.class,
                        ex -> assertThat(ex.reason()).isEqualTo(CancelReason.CALLER));
        StoredMessage stored = store.requireMessage("msg_cancel");
        assertThat(stored.message().status()).isEqualTo(MessageStatus.ERROR);
        assertThat(stored.blocks()).singleElement()
                .satisfies(block -> assertThat(block.content()).isEqualTo("partial"));
    }

    @Test
    void readerFailureShouldSurfaceAsProviderStreamException() {
        Flux<JsonNode> parts = Flux.concat(
                Flux.just(json("{\"type\":\"text-delta\",\"text\":\"A\"}")),
                Flux.error(new IOException("connection reset"))
        );

        assertThatThrownBy(() -> service
                .streamParts(new StreamRequest("msg_fail", "conv_1"), "test", parts, Mono.empty())
                .block(Duration.ofSeconds(5)))
                .isInstanceOf(ProviderStreamException.class)
                .hasMessage("connection reset");
        assertThat(store.requireMessage("msg_fail").blocks())
                .extracting(Block::kind)
                .containsExactly(BlockKind.TEXT, BlockKind.ERROR);
    }

    @Test
    void concurrentStreamForSameMessageShouldBeRejected() {
        CompletableFuture<Message> first = service
                .streamParts(new StreamRequest("msg_dup", "conv_1", 0L), "test", Flux.never(), Mono.empty())
                .toFuture();

        assertThatThrownBy(() -> service
                .streamParts(new StreamRequest("msg_dup", "conv_1"), "test", Flux.never(), Mono.empty())
                .block(Duration.ofSeconds(1)))
                .isInstanceOf(IllegalStateException.class);

        first.cancel(true);
    }

    private JsonNode json(String raw) {
        try {
            return objectMapper.readTree(raw);
        } catch (IOException ex) {
            throw new IllegalArgumentException(raw, ex);
        }
    }
}
