package com.linlay.blockstream.block;

import com.linlay.blockstream.stream.model.Chunk;
import com.linlay.blockstream.stream.model.ErrorKind;
import com.linlay.blockstream.throttle.CoalescingScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单条消息的块状态机：把 chunk 序列物化为有序、持久化的 block 列表。
 * <p>
 * At most one block is active. Partial content of the active block goes through the
 * coalescing throttle; closing a block cancels its pending throttled write and issues a
 * mandatory write instead. {@link #finalize(String)} orders the remaining writes as
 * earlier closes, last block, error block, message; an earlier mandatory write that failed is
 * retried once there, and a second failure fails the finalize.
 * <p>
 * Chunks must be delivered from a single producer in order.
 */
public class BlockManager {

    private static final Logger log = LoggerFactory.getLogger(BlockManager.class);

    public enum State {
        NO_ACTIVE_BLOCK,
        ACTIVE_BLOCK,
        FINALIZING,
        CLOSED
    }

    private final BlockPersistence persistence;
    private final BlockTransitionPolicy policy;
    private final BlockManagerOptions options;
    private final Clock clock;
    private final CoalescingScheduler<String, Block> throttle;
    private final Map<String, Block> closedToolBlocks = new HashMap<>();
    private final List<Mono<Void>> mandatoryWrites = new ArrayList<>();
    private final List<String> protocolWarnings = new ArrayList<>();
    private final AtomicBoolean cleanedUp = new AtomicBoolean(false);

    private volatile State state = State.NO_ACTIVE_BLOCK;
    private volatile Message message;
    private Block active;
    private Chunk.Error failure;
    private StreamTermination termination;
    private Mono<Message> finalization;

    public BlockManager(
            Message message,
            BlockPersistence persistence,
            BlockTransitionPolicy policy,
            BlockManagerOptions options,
            Scheduler scheduler,
            Clock clock
    ) {
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.persistence = Objects.requireNonNull(persistence, "persistence must not be null");
        this.policy = policy == null ? new BlockTransitionPolicy() : policy;
        this.options = options == null ? BlockManagerOptions.defaults() : options;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        Duration interval = this.options.throttleInterval();
        this.throttle = new CoalescingScheduler<>(interval, Objects.requireNonNull(scheduler, "scheduler must not be null"),
                persistence::saveBlock);
    }

    /**
     * Applies one chunk. A finish chunk completes once the message has been finalized;
     * every other chunk is applied synchronously on subscription.
     */
    public Mono<Void> onChunk(Chunk chunk) {
        Objects.requireNonNull(chunk, "chunk must not be null");
        if (chunk instanceof Chunk.Finish finish) {
            return finalize(finish.reason()).then();
        }
        return Mono.fromRunnable(() -> apply(chunk));
    }

    /**
     * Idempotent. The first call fixes the terminal status and snapshot; later calls return the
     * same cached result. Nothing is written until the returned Mono is subscribed.
     */
    public synchronized Mono<Message> finalize(String reason) {
        if (finalization != null) {
            return finalization;
        }
        state = State.FINALIZING;
        Instant now = clock.instant();
        termination = resolveTermination(reason);
        boolean abnormal = termination != StreamTermination.COMPLETED;

        Block lastBlock = null;
        if (active != null) {
            throttle.cancel(active.id());
            lastBlock = closeSnapshot(active, abnormal ? BlockStatus.ERROR : BlockStatus.SUCCESS, now);
            active = null;
        }
        Block errorBlock = buildErrorBlock(now);
        Message current = message;
        if (errorBlock != null) {
            current = current.withBlock(errorBlock.id(), now);
        }
        if (!protocolWarnings.isEmpty()) {
            current = current.withMetadata(Message.META_PROTOCOL_WARNINGS, List.copyOf(protocolWarnings), now);
        }
        Message finalMessage = current.withStatus(abnormal ? MessageStatus.ERROR : MessageStatus.SUCCESS, now);
        message = finalMessage;

        Mono<Void> earlier = Mono.whenDelayError(List.copyOf(mandatoryWrites));
        Block blockToWrite = lastBlock;
        Mono<Void> writes = earlier
                .then(blockToWrite == null ? Mono.<Void>empty() : Mono.defer(() -> persistence.saveBlock(blockToWrite)))
                .then(errorBlock == null ? Mono.<Void>empty() : Mono.defer(() -> persistence.saveBlock(errorBlock)))
                .then(Mono.defer(() -> persistence.saveMessage(finalMessage)))
                .onErrorMap(ex -> !(ex instanceof PersistenceException),
                        ex -> new PersistenceException("Failed to persist message " + finalMessage.id(), ex));

        finalization = writes
                .doOnSuccess(ignored -> log.debug("Finalized message {} with {} blocks, termination={}",
                        finalMessage.id(), finalMessage.blockIds().size(), termination))
                .doOnError(ex -> log.error("Finalize failed for message {}", finalMessage.id(), ex))
                .doFinally(signal -> state = State.CLOSED)
                .thenReturn(finalMessage)
                .cache();
        return finalization;
    }

    /**
     * Cancels pending throttled writes and releases per-stream state. Safe to call repeatedly.
     */
    public void cleanup() {
        if (!cleanedUp.compareAndSet(false, true)) {
            return;
        }
        int pending = throttle.pendingCount();
        if (pending > 0) {
            log.debug("Discarding {} pending partial writes for message {}", pending, message.id());
        }
        throttle.dispose();
        synchronized (this) {
            closedToolBlocks.clear();
            if (finalization == null) {
                active = null;
                state = State.CLOSED;
            }
        }
    }

    public State state() {
        return state;
    }

    public Message message() {
        return message;
    }

    public synchronized Block activeBlock() {
        return active;
    }

    /**
     * Null until {@link #finalize(String)} has been called.
     */
    public synchronized StreamTermination termination() {
        return termination;
    }

    public synchronized Chunk.Error failure() {
        return failure;
    }

    private synchronized void apply(Chunk chunk) {
        if (state == State.FINALIZING || state == State.CLOSED) {
            log.warn("Message {} already {}, dropping {} chunk", message.id(), state, chunk.type());
            return;
        }
        BlockAction action = policy.decide(chunk, active);
        switch (action) {
            case CONTINUE -> appendToActive(chunk);
            case CLOSE_AND_OPEN -> {
                closeActive(BlockStatus.SUCCESS);
                open(chunk);
            }
            case APPEND_AND_CLOSE -> {
                appendToActive(chunk);
                closeActive(chunk instanceof Chunk.ToolCallEnd end && end.failed() ? BlockStatus.ERROR : BlockStatus.SUCCESS);
            }
            case UPDATE_DETACHED -> updateDetached((Chunk.ToolCallEnd) chunk);
            case METADATA_ONLY -> applyMetadata((Chunk.Raw) chunk);
            case RECORD_FAILURE -> recordFailure((Chunk.Error) chunk);
            case FINALIZE -> throw new IllegalStateException("finish chunks are handled by finalize");
        }
    }

    private void appendToActive(Chunk chunk) {
        Instant now = clock.instant();
        Block updated = active;
        if (chunk instanceof Chunk.TextDelta text) {
            updated = updated.append(text.text(), now);
        } else if (chunk instanceof Chunk.ReasoningDelta reasoning) {
            updated = updated.append(reasoning.text(), now);
        } else if (chunk instanceof Chunk.ToolCallDelta delta) {
            updated = updated.append(delta.argsFragment(), now);
        } else if (chunk instanceof Chunk.ToolCallEnd end && end.result() != null) {
            updated = updated.withAttribute(Block.ATTR_TOOL_RESULT, end.result(), now);
        }
        active = updated;
        throttle.submit(updated.id(), updated);
    }

    private void open(Chunk chunk) {
        Instant now = clock.instant();
        BlockKind kind = policy.targetKind(chunk.type());
        Block block = switch (chunk.type()) {
            case TEXT_DELTA -> Block.open(message.id(), kind, BlockStatus.STREAMING,
                    ((Chunk.TextDelta) chunk).text(), now);
            case REASONING_DELTA -> Block.open(message.id(), kind, BlockStatus.STREAMING,
                    ((Chunk.ReasoningDelta) chunk).text(), now);
            case TOOL_CALL_START -> {
                Chunk.ToolCallStart start = (Chunk.ToolCallStart) chunk;
                yield Block.open(message.id(), kind, BlockStatus.PENDING, "", now)
                        .withAttribute(Block.ATTR_TOOL_CALL_ID, start.id(), now)
                        .withAttribute(Block.ATTR_TOOL_NAME, start.name(), now);
            }
            case TOOL_CALL_DELTA -> {
                Chunk.ToolCallDelta delta = (Chunk.ToolCallDelta) chunk;
                yield Block.open(message.id(), kind, BlockStatus.STREAMING, delta.argsFragment(), now)
                        .withAttribute(Block.ATTR_TOOL_CALL_ID, delta.id(), now);
            }
            case IMAGE -> {
                Chunk.Image image = (Chunk.Image) chunk;
                yield Block.open(message.id(), kind, BlockStatus.STREAMING, image.data(), now)
                        .withAttribute(Block.ATTR_MIME_TYPE, image.mimeType(), now);
            }
            default -> throw new IllegalStateException("Cannot open a block for " + chunk.type());
        };
        active = block;
        state = State.ACTIVE_BLOCK;
        message = message.withBlock(block.id(), now);
        throttle.submit(block.id(), block);
        Message snapshot = message;
        writeNow(() -> persistence.saveMessage(snapshot), "message " + snapshot.id());
        log.debug("Opened {} block {} for message {}", block.kind().wireName(), block.id(), message.id());
    }

    private void closeActive(BlockStatus status) {
        if (active == null) {
            return;
        }
        throttle.cancel(active.id());
        Block closed = closeSnapshot(active, status, clock.instant());
        active = null;
        state = State.NO_ACTIVE_BLOCK;
        writeNow(() -> persistence.saveBlock(closed), "block " + closed.id());
    }

    private Block closeSnapshot(Block block, BlockStatus status, Instant now) {
        Block closed = block.withStatus(status, now);
        if (closed.kind() == BlockKind.REASONING) {
            closed = closed.withAttribute(Block.ATTR_THINKING_MS,
                    Math.max(0L, Duration.between(block.createdAt(), now).toMillis()), now);
        }
        if (closed.kind() == BlockKind.TOOL_CALL && closed.toolCallId() != null) {
            closedToolBlocks.put(closed.toolCallId(), closed);
        }
        return closed;
    }

    private void updateDetached(Chunk.ToolCallEnd end) {
        Block target = closedToolBlocks.get(end.id());
        if (target == null) {
            // result for a call never seen as a block; materialize it as its own closed block
            closeActive(BlockStatus.SUCCESS);
            open(new Chunk.ToolCallStart(end.id(), null));
            appendToActive(end);
            closeActive(end.failed() ? BlockStatus.ERROR : BlockStatus.SUCCESS);
            return;
        }
        Instant now = clock.instant();
        Block updated = target.withStatus(end.failed() ? BlockStatus.ERROR : BlockStatus.SUCCESS, now);
        if (end.result() != null) {
            updated = updated.withAttribute(Block.ATTR_TOOL_RESULT, end.result(), now);
        }
        closedToolBlocks.put(end.id(), updated);
        Block snapshot = updated;
        writeNow(() -> persistence.saveBlock(snapshot), "block " + snapshot.id());
    }

    private void applyMetadata(Chunk.Raw raw) {
        Instant now = clock.instant();
        Message updated = message;
        if (raw.hasPersistentSideData()) {
            Map<String, Object> providers = new LinkedHashMap<>();
            Object existing = message.metadata().get(Message.META_PROVIDER);
            if (existing instanceof Map<?, ?> map) {
                map.forEach((key, value) -> providers.put(String.valueOf(key), value));
            }
            Map<String, Object> merged = new LinkedHashMap<>();
            if (providers.get(raw.providerTag()) instanceof Map<?, ?> previous) {
                previous.forEach((key, value) -> merged.put(String.valueOf(key), value));
            }
            merged.putAll(raw.providerMetadata());
            providers.put(raw.providerTag(), merged);
            updated = updated.withMetadata(Message.META_PROVIDER, providers, now);
        }
        Object usage = raw.payload().get(Message.META_USAGE);
        if (usage != null) {
            updated = updated.withMetadata(Message.META_USAGE, usage, now);
        }
        if (updated == message) {
            log.debug("Raw {} chunk carries no persistent metadata for message {}", raw.providerTag(), message.id());
            return;
        }
        message = updated;
        Message snapshot = updated;
        writeNow(() -> persistence.saveMessage(snapshot), "message " + snapshot.id());
    }

    private void recordFailure(Chunk.Error error) {
        if (!error.isTerminal()) {
            protocolWarnings.add(error.message());
            log.warn("Protocol warning on message {}: {}", message.id(), error.message());
            return;
        }
        if (failure == null) {
            failure = error;
        }
        log.warn("Stream failure on message {}: kind={}, message={}", message.id(), error.kind().wireName(), error.message());
    }

    /**
     * Starts the write immediately. A failure stays in the cached result; finalize retries it
     * once and fails if the retry fails too.
     */
    private void writeNow(WriteAction action, String target) {
        Mono<Void> write = Mono.defer(action::write).cache();
        mandatoryWrites.add(write.onErrorResume(ex -> {
            log.warn("Retrying mandatory write of {} after: {}", target, ex.getMessage());
            return Mono.defer(action::write);
        }));
        write.subscribe(
                ignored -> {
                },
                ex -> log.error("Mandatory write of {} failed", target, ex)
        );
    }

    private StreamTermination resolveTermination(String reason) {
        if (failure != null) {
            return switch (failure.kind()) {
                case TIMEOUT -> StreamTermination.TIMEOUT;
                case ABORT -> StreamTermination.ABORTED;
                default -> StreamTermination.FAILED;
            };
        }
        if (Chunk.Finish.ABORTED.equals(reason)) {
            return StreamTermination.ABORTED;
        }
        if (Chunk.Finish.ERROR.equals(reason)) {
            return StreamTermination.FAILED;
        }
        return StreamTermination.COMPLETED;
    }

    private Block buildErrorBlock(Instant now) {
        String content;
        Map<String, Object> attributes = new LinkedHashMap<>();
        if (failure != null) {
            content = failure.message();
            attributes.put(Block.ATTR_ERROR_KIND, failure.kind().wireName());
            if (failure.timeoutMs() != null) {
                attributes.put(Block.ATTR_TIMEOUT_MS, failure.timeoutMs());
            }
        } else if (termination == StreamTermination.ABORTED && options.abortVisible()) {
            content = options.abortMessage();
            attributes.put(Block.ATTR_ERROR_KIND, ErrorKind.ABORT.wireName());
        } else {
            return null;
        }
        return new Block("blk_" + UUID.randomUUID(), message.id(), BlockKind.ERROR, BlockStatus.ERROR,
                content, attributes, now, now);
    }

    @FunctionalInterface
    private interface WriteAction {
        Mono<Void> write();
    }
}
