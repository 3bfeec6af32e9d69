package com.linlay.blockstream.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.blockstream.block.Block;
import com.linlay.blockstream.block.BlockPersistence;
import com.linlay.blockstream.block.Message;
import com.linlay.blockstream.block.MessageStatus;
import com.linlay.blockstream.block.PersistenceException;
import com.linlay.blockstream.serializer.FileRecordSink;
import com.linlay.blockstream.serializer.NdjsonStreamSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * One append-only {@code <messageId>.jsonl} file per message. Each write appends a full
 * snapshot line tagged {@code _type=block|message}; on load the newest snapshot per id wins,
 * a terminal snapshot always beating a non-terminal one so a late throttled partial can never
 * resurrect a finished block.
 */
@Service
public class JsonlBlockStore implements BlockPersistence {

    private static final Logger log = LoggerFactory.getLogger(JsonlBlockStore.class);

    static final String TYPE_FIELD = "_type";
    static final String TYPE_BLOCK = "block";
    static final String TYPE_MESSAGE = "message";

    private static final Pattern MESSAGE_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-][A-Za-z0-9_.-]{0,127}");

    private final ObjectMapper objectMapper;
    private final BlockStoreProperties properties;
    private final NdjsonStreamSerializer serializer;
    private final Map<String, Object> fileLocks = new ConcurrentHashMap<>();

    public JsonlBlockStore(ObjectMapper objectMapper, BlockStoreProperties properties, NdjsonStreamSerializer serializer) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.serializer = serializer;
    }

    @Override
    public Mono<Void> saveBlock(Block block) {
        return Mono.fromRunnable(() -> appendLine(block.messageId(), TYPE_BLOCK, block));
    }

    @Override
    public Mono<Void> saveMessage(Message message) {
        return Mono.fromRunnable(() -> appendLine(message.id(), TYPE_MESSAGE, message));
    }

    public Optional<StoredMessage> loadMessage(String messageId) {
        requireValidMessageId(messageId);
        Path path = resolvePath(messageId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        Snapshot snapshot;
        synchronized (lockFor(messageId)) {
            snapshot = readSnapshot(path);
        }
        if (snapshot.message == null) {
            log.warn("Message file {} has no message line", path);
            return Optional.empty();
        }
        List<Block> ordered = new ArrayList<>();
        for (String blockId : snapshot.message.blockIds()) {
            Block block = snapshot.blocks.get(blockId);
            if (block == null) {
                log.warn("Message {} references missing block {}", messageId, blockId);
                continue;
            }
            ordered.add(block);
        }
        return Optional.of(new StoredMessage(snapshot.message, ordered));
    }

    public StoredMessage requireMessage(String messageId) {
        return loadMessage(messageId).orElseThrow(() -> new MessageNotFoundException(messageId));
    }

    /**
     * The winning snapshot as tagged records: the message line first, then its blocks in order.
     */
    public List<ObjectNode> snapshotRecords(String messageId) {
        StoredMessage stored = requireMessage(messageId);
        List<ObjectNode> records = new ArrayList<>(stored.blocks().size() + 1);
        records.add(tagged(TYPE_MESSAGE, stored.message()));
        stored.blocks().forEach(block -> records.add(tagged(TYPE_BLOCK, block)));
        return records;
    }

    /**
     * Rewrites the file with only the winning snapshot per id. Meant for messages that are no
     * longer streaming. When a line is appended while the compacted copy is being written, the
     * compaction is abandoned and the append log kept as is.
     */
    public Mono<Void> compact(String messageId) {
        return Mono.defer(() -> {
            Path path = resolvePath(messageId);
            List<ObjectNode> lines;
            long sizeAtSnapshot;
            synchronized (lockFor(messageId)) {
                lines = snapshotRecords(messageId);
                sizeAtSnapshot = sizeOf(path);
            }
            Path temp = path.resolveSibling(path.getFileName() + ".compact");
            return serializer.writeAll(new FileRecordSink(temp, false), lines)
                    .doOnNext(report -> {
                        boolean replaced;
                        synchronized (lockFor(messageId)) {
                            replaced = sizeOf(path) == sizeAtSnapshot;
                            if (replaced) {
                                moveReplacing(temp, path);
                            }
                        }
                        if (replaced) {
                            log.debug("Compacted {} to {} lines", path, report.records());
                        } else {
                            deleteQuietly(temp);
                            log.info("Skip compaction of {}: appended while compacting", path);
                        }
                    })
                    .doOnError(ex -> deleteQuietly(temp))
                    .then();
        });
    }

    private void appendLine(String messageId, String type, Object value) {
        requireValidMessageId(messageId);
        Path path = resolvePath(messageId);
        byte[] line;
        try {
            line = serializer.encodeLine(tagged(type, value));
        } catch (JsonProcessingException ex) {
            throw new PersistenceException("Cannot encode " + type + " for message " + messageId, ex);
        }
        synchronized (lockFor(messageId)) {
            FileRecordSink sink = new FileRecordSink(path, true);
            try {
                sink.write(line);
                sink.complete();
            } catch (RuntimeException ex) {
                sink.fail(ex);
                throw new PersistenceException("Cannot append " + type + " line for message " + messageId, ex);
            }
        }
    }

    private ObjectNode tagged(String type, Object value) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(TYPE_FIELD, type);
        node.setAll((ObjectNode) objectMapper.valueToTree(value));
        return node;
    }

    private Snapshot readSnapshot(Path path) {
        Snapshot snapshot = new Snapshot();
        List<String> rawLines;
        try {
            rawLines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new PersistenceException("Cannot read " + path, ex);
        }
        for (String rawLine : rawLines) {
            if (!StringUtils.hasText(rawLine)) {
                continue;
            }
            try {
                JsonNode node = objectMapper.readTree(rawLine);
                if (!(node instanceof ObjectNode object)) {
                    continue;
                }
                String type = object.path(TYPE_FIELD).asText("");
                object.remove(TYPE_FIELD);
                if (TYPE_BLOCK.equals(type)) {
                    snapshot.offer(objectMapper.treeToValue(object, Block.class));
                } else if (TYPE_MESSAGE.equals(type)) {
                    snapshot.offer(objectMapper.treeToValue(object, Message.class));
                }
            } catch (Exception ex) {
                // a torn trailing line must not hide everything written before it
                log.warn("Skip unreadable line in {}: {}", path, ex.getMessage());
            }
        }
        return snapshot;
    }

    private long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException ex) {
            throw new PersistenceException("Cannot stat " + path, ex);
        }
    }

    private void moveReplacing(Path source, Path target) {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            throw new PersistenceException("Cannot replace " + target, ex);
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.warn("Cannot delete {}", path, ex);
        }
    }

    private Object lockFor(String messageId) {
        return fileLocks.computeIfAbsent(messageId, ignored -> new Object());
    }

    private Path resolvePath(String messageId) {
        Path dir = Paths.get(properties.getDir()).toAbsolutePath().normalize();
        return dir.resolve(messageId + ".jsonl");
    }

    private void requireValidMessageId(String messageId) {
        if (!StringUtils.hasText(messageId) || !MESSAGE_ID_PATTERN.matcher(messageId).matches()) {
            throw new IllegalArgumentException("Invalid messageId: " + messageId);
        }
    }

    private static final class Snapshot {
        private Message message;
        private final Map<String, Block> blocks = new LinkedHashMap<>();

        private void offer(Block candidate) {
            Block current = blocks.get(candidate.id());
            if (current == null || supersedes(candidate.isTerminal(), candidate.updatedAt(), current.isTerminal(), current.updatedAt())) {
                blocks.put(candidate.id(), candidate);
            }
        }

        private void offer(Message candidate) {
            if (message == null || supersedes(
                    candidate.status() != MessageStatus.PROCESSING, candidate.updatedAt(),
                    message.status() != MessageStatus.PROCESSING, message.updatedAt())) {
                message = candidate;
            }
        }

        private static boolean supersedes(boolean candidateTerminal, Instant candidateAt,
                                          boolean currentTerminal, Instant currentAt) {
            if (candidateTerminal != currentTerminal) {
                return candidateTerminal;
            }
            if (candidateAt == null || currentAt == null) {
                return true;
            }
            return !candidateAt.isBefore(currentAt);
        }
    }
}
