package com.linlay.blockstream.export;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.blockstream.persistence.JsonlBlockStore;
import com.linlay.blockstream.serializer.FileRecordSink;
import com.linlay.blockstream.serializer.NdjsonStreamSerializer;
import com.linlay.blockstream.serializer.RecordSink;
import com.linlay.blockstream.serializer.SerializerOptions;
import com.linlay.blockstream.serializer.WriteReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 导出与备份：把已持久化的消息快照按 NDJSON 写出。
 */
@Service
public class BlockExportService {

    private static final Logger log = LoggerFactory.getLogger(BlockExportService.class);

    private final JsonlBlockStore store;
    private final NdjsonStreamSerializer serializer;
    private final ExportProperties properties;

    public BlockExportService(JsonlBlockStore store, NdjsonStreamSerializer serializer, ExportProperties properties) {
        this.store = store;
        this.serializer = serializer;
        this.properties = properties;
    }

    /**
     * Lines are produced as the subscriber requests them. An unknown id throws
     * {@link com.linlay.blockstream.persistence.MessageNotFoundException} before any flux exists.
     */
    public Flux<byte[]> exportMessage(String messageId) {
        List<ObjectNode> records = store.snapshotRecords(messageId);
        return serializer.toFlux(records, properties.getBatchSize());
    }

    public Mono<WriteReport> backupMessages(List<String> messageIds, Path target) {
        Objects.requireNonNull(target, "target must not be null");
        return Mono.defer(() -> writeBackup(messageIds, new FileRecordSink(target, false)))
                .doOnNext(report -> log.info("Backed up {} messages to {}: {} records in {} batches",
                        messageIds.size(), target, report.records(), report.batches()));
    }

    /**
     * Streams every listed message into {@code sink}, loading one message at a time.
     */
    public Mono<WriteReport> writeBackup(List<String> messageIds, RecordSink sink) {
        List<String> ids = messageIds == null ? List.of() : List.copyOf(messageIds);
        Iterable<ObjectNode> records = () -> ids.stream()
                .flatMap(id -> store.snapshotRecords(id).stream())
                .iterator();
        return serializer.write(sink, records, properties.getBatchSize(), options());
    }

    private SerializerOptions options() {
        long drainTimeoutMs = properties.getDrainTimeoutMs();
        return new SerializerOptions(
                properties.isWaitForDrain(),
                drainTimeoutMs > 0 ? Duration.ofMillis(drainTimeoutMs) : null
        );
    }
}
