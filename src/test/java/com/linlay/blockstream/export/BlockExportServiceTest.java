package com.linlay.blockstream.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.blockstream.block.Block;
import com.linlay.blockstream.block.BlockKind;
import com.linlay.blockstream.block.BlockStatus;
import com.linlay.blockstream.block.Message;
import com.linlay.blockstream.block.MessageStatus;
import com.linlay.blockstream.persistence.BlockStoreProperties;
import com.linlay.blockstream.persistence.JsonlBlockStore;
import com.linlay.blockstream.persistence.MessageNotFoundException;
import com.linlay.blockstream.serializer.BoundedBufferSink;
import com.linlay.blockstream.serializer.NdjsonStreamSerializer;
import com.linlay.blockstream.serializer.WriteReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlockExportServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-01T08:00:00Z");

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private JsonlBlockStore store;
    private ExportProperties properties;
    private BlockExportService service;

    @BeforeEach
    void setUp() {
        BlockStoreProperties storeProperties = new BlockStoreProperties();
        storeProperties.setDir(tempDir.resolve("messages").toString());
        NdjsonStreamSerializer serializer = new NdjsonStreamSerializer(objectMapper);
        store = new JsonlBlockStore(objectMapper, storeProperties, serializer);
        properties = new ExportProperties();
        properties.setBatchSize(2);
        service = new BlockExportService(store, serializer, properties);
        persist("msg_a", 3);
        persist("msg_b", 1);
    }

    @Test
    void exportShouldStreamMessageThenBlocksInBatches() throws Exception {
        List<String> chunks = service.exportMessage("msg_a")
                .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
                .collectList()
                .block();

        assertThat(chunks).hasSize(2);
        List<String> lines = String.join("", chunks).lines().toList();
        assertThat(lines).hasSize(4);
        assertThat(objectMapper.readTree(lines.get(0)).path("_type").asText()).isEqualTo("message");
        assertThat(objectMapper.readTree(lines.get(0)).path("status").asText()).isEqualTo("success");
        assertThat(objectMapper.readTree(lines.get(3)).path("content").asText()).isEqualTo("part-2");
    }

    @Test
    void exportOfUnknownMessageShouldFailBeforeStreaming() {
        assertThatThrownBy(() -> service.exportMessage("msg_unknown"))
                .isInstanceOf(MessageNotFoundException.class);
    }

    @Test
    void backupShouldWriteAllMessagesToFile() throws Exception {
        Path target = tempDir.resolve("backup/all.jsonl");

        WriteReport report = service.backupMessages(List.of("msg_a", "msg_b"), target).block();

        assertThat(report.records()).isEqualTo(6);
        assertThat(Files.readAllLines(target)).hasSize(6);
    }

    @Test
    void backupShouldWaitForSlowSink() {
        BoundedBufferSink sink = new BoundedBufferSink(64);

        CompletableFuture<WriteReport> future = service.writeBackup(List.of("msg_a", "msg_b"), sink).toFuture();
        while (!future.isDone()) {
            sink.drain();
        }

        WriteReport report = future.join();
        assertThat(report.records()).isEqualTo(6);
        assertThat(report.waits()).isPositive();
        assertThat(sink.writeLineCounts()).containsExactly(2, 2, 2);
        assertThat(sink.isCompleted()).isTrue();
    }

    private void persist(String messageId, int blocks) {
        Message message = Message.start(messageId, "conv", T0);
        for (int i = 0; i < blocks; i++) {
            Block block = Block.open(messageId, BlockKind.TEXT, BlockStatus.SUCCESS, "part-" + i, T0);
            message = message.withBlock(block.id(), T0);
            store.saveBlock(block).block();
        }
        store.saveMessage(message.withStatus(MessageStatus.SUCCESS, T0)).block();
    }
}
