package com.linlay.blockstream.controller;

import com.linlay.blockstream.block.Message;
import com.linlay.blockstream.export.BlockExportService;
import com.linlay.blockstream.model.api.ApiResponse;
import com.linlay.blockstream.model.api.MessageDetailResponse;
import com.linlay.blockstream.persistence.JsonlBlockStore;
import com.linlay.blockstream.persistence.StoredMessage;
import com.linlay.blockstream.service.ActiveStreamRegistry;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

@RestController
@RequestMapping("/api/messages")
public class MessageController {

    private final JsonlBlockStore blockStore;
    private final BlockExportService exportService;
    private final ActiveStreamRegistry streamRegistry;

    public MessageController(JsonlBlockStore blockStore, BlockExportService exportService, ActiveStreamRegistry streamRegistry) {
        this.blockStore = blockStore;
        this.exportService = exportService;
        this.streamRegistry = streamRegistry;
    }

    @GetMapping("/{messageId}")
    public ApiResponse<MessageDetailResponse> message(@PathVariable String messageId) {
        StoredMessage stored = blockStore.requireMessage(messageId);
        Message message = stored.message();
        return ApiResponse.success(new MessageDetailResponse(
                message.id(),
                message.conversationId(),
                message.status(),
                streamRegistry.isStreaming(message.id()),
                message.metadata(),
                stored.blocks(),
                message.updatedAt()
        ));
    }

    @GetMapping(value = "/{messageId}/export", produces = MediaType.APPLICATION_NDJSON_VALUE)
    public Flux<byte[]> export(@PathVariable String messageId) {
        return exportService.exportMessage(messageId);
    }
}
