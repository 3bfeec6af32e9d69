package com.linlay.blockstream.controller;

import com.linlay.blockstream.model.api.ApiResponse;
import com.linlay.blockstream.model.api.CancelStreamResponse;
import com.linlay.blockstream.model.api.StreamStatusResponse;
import com.linlay.blockstream.service.ActiveStreamRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/streams")
public class StreamController {

    private static final Logger log = LoggerFactory.getLogger(StreamController.class);

    private final ActiveStreamRegistry streamRegistry;

    public StreamController(ActiveStreamRegistry streamRegistry) {
        this.streamRegistry = streamRegistry;
    }

    @GetMapping("/{messageId}")
    public ApiResponse<StreamStatusResponse> status(@PathVariable String messageId) {
        return ApiResponse.success(new StreamStatusResponse(
                messageId,
                streamRegistry.isStreaming(messageId),
                streamRegistry.activeCount()
        ));
    }

    @PostMapping("/{messageId}/cancel")
    public ApiResponse<CancelStreamResponse> cancel(@PathVariable String messageId) {
        ActiveStreamRegistry.CancelAck ack = streamRegistry.cancel(messageId);
        log.info("Received stream cancel messageId={}, accepted={}, status={}", messageId, ack.accepted(), ack.status());
        return ApiResponse.success(new CancelStreamResponse(
                messageId,
                ack.accepted(),
                ack.status(),
                ack.detail()
        ));
    }
}
