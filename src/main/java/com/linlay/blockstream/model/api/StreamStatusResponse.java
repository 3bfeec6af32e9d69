package com.linlay.blockstream.model.api;

public record StreamStatusResponse(
        String messageId,
        boolean streaming,
        int activeStreams
) {
}
