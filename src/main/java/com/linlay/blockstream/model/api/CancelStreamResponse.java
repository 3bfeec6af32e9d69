package com.linlay.blockstream.model.api;

public record CancelStreamResponse(
        String messageId,
        boolean accepted,
        String status,
        String detail
) {
}
