package com.linlay.blockstream.stream.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class IdleTimeoutMessage {

    public static final String DEFAULT_TEMPLATE = "SSE idle timeout after %s minutes";

    private IdleTimeoutMessage() {
    }

    public static String format(String template, long timeoutMs) {
        String effective = template == null || template.isBlank() ? DEFAULT_TEMPLATE : template;
        return effective.formatted(minutes(timeoutMs));
    }

    /**
     * Minutes with at most two decimals, trailing zeros dropped: 300000 -> "5", 1000 -> "0.02".
     */
    public static String minutes(long timeoutMs) {
        return BigDecimal.valueOf(Math.max(0L, timeoutMs))
                .divide(BigDecimal.valueOf(60_000L), 2, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
    }
}
