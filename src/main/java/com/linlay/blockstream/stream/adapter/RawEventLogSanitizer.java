package com.linlay.blockstream.stream.adapter;

import java.util.regex.Pattern;

/**
 * 原始 provider 事件日志脱敏工具。
 * <p>
 * 屏蔽 API Key、Bearer Token 以及续接凭据（encrypted_content、thoughtSignature），避免不透明的
 * provider 状态出现在日志中。该类为纯静态工具类，无状态。
 */
public final class RawEventLogSanitizer {

    private static final Pattern JSON_SECRET_VALUE_PATTERN = Pattern.compile(
            "(?i)(\"(?:authorization|api[_-]?key|access[_-]?token|token|secret|password"
                    + "|encrypted[_-]?content|reasoning[_-]?encrypted[_-]?content|thought[_-]?signature)\"\\s*:\\s*)\"([^\"]*)\""
    );
    private static final Pattern BEARER_TOKEN_PATTERN = Pattern.compile("(?i)(Bearer\\s+)[A-Za-z0-9._\\-+/=]+");
    private static final int MAX_LOGGED_LENGTH = 2_000;

    private RawEventLogSanitizer() {
    }

    public static String maskText(Object rawEvent) {
        if (rawEvent == null) {
            return "";
        }
        String text = String.valueOf(rawEvent);
        if (text.isEmpty()) {
            return text;
        }
        String masked = JSON_SECRET_VALUE_PATTERN.matcher(text).replaceAll("$1\"***\"");
        masked = BEARER_TOKEN_PATTERN.matcher(masked).replaceAll("$1***");
        if (masked.length() > MAX_LOGGED_LENGTH) {
            return masked.substring(0, MAX_LOGGED_LENGTH) + "...(" + masked.length() + " chars)";
        }
        return masked;
    }
}
