package com.linlay.blockstream.stream.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public sealed interface Chunk permits
        Chunk.TextDelta,
        Chunk.ReasoningDelta,
        Chunk.ToolCallStart,
        Chunk.ToolCallDelta,
        Chunk.ToolCallEnd,
        Chunk.Image,
        Chunk.Raw,
        Chunk.Error,
        Chunk.Finish {

    ChunkType type();

    record TextDelta(String text) implements Chunk {
        public TextDelta {
            requireNonNull(text, "text");
        }

        @Override
        public ChunkType type() {
            return ChunkType.TEXT_DELTA;
        }
    }

    record ReasoningDelta(String text) implements Chunk {
        public ReasoningDelta {
            requireNonNull(text, "text");
        }

        @Override
        public ChunkType type() {
            return ChunkType.REASONING_DELTA;
        }
    }

    record ToolCallStart(String id, String name) implements Chunk {
        public ToolCallStart {
            requireNonBlank(id, "id");
        }

        @Override
        public ChunkType type() {
            return ChunkType.TOOL_CALL_START;
        }
    }

    record ToolCallDelta(String id, String argsFragment) implements Chunk {
        public ToolCallDelta {
            requireNonBlank(id, "id");
            requireNonNull(argsFragment, "argsFragment");
        }

        @Override
        public ChunkType type() {
            return ChunkType.TOOL_CALL_DELTA;
        }
    }

    /**
     * Tool call completed. {@code result} is null when the call ended without a result
     * (e.g. the provider only finished streaming arguments).
     */
    record ToolCallEnd(String id, Object result, boolean failed) implements Chunk {
        public ToolCallEnd {
            requireNonBlank(id, "id");
        }

        public ToolCallEnd(String id, Object result) {
            this(id, result, false);
        }

        @Override
        public ChunkType type() {
            return ChunkType.TOOL_CALL_END;
        }
    }

    record Image(String data, String mimeType) implements Chunk {
        public Image {
            requireNonBlank(data, "data");
            requireNonBlank(mimeType, "mimeType");
        }

        @Override
        public ChunkType type() {
            return ChunkType.IMAGE;
        }
    }

    /**
     * Provider passthrough. {@code providerMetadata} is the persistent side-data
     * (item ids, encrypted continuation content); empty when the payload is informational only.
     */
    record Raw(String providerTag, Map<String, Object> payload, Map<String, Object> providerMetadata) implements Chunk {
        public Raw {
            requireNonBlank(providerTag, "providerTag");
            payload = copyOf(payload);
            providerMetadata = copyOf(providerMetadata);
        }

        public Raw(String providerTag, Map<String, Object> payload) {
            this(providerTag, payload, Map.of());
        }

        public boolean hasPersistentSideData() {
            return !providerMetadata.isEmpty();
        }

        @Override
        public ChunkType type() {
            return ChunkType.RAW;
        }
    }

    /**
     * {@code timeoutMs} is only set for {@link ErrorKind#TIMEOUT}.
     */
    record Error(ErrorKind kind, String message, Long timeoutMs) implements Chunk {
        public Error {
            requireNonNull(kind, "kind");
            message = message == null ? "" : message;
        }

        public Error(ErrorKind kind, String message) {
            this(kind, message, null);
        }

        public boolean isTerminal() {
            return kind != ErrorKind.PROTOCOL;
        }

        @Override
        public ChunkType type() {
            return ChunkType.ERROR;
        }
    }

    record Finish(String reason) implements Chunk {

        public static final String STOP = "stop";
        public static final String ABORTED = "aborted";
        public static final String ERROR = "error";

        public Finish {
            requireNonBlank(reason, "reason");
        }

        public boolean isAbnormal() {
            return ABORTED.equals(reason) || ERROR.equals(reason);
        }

        @Override
        public ChunkType type() {
            return ChunkType.FINISH;
        }
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        return source == null || source.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    private static void requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be null or blank");
        }
    }

    private static void requireNonNull(Object value, String fieldName) {
        if (value == null) {
            throw new IllegalArgumentException(fieldName + " must not be null");
        }
    }
}
