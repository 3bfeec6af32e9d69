package com.linlay.blockstream.stream.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.blockstream.stream.model.Chunk;
import com.linlay.blockstream.stream.model.ErrorKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Translates discriminated stream parts ({@code {"type":"text-delta","text":"..."}}) as produced
 * by SDK-normalised provider streams.
 */
public class StreamPartTranslator implements RawEventTranslator<JsonNode> {

    private static final Set<String> LIFECYCLE_PARTS = Set.of(
            "start",
            "start-step",
            "finish-step",
            "text-start",
            "text-end",
            "reasoning-start",
            "reasoning-end",
            "tool-input-end"
    );

    private final ObjectMapper objectMapper;
    private final String providerTag;
    private final Set<String> startedToolCalls = new HashSet<>();

    public StreamPartTranslator(ObjectMapper objectMapper, String providerTag) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        if (providerTag == null || providerTag.isBlank()) {
            throw new IllegalArgumentException("providerTag must not be blank");
        }
        this.providerTag = providerTag;
    }

    @Override
    public boolean isAbort(JsonNode rawEvent) {
        return rawEvent != null && "abort".equals(rawEvent.path("type").asText(null));
    }

    @Override
    public List<Chunk> translate(JsonNode part) {
        if (part == null || !part.isObject()) {
            throw new ProtocolException("stream part is not an object");
        }
        String type = optionalText(part.get("type"));
        if (!hasText(type)) {
            throw new ProtocolException("stream part without type");
        }
        if (LIFECYCLE_PARTS.contains(type)) {
            return List.of();
        }
        return switch (type) {
            case "text-delta" -> List.of(new Chunk.TextDelta(requireDelta(part, type)));
            case "reasoning-delta" -> List.of(new Chunk.ReasoningDelta(requireDelta(part, type)));
            case "tool-input-start" -> toolInputStart(part);
            case "tool-input-delta" -> List.of(new Chunk.ToolCallDelta(
                    requireText(part, "id", type),
                    requireDelta(part, type)
            ));
            case "tool-call" -> toolCall(part);
            case "tool-result" -> List.of(new Chunk.ToolCallEnd(
                    requireText(part, "toolCallId", type),
                    toPlainValue(part.get("output"))
            ));
            case "tool-error" -> List.of(new Chunk.ToolCallEnd(
                    requireText(part, "toolCallId", type),
                    errorMessage(part.get("error")),
                    true
            ));
            case "file" -> file(part);
            case "raw" -> List.of(raw(part));
            case "error" -> List.of(new Chunk.Error(ErrorKind.PROVIDER, errorMessage(part.get("error"))));
            case "finish" -> List.of(finish(part));
            default -> throw new ProtocolException("unrecognized stream part type: " + type);
        };
    }

    private List<Chunk> toolInputStart(JsonNode part) {
        String id = requireText(part, "id", "tool-input-start");
        startedToolCalls.add(id);
        return List.of(new Chunk.ToolCallStart(id, optionalText(part.get("toolName"))));
    }

    private List<Chunk> toolCall(JsonNode part) {
        String id = requireText(part, "toolCallId", "tool-call");
        if (!startedToolCalls.add(id)) {
            // arguments were already streamed through tool-input-delta
            return List.of();
        }
        List<Chunk> chunks = new ArrayList<>(2);
        chunks.add(new Chunk.ToolCallStart(id, optionalText(part.get("toolName"))));
        JsonNode input = part.get("input");
        if (input != null && !input.isNull() && !input.isMissingNode()) {
            chunks.add(new Chunk.ToolCallDelta(id, input.isTextual() ? input.asText() : input.toString()));
        }
        return chunks;
    }

    private List<Chunk> file(JsonNode part) {
        String mediaType = firstText(part, "mediaType", "mimeType");
        if (!hasText(mediaType) || !mediaType.startsWith("image/")) {
            throw new ProtocolException("unsupported file media type: " + mediaType);
        }
        String data = firstText(part, "base64", "data", "url");
        if (!hasText(data)) {
            throw new ProtocolException("file part without data");
        }
        return List.of(new Chunk.Image(data, mediaType));
    }

    private Chunk.Raw raw(JsonNode part) {
        String tag = hasText(optionalText(part.get("provider"))) ? part.get("provider").asText() : providerTag;
        Map<String, Object> payload = new LinkedHashMap<>();
        JsonNode rawValue = part.get("rawValue");
        if (rawValue != null && !rawValue.isNull()) {
            payload.put("rawValue", toPlainValue(rawValue));
        }
        Map<String, Object> metadata = Map.of();
        JsonNode metadataNode = part.path("providerMetadata");
        if (metadataNode.isObject()) {
            JsonNode scoped = metadataNode.has(tag) ? metadataNode.get(tag) : metadataNode;
            metadata = toMap(scoped);
        }
        return new Chunk.Raw(tag, payload, metadata);
    }

    private Chunk.Finish finish(JsonNode part) {
        JsonNode reason = part.get("finishReason");
        if (reason == null || reason.isMissingNode()) {
            return new Chunk.Finish(Chunk.Finish.STOP);
        }
        if (!reason.isTextual() || !hasText(reason.asText())) {
            throw new ProtocolException("malformed finish reason: " + reason, true, null);
        }
        return new Chunk.Finish(reason.asText());
    }

    private String requireDelta(JsonNode part, String type) {
        for (String field : List.of("text", "delta", "textDelta")) {
            JsonNode node = part.get(field);
            if (node != null && node.isTextual()) {
                return node.asText();
            }
        }
        throw new ProtocolException(type + " without text");
    }

    private String requireText(JsonNode part, String field, String type) {
        String value = optionalText(part.get(field));
        if (!hasText(value)) {
            throw new ProtocolException(type + " without " + field);
        }
        return value;
    }

    private String firstText(JsonNode part, String... fields) {
        for (String field : fields) {
            String value = optionalText(part.get(field));
            if (hasText(value)) {
                return value;
            }
        }
        return null;
    }

    private String errorMessage(JsonNode error) {
        if (error == null || error.isNull() || error.isMissingNode()) {
            return "unknown provider error";
        }
        if (error.isTextual()) {
            return error.asText();
        }
        String message = optionalText(error.get("message"));
        return hasText(message) ? message : error.toString();
    }

    private Object toPlainValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return objectMapper.convertValue(node, Object.class);
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        Map<String, Object> map = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> map.put(entry.getKey(), toPlainValue(entry.getValue())));
        return map;
    }

    private String optionalText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return node.toString();
    }

    private boolean hasText(String text) {
        return text != null && !text.isBlank();
    }
}
