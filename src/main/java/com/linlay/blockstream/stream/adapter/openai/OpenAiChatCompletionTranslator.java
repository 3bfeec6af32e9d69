package com.linlay.blockstream.stream.adapter.openai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.blockstream.stream.adapter.ProtocolException;
import com.linlay.blockstream.stream.adapter.RawEventTranslator;
import com.linlay.blockstream.stream.model.Chunk;
import com.linlay.blockstream.stream.model.ErrorKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * OpenAI Compatible SSE 行解析：把 {@code data: {...}} 形式的 chat completion delta 转换为 chunk。
 * <p>
 * tool_calls 只在首个分片携带 id，后续分片按 index 关联，因此实例按流维护 index 到 id 的映射，
 * 一个实例只服务一条流。
 */
public class OpenAiChatCompletionTranslator implements RawEventTranslator<String> {

    public static final String PROVIDER_TAG = "openai";

    private final ObjectMapper objectMapper;
    private final Map<Integer, String> toolIdsByIndex = new LinkedHashMap<>();
    private final Set<String> openToolIds = new LinkedHashSet<>();

    public OpenAiChatCompletionTranslator(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    @Override
    public List<Chunk> translate(String rawChunk) {
        String payload = normalizePayload(rawChunk);
        if (payload == null) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException ex) {
            throw new ProtocolException("Failed to parse OpenAI SSE chunk: " + ex.getOriginalMessage(), false, ex);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException("OpenAI SSE chunk is not an object");
        }

        List<Chunk> chunks = new ArrayList<>();
        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            String message = optionalText(error.get("message"));
            chunks.add(new Chunk.Error(
                    ErrorKind.PROVIDER,
                    hasText(message) ? message : error.toString()
            ));
            return chunks;
        }

        JsonNode choices = root.path("choices");
        if (choices.isArray() && !choices.isEmpty()) {
            JsonNode firstChoice = choices.get(0);
            JsonNode deltaNode = firstChoice.path("delta");

            String reasoning = optionalText(deltaNode.get("reasoning_content"));
            if (reasoning == null) {
                reasoning = optionalText(deltaNode.get("reasoning"));
            }
            if (hasContent(reasoning)) {
                chunks.add(new Chunk.ReasoningDelta(reasoning));
            }
            String content = optionalText(deltaNode.get("content"));
            if (hasContent(content)) {
                chunks.add(new Chunk.TextDelta(content));
            }

            JsonNode toolCallsNode = deltaNode.path("tool_calls");
            if (toolCallsNode.isArray()) {
                for (JsonNode toolCallNode : toolCallsNode) {
                    translateToolCall(toolCallNode, chunks);
                }
            }

            String finishReason = optionalText(firstChoice.get("finish_reason"));
            if (hasText(finishReason)) {
                for (String toolId : openToolIds) {
                    chunks.add(new Chunk.ToolCallEnd(toolId, null));
                }
                openToolIds.clear();
                chunks.add(new Chunk.Finish(normalizeFinishReason(finishReason)));
            }
        }

        Map<String, Object> usage = parseUsage(root.get("usage"));
        if (usage != null) {
            chunks.add(new Chunk.Raw(PROVIDER_TAG, Map.of("usage", usage)));
        }
        return chunks;
    }

    private void translateToolCall(JsonNode toolCallNode, List<Chunk> chunks) {
        String id = optionalText(toolCallNode.get("id"));
        Integer index = optionalInt(toolCallNode.get("index"));
        JsonNode functionNode = toolCallNode.path("function");
        String name = optionalText(functionNode.get("name"));
        String arguments = optionalText(functionNode.get("arguments"));
        if (!hasText(id) && index == null && !hasText(name) && !hasText(arguments)) {
            return;
        }

        String resolvedId = id;
        if (!hasText(resolvedId)) {
            resolvedId = index == null ? null : toolIdsByIndex.get(index);
        }
        if (!hasText(resolvedId)) {
            if (index == null) {
                throw new ProtocolException("tool call delta without id or index");
            }
            resolvedId = "call_" + index;
        }
        if (index != null) {
            toolIdsByIndex.putIfAbsent(index, resolvedId);
        }
        if (openToolIds.add(resolvedId)) {
            chunks.add(new Chunk.ToolCallStart(resolvedId, name));
        }
        if (hasContent(arguments)) {
            chunks.add(new Chunk.ToolCallDelta(resolvedId, arguments));
        }
    }

    private String normalizeFinishReason(String finishReason) {
        return switch (finishReason) {
            case "tool_calls", "function_call" -> "tool-calls";
            case "content_filter" -> "content-filter";
            default -> finishReason;
        };
    }

    private Map<String, Object> parseUsage(JsonNode usageNode) {
        if (usageNode == null || usageNode.isNull() || usageNode.isMissingNode() || !usageNode.isObject()) {
            return null;
        }
        Map<String, Object> usage = new LinkedHashMap<>();
        usageNode.fields().forEachRemaining(entry -> {
            Object normalized = normalizeUsageValue(entry.getValue());
            if (normalized != null) {
                usage.put(entry.getKey(), normalized);
            }
        });
        return usage.isEmpty() ? null : usage;
    }

    private Object normalizeUsageValue(JsonNode valueNode) {
        if (valueNode == null || valueNode.isNull() || valueNode.isMissingNode()) {
            return null;
        }
        if (valueNode.isInt() || valueNode.isLong()) {
            return valueNode.asLong();
        }
        if (valueNode.isFloat() || valueNode.isDouble() || valueNode.isBigDecimal()) {
            return valueNode.doubleValue();
        }
        if (valueNode.isTextual()) {
            return valueNode.asText();
        }
        if (valueNode.isBoolean()) {
            return valueNode.asBoolean();
        }
        if (valueNode.isObject()) {
            Map<String, Object> map = new LinkedHashMap<>();
            valueNode.fields().forEachRemaining(entry ->
                    map.put(entry.getKey(), normalizeUsageValue(entry.getValue()))
            );
            return map;
        }
        return valueNode.toString();
    }

    private String normalizePayload(String rawChunk) {
        if (!hasText(rawChunk)) {
            return null;
        }
        String payload = rawChunk.trim();
        if (payload.startsWith("data:")) {
            payload = payload.substring(5).trim();
        }
        if (!hasText(payload) || "[DONE]".equals(payload)) {
            return null;
        }
        return payload;
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

    private Integer optionalInt(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isInt() || node.isLong()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    private boolean hasContent(String text) {
        return text != null && !text.isEmpty();
    }

    private boolean hasText(String text) {
        return text != null && !text.isBlank();
    }
}
