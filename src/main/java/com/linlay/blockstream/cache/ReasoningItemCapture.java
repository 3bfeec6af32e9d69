package com.linlay.blockstream.cache;

import com.linlay.blockstream.stream.model.Chunk;
import org.springframework.util.StringUtils;

import java.util.Objects;

/**
 * Stores encrypted reasoning items keyed by conversation and provider item id.
 */
public class ReasoningItemCapture implements ContinuationCapture {

    public static final String PROVIDER_TAG = "openai-responses";
    static final String ITEM_ID_KEY = "itemId";
    static final String ENCRYPTED_CONTENT_KEY = "reasoningEncryptedContent";

    private final ContinuationCache<String> cache;

    public ReasoningItemCapture(ContinuationCache<String> cache) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
    }

    public static String cacheKey(String conversationId, String itemId) {
        return conversationId + ":" + itemId;
    }

    @Override
    public String providerTag() {
        return PROVIDER_TAG;
    }

    @Override
    public boolean capture(String conversationId, Chunk.Raw raw) {
        if (!StringUtils.hasText(conversationId) || raw == null || !PROVIDER_TAG.equals(raw.providerTag())) {
            return false;
        }
        Object itemId = raw.providerMetadata().get(ITEM_ID_KEY);
        Object encrypted = raw.providerMetadata().get(ENCRYPTED_CONTENT_KEY);
        if (!(itemId instanceof String id) || !StringUtils.hasText(id) || !(encrypted instanceof String content)) {
            return false;
        }
        cache.set(cacheKey(conversationId, id), content);
        return true;
    }
}
