package com.linlay.blockstream.cache;

import com.linlay.blockstream.stream.model.Chunk;
import org.springframework.util.StringUtils;

import java.util.Objects;

/**
 * Keeps the latest thought signature per conversation so the next turn can echo it back.
 */
public class ThoughtSignatureCapture implements ContinuationCapture {

    public static final String PROVIDER_TAG = "google";
    static final String SIGNATURE_KEY = "thoughtSignature";

    private final ContinuationCache<String> cache;

    public ThoughtSignatureCapture(ContinuationCache<String> cache) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
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
        Object signature = raw.providerMetadata().get(SIGNATURE_KEY);
        if (!(signature instanceof String value)) {
            return false;
        }
        cache.set(conversationId, value);
        return true;
    }
}
