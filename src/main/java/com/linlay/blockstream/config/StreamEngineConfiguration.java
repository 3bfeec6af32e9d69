package com.linlay.blockstream.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.blockstream.block.BlockTransitionPolicy;
import com.linlay.blockstream.cache.ContinuationCache;
import com.linlay.blockstream.cache.ReasoningItemCapture;
import com.linlay.blockstream.cache.ThoughtSignatureCapture;
import com.linlay.blockstream.serializer.NdjsonStreamSerializer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

@Configuration
public class StreamEngineConfiguration {

    public static final String TIMER_SCHEDULER = "streamTimerScheduler";

    @Bean
    public Clock streamClock() {
        return Clock.systemUTC();
    }

    @Bean(name = TIMER_SCHEDULER)
    public Scheduler streamTimerScheduler() {
        return Schedulers.parallel();
    }

    @Bean
    public NdjsonStreamSerializer ndjsonStreamSerializer(ObjectMapper objectMapper) {
        return new NdjsonStreamSerializer(objectMapper);
    }

    @Bean
    public BlockTransitionPolicy blockTransitionPolicy() {
        return new BlockTransitionPolicy();
    }

    @Bean
    public ContinuationCache<String> thoughtSignatureCache(StreamEngineProperties properties, Clock streamClock) {
        return new ContinuationCache<>(ThoughtSignatureCapture.PROVIDER_TAG, properties.getContinuationTtl(), streamClock);
    }

    @Bean
    public ContinuationCache<String> reasoningItemCache(StreamEngineProperties properties, Clock streamClock) {
        return new ContinuationCache<>(ReasoningItemCapture.PROVIDER_TAG, properties.getContinuationTtl(), streamClock);
    }

    @Bean
    public ThoughtSignatureCapture thoughtSignatureCapture(@Qualifier("thoughtSignatureCache") ContinuationCache<String> cache) {
        return new ThoughtSignatureCapture(cache);
    }

    @Bean
    public ReasoningItemCapture reasoningItemCapture(@Qualifier("reasoningItemCache") ContinuationCache<String> cache) {
        return new ReasoningItemCapture(cache);
    }
}
