package com.marketplace.shared.effects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.shared.cache.CacheSynchronizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
class CacheReconciler implements EffectReconciler {

    private final CacheSynchronizer cacheSynchronizer;
    private final ObjectMapper objectMapper;

    @Override
    public EffectStep step() {
        return EffectStep.CACHE;
    }

    @Override
    public void reconcile(EffectFailureRecord failure) throws Exception {
        cacheSynchronizer.invalidate(objectMapper.readTree(failure.getPayload()).get("key").asText());
    }
}
