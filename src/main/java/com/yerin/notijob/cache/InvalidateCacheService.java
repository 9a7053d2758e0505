package com.yerin.notijob.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 캐시 무효화는 best-effort 다. 실패해도 로그만 남기고 호출 측의 쓰기 흐름은 계속된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InvalidateCacheService {

    private final CacheService cacheService;

    public void invalidateByKey(String key) {
        if (!cacheService.cacheEnabled()) return;

        try {
            cacheService.del(key);
        } catch (RuntimeException e) {
            log.error("[InvalidateCache] failed to delete key={}, err={}", key, e.toString());
        }
    }

    public void invalidateQuery(String scopeKey) {
        if (!cacheService.cacheEnabled()) return;

        try {
            cacheService.delQuery(scopeKey);
        } catch (RuntimeException e) {
            log.error("[InvalidateCache] failed to delete query scope={}, err={}", scopeKey, e.toString());
        }
    }

    public void clearByPattern(String pattern) {
        if (!cacheService.cacheEnabled()) return;
        if (pattern == null || pattern.isBlank()) {
            log.warn("[InvalidateCache] empty pattern, nothing to clear");
            return;
        }

        try {
            long deleted = cacheService.delByPattern(pattern);
            log.debug("[InvalidateCache] cleared pattern={}, deleted={}", pattern, deleted);
        } catch (RuntimeException e) {
            log.error("[InvalidateCache] failed to delete pattern={}, err={}", pattern, e.toString());
        }
    }
}
