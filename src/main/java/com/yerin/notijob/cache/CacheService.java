package com.yerin.notijob.cache;

import com.yerin.notijob.global.exception.BackendTransientException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 공유 인메모리 저장소 위의 얇은 캐시 계층. 캐시는 성능용이므로 백엔드가 없으면 모든 연산이 조용히 빠진다.
 */
@Slf4j
@Service
public class CacheService {

    static final double TTL_VARIANT_PERCENTAGE = 0.1;
    private static final String ALL_KEYS = "*";

    private final CacheStorePort store;
    private final boolean enabled;
    private final long cacheTtlSeconds;
    private final int scanCount;
    private final DoubleSupplier random;

    @Autowired
    public CacheService(ObjectProvider<CacheStorePort> store,
                        @Value("${notijob.cache.enabled:true}") boolean enabled,
                        @Value("${notijob.cache.ttl-seconds:7200}") long cacheTtlSeconds,
                        @Value("${notijob.cache.scan-count:100}") int scanCount) {
        this(store.getIfAvailable(), enabled, cacheTtlSeconds, scanCount, () -> ThreadLocalRandom.current().nextDouble());
    }

    public CacheService(CacheStorePort store, boolean enabled, long cacheTtlSeconds, int scanCount, DoubleSupplier random) {
        this.store = store;
        this.enabled = enabled;
        this.cacheTtlSeconds = cacheTtlSeconds;
        this.scanCount = scanCount;
        this.random = random;
        log.info("[Cache] initiated enabled={}, store={}, ttl={}s", enabled, store == null ? "none" : store.getClass().getSimpleName(), cacheTtlSeconds);
    }

    public boolean cacheEnabled() {
        boolean ready = enabled && store != null && store.isReady();
        if (!ready) {
            log.debug("[Cache] cache service is not enabled");
        }
        return ready;
    }

    /** 백엔드 오류는 캐시 미스로 본다. */
    public Optional<String> get(String key) {
        if (!cacheEnabled()) return Optional.empty();
        try {
            return store.get(key);
        } catch (BackendTransientException e) {
            log.warn("[Cache] get failed key={}, err={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public void set(String key, String value) {
        set(key, value, null);
    }

    public void set(String key, String value, Long ttlSeconds) {
        if (!cacheEnabled()) return;
        try {
            store.set(key, value, ttlInSeconds(ttlSeconds));
        } catch (BackendTransientException e) {
            log.warn("[Cache] set failed key={}, err={}", key, e.getMessage());
        }
    }

    public long del(String key) {
        return del(List.of(key));
    }

    public long del(Collection<String> keys) {
        if (!cacheEnabled() || keys.isEmpty()) return 0;
        return store.del(keys);
    }

    /**
     * 쿼리 결과를 저장하면서 쿼리 셋에 판별자를 등록한다. 셋의 TTL 은 항상 항목 TTL 보다 길다.
     */
    public void setQuery(String key, String value, Long ttlSeconds) {
        if (!cacheEnabled()) return;

        CacheKeys.SplitKey split = CacheKeys.splitKey(key);
        if (split.query() == null) {
            throw new IllegalArgumentException("query key must contain ':" + CacheKeys.QUERY_PREFIX + "=': " + key);
        }
        long ttl = ttlInSeconds(ttlSeconds);

        try {
            store.atomically(batch -> batch
                    .sadd(split.credentials(), split.query())
                    .expire(split.credentials(), cacheTtlSeconds + ttl)
                    .set(key, value, ttl));
        } catch (BackendTransientException e) {
            log.warn("[Cache] setQuery failed key={}, err={}", key, e.getMessage());
        }
    }

    /** 쿼리 셋에 등록된 모든 항목과 셋 자체를 지운다. 멤버가 없으면 아무것도 하지 않는다. */
    public void delQuery(String scopeKey) {
        if (!cacheEnabled()) return;

        Set<String> queries = store.members(scopeKey);
        if (queries.isEmpty()) return;

        store.atomically(batch -> {
            queries.forEach(query -> batch.del(CacheKeys.memberKey(scopeKey, query)));
            batch.del(scopeKey);
        });
    }

    /**
     * SCAN 으로 패턴에 맞는 키를 페이지 단위로 받아 바로 삭제한다.
     *
     * @return 삭제된 키 수
     */
    public long delByPattern(String pattern) {
        if (!cacheEnabled()) return 0;

        long deleted = 0;
        try (KeyPageCursor cursor = store.scan(pattern, scanCount)) {
            while (cursor.hasNext()) {
                List<String> page = cursor.next();
                if (!page.isEmpty()) {
                    deleted += store.del(page);
                }
            }
        }
        log.debug("[Cache] delByPattern pattern={}, deleted={}", pattern, deleted);
        return deleted;
    }

    public List<String> keys(String pattern) {
        if (!cacheEnabled()) return List.of();

        List<String> keys = new ArrayList<>();
        try (KeyPageCursor cursor = store.scan(pattern == null ? ALL_KEYS : pattern, scanCount)) {
            cursor.forEachRemaining(keys::addAll);
        }
        return keys;
    }

    long ttlInSeconds(Long ttlSeconds) {
        long seconds = ttlSeconds == null || ttlSeconds <= 0 ? cacheTtlSeconds : ttlSeconds;
        return ttlVariant(seconds);
    }

    // [0.95 * ttl, 1.05 * ttl] 안의 정수로 흩어 동시 만료를 피한다. 0 초는 Redis 가 거부하므로 최소 1
    long ttlVariant(long ttl) {
        double spread = TTL_VARIANT_PERCENTAGE * ttl;
        long lower = (long) Math.ceil(ttl - spread / 2);
        long upper = (long) Math.floor(ttl + spread / 2);
        long varied = (long) Math.floor(ttl - spread / 2 + spread * random.getAsDouble());
        return Math.max(1, Math.min(upper, Math.max(lower, varied)));
    }
}
