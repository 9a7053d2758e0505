package com.yerin.notijob.infra.redis;

import com.yerin.notijob.cache.CacheBatch;
import com.yerin.notijob.cache.CacheStorePort;
import com.yerin.notijob.cache.KeyPageCursor;
import com.yerin.notijob.global.exception.BackendTransientException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

@Slf4j
@Component
@Profile("!local-inmem")
@RequiredArgsConstructor
public class RedisCacheStoreAdapter implements CacheStorePort {

    private final StringRedisTemplate redis;

    private volatile boolean ready = false;

    @PostConstruct
    void init() {
        checkReady();
    }

    @Scheduled(fixedDelayString = "${notijob.cache.health-check-millis:10000}")
    public void checkReady() {
        boolean before = ready;
        try {
            String pong = redis.execute((RedisCallback<String>) c -> c.ping());
            ready = "PONG".equalsIgnoreCase(pong);
        } catch (RuntimeException e) {
            ready = false;
            if (before) log.warn("[RedisCache] backend not reachable: {}", e.toString());
        }
        if (ready != before) log.info("[RedisCache] ready={}", ready);
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redis.opsForValue().get(key));
        } catch (DataAccessException e) {
            throw new BackendTransientException("cache get failed key=" + key, e);
        }
    }

    @Override
    public void set(String key, String value, long ttlSeconds) {
        try {
            redis.opsForValue().set(key, value, Duration.ofSeconds(ttlSeconds));
        } catch (DataAccessException e) {
            throw new BackendTransientException("cache set failed key=" + key, e);
        }
    }

    @Override
    public long del(Collection<String> keys) {
        try {
            Long deleted = redis.delete(keys);
            return deleted == null ? 0 : deleted;
        } catch (DataAccessException e) {
            throw new BackendTransientException("cache del failed keys=" + keys.size(), e);
        }
    }

    @Override
    public Set<String> members(String setKey) {
        try {
            Set<String> members = redis.opsForSet().members(setKey);
            return members == null ? Set.of() : members;
        } catch (DataAccessException e) {
            throw new BackendTransientException("cache smembers failed key=" + setKey, e);
        }
    }

    @Override
    public void atomically(Consumer<CacheBatch> commands) {
        try {
            RedisTransactions.multiExec(redis, ops -> commands.accept(new MultiBatch(ops)));
        } catch (DataAccessException e) {
            throw new BackendTransientException("cache batch failed", e);
        }
    }

    @Override
    public KeyPageCursor scan(String pattern, int pageSize) {
        try {
            Cursor<String> cursor = redis.scan(ScanOptions.scanOptions().match(pattern).count(pageSize).build());
            return new ScanPageCursor(cursor, pageSize);
        } catch (DataAccessException e) {
            throw new BackendTransientException("cache scan failed pattern=" + pattern, e);
        }
    }

    private record MultiBatch(RedisOperations<String, String> ops) implements CacheBatch {
        @Override
        public CacheBatch sadd(String setKey, String member) {
            ops.opsForSet().add(setKey, member);
            return this;
        }

        @Override
        public CacheBatch expire(String key, long ttlSeconds) {
            ops.expire(key, Duration.ofSeconds(ttlSeconds));
            return this;
        }

        @Override
        public CacheBatch set(String key, String value, long ttlSeconds) {
            ops.opsForValue().set(key, value, Duration.ofSeconds(ttlSeconds));
            return this;
        }

        @Override
        public CacheBatch del(String key) {
            ops.delete(key);
            return this;
        }
    }

    /** SCAN 커서를 pageSize 단위 묶음으로 나눈다. 커서는 다음 페이지가 필요할 때만 진행한다. */
    private static final class ScanPageCursor implements KeyPageCursor {
        private final Cursor<String> cursor;
        private final int pageSize;

        private ScanPageCursor(Cursor<String> cursor, int pageSize) {
            this.cursor = cursor;
            this.pageSize = pageSize;
        }

        @Override
        public boolean hasNext() {
            try {
                return cursor.hasNext();
            } catch (DataAccessException e) {
                throw new BackendTransientException("cache scan failed", e);
            }
        }

        @Override
        public List<String> next() {
            if (!hasNext()) throw new NoSuchElementException();
            List<String> page = new ArrayList<>(pageSize);
            try {
                while (page.size() < pageSize && cursor.hasNext()) {
                    page.add(cursor.next());
                }
            } catch (DataAccessException e) {
                throw new BackendTransientException("cache scan failed", e);
            }
            return page;
        }

        @Override
        public void close() {
            cursor.close();
        }
    }
}
