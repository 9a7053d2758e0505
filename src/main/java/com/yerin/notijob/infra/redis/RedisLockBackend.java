package com.yerin.notijob.infra.redis;

import com.yerin.notijob.global.exception.BackendTransientException;
import com.yerin.notijob.lock.LockBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;

/**
 * Redis 노드 하나를 락 백엔드로 사용한다. SET NX PX 로 점유하고, 토큰 비교 후 삭제하는 스크립트로 해제한다.
 */
@Slf4j
public class RedisLockBackend implements LockBackend {

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>("""
            if redis.call('get', KEYS[1]) == ARGV[1] then
              return redis.call('del', KEYS[1])
            end
            return 0
            """, Long.class);

    private final String name;
    private final StringRedisTemplate redis;
    private final String keyPrefix;
    private final Runnable onClose;

    public RedisLockBackend(String name, StringRedisTemplate redis, String keyPrefix, Runnable onClose) {
        this.name = name;
        this.redis = redis;
        this.keyPrefix = keyPrefix;
        this.onClose = onClose;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean tryAcquire(String resource, String token, long ttlMillis) {
        try {
            Boolean ok = redis.opsForValue().setIfAbsent(key(resource), token, Duration.ofMillis(ttlMillis));
            return Boolean.TRUE.equals(ok);
        } catch (DataAccessException e) {
            throw new BackendTransientException("lock acquire failed on " + name, e);
        }
    }

    @Override
    public boolean release(String resource, String token) {
        try {
            Long deleted = redis.execute(RELEASE_SCRIPT, List.of(key(resource)), token);
            return deleted != null && deleted > 0;
        } catch (DataAccessException e) {
            throw new BackendTransientException("lock release failed on " + name, e);
        }
    }

    @Override
    public void close() {
        onClose.run();
        log.info("[RedisLock] backend closed name={}", name);
    }

    private String key(String resource) {
        return keyPrefix + resource;
    }
}
