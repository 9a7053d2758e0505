package com.yerin.notijob.cache;

/**
 * 한 번에 전송되어 모두 적용되거나 모두 실패하는 명령 묶음.
 */
public interface CacheBatch {
    CacheBatch sadd(String setKey, String member);
    CacheBatch expire(String key, long ttlSeconds);
    CacheBatch set(String key, String value, long ttlSeconds);
    CacheBatch del(String key);
}
