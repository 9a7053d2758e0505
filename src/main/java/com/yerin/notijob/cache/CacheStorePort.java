package com.yerin.notijob.cache;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

public interface CacheStorePort {

    boolean isReady();

    Optional<String> get(String key);

    void set(String key, String value, long ttlSeconds);

    long del(Collection<String> keys);

    Set<String> members(String setKey);

    void atomically(Consumer<CacheBatch> commands);

    KeyPageCursor scan(String pattern, int pageSize);
}
