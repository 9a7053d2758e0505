package com.yerin.notijob.infra;

import com.yerin.notijob.cache.CacheBatch;
import com.yerin.notijob.cache.CacheStorePort;
import com.yerin.notijob.cache.KeyPageCursor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * 단일 프로세스용 캐시 저장소. Redis 없이 띄울 때(local-inmem)와 테스트에서 쓴다.
 */
@Slf4j
@Component
@Profile("local-inmem")
public class InMemoryCacheStoreAdapter implements CacheStorePort {

    private final Map<String, Entry> entries = new HashMap<>();
    private final Clock clock;

    public InMemoryCacheStoreAdapter() {
        this(Clock.systemUTC());
    }

    public InMemoryCacheStoreAdapter(Clock clock) {
        this.clock = clock;
    }

    private record Entry(String value, Set<String> members, long expiresAtMillis) {
        boolean expired(long now) {
            return expiresAtMillis > 0 && expiresAtMillis <= now;
        }
    }

    @Override
    public boolean isReady() {
        return true;
    }

    @Override
    public synchronized Optional<String> get(String key) {
        Entry e = live(key);
        return e == null ? Optional.empty() : Optional.ofNullable(e.value());
    }

    @Override
    public synchronized void set(String key, String value, long ttlSeconds) {
        entries.put(key, new Entry(value, null, expiry(ttlSeconds)));
    }

    @Override
    public synchronized long del(Collection<String> keys) {
        long deleted = 0;
        for (String key : keys) {
            if (live(key) != null) deleted++;
            entries.remove(key);
        }
        return deleted;
    }

    @Override
    public synchronized Set<String> members(String setKey) {
        Entry e = live(setKey);
        return e == null || e.members() == null ? Set.of() : Set.copyOf(e.members());
    }

    @Override
    public void atomically(Consumer<CacheBatch> commands) {
        List<Runnable> queued = new ArrayList<>();
        commands.accept(new QueuedBatch(queued));
        // MULTI/EXEC 처럼 모아 둔 명령을 한 번에 적용
        synchronized (this) {
            queued.forEach(Runnable::run);
        }
    }

    @Override
    public synchronized KeyPageCursor scan(String pattern, int pageSize) {
        Pattern regex = globToRegex(pattern);
        long now = clock.millis();
        List<String> matched = entries.entrySet().stream()
                .filter(e -> !e.getValue().expired(now))
                .map(Map.Entry::getKey)
                .filter(k -> regex.matcher(k).matches())
                .sorted()
                .toList();
        return new ListPageCursor(matched.iterator(), pageSize);
    }

    public synchronized int size() {
        long now = clock.millis();
        return (int) entries.values().stream().filter(e -> !e.expired(now)).count();
    }

    private Entry live(String key) {
        Entry e = entries.get(key);
        if (e != null && e.expired(clock.millis())) {
            entries.remove(key);
            return null;
        }
        return e;
    }

    private long expiry(long ttlSeconds) {
        return ttlSeconds > 0 ? clock.millis() + ttlSeconds * 1000 : 0;
    }

    static Pattern globToRegex(String glob) {
        StringBuilder sb = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> sb.append(".*");
                case '?' -> sb.append('.');
                default -> sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(sb.toString());
    }

    private final class QueuedBatch implements CacheBatch {
        private final List<Runnable> queued;

        private QueuedBatch(List<Runnable> queued) {
            this.queued = queued;
        }

        @Override
        public CacheBatch sadd(String setKey, String member) {
            queued.add(() -> {
                Entry e = live(setKey);
                Set<String> members = e == null || e.members() == null ? new HashSet<>() : new HashSet<>(e.members());
                members.add(member);
                entries.put(setKey, new Entry(null, members, e == null ? 0 : e.expiresAtMillis()));
            });
            return this;
        }

        @Override
        public CacheBatch expire(String key, long ttlSeconds) {
            queued.add(() -> {
                Entry e = live(key);
                if (e != null) entries.put(key, new Entry(e.value(), e.members(), expiry(ttlSeconds)));
            });
            return this;
        }

        @Override
        public CacheBatch set(String key, String value, long ttlSeconds) {
            queued.add(() -> entries.put(key, new Entry(value, null, expiry(ttlSeconds))));
            return this;
        }

        @Override
        public CacheBatch del(String key) {
            queued.add(() -> entries.remove(key));
            return this;
        }
    }

    private static final class ListPageCursor implements KeyPageCursor {
        private final Iterator<String> keys;
        private final int pageSize;

        private ListPageCursor(Iterator<String> keys, int pageSize) {
            this.keys = keys;
            this.pageSize = Math.max(1, pageSize);
        }

        @Override
        public boolean hasNext() {
            return keys.hasNext();
        }

        @Override
        public List<String> next() {
            if (!keys.hasNext()) throw new NoSuchElementException();
            List<String> page = new ArrayList<>(pageSize);
            while (page.size() < pageSize && keys.hasNext()) {
                page.add(keys.next());
            }
            return page;
        }

        @Override
        public void close() {
        }
    }
}
