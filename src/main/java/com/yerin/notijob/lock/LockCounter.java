package com.yerin.notijob.lock;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 리소스별 보유 중인 락 수. drain 은 모든 값이 0이 될 때까지 기다린다.
 */
public class LockCounter {

    private final Map<String, AtomicInteger> counters = new ConcurrentHashMap<>();

    public int increment(String resource) {
        return counters.computeIfAbsent(resource, r -> new AtomicInteger()).incrementAndGet();
    }

    public int decrement(String resource) {
        AtomicInteger counter = counters.get(resource);
        if (counter == null) {
            throw new IllegalStateException("Lock counter for " + resource + " was never incremented");
        }
        return counter.updateAndGet(v -> Math.max(0, v - 1));
    }

    public int get(String resource) {
        AtomicInteger counter = counters.get(resource);
        return counter == null ? 0 : counter.get();
    }

    public boolean allReleased() {
        return counters.values().stream().allMatch(c -> c.get() == 0);
    }
}
