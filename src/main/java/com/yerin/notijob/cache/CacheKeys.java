package com.yerin.notijob.cache;

import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * 캐시 키 규칙.
 * <ul>
 *     <li>엔티티: {@code {prefix}:{entity}:{environmentId}:{id}}</li>
 *     <li>쿼리: {@code {prefix}:{query}:{credentials}:query={discriminator}}, 앞부분이 쿼리 셋 키가 된다</li>
 * </ul>
 */
public final class CacheKeys {

    public static final String QUERY_PREFIX = "query";
    private static final String QUERY_DELIMITER = ":" + QUERY_PREFIX + "=";

    public static final String FEED = "feed";
    public static final String MESSAGE_COUNT = "message_count";
    public static final String SUBSCRIBER = "subscriber";
    public static final String INTEGRATION = "integration";

    private CacheKeys() {}

    public static String entity(String prefix, String entity, String environmentId, String id) {
        return join(prefix, entity, environmentId, id);
    }

    /** 쿼리 셋 키 (무효화 단위). */
    public static String queryScope(String prefix, String query, String environmentId, String subscriberId) {
        return join(prefix, query, environmentId, subscriberId);
    }

    public static String query(String scopeKey, Map<String, ?> queryParams) {
        StringJoiner discriminator = new StringJoiner(",");
        new TreeMap<>(queryParams).forEach((k, v) -> discriminator.add(k + "=" + v));
        return scopeKey + QUERY_DELIMITER + discriminator;
    }

    public static String memberKey(String scopeKey, String member) {
        return scopeKey + QUERY_DELIMITER + member;
    }

    public static SplitKey splitKey(String key) {
        int idx = key.indexOf(QUERY_DELIMITER);
        if (idx < 0) return new SplitKey(key, null);
        return new SplitKey(key.substring(0, idx), key.substring(idx + QUERY_DELIMITER.length()));
    }

    public record SplitKey(String credentials, String query) {}

    private static String join(String... parts) {
        StringJoiner joiner = new StringJoiner(":");
        for (String p : parts) {
            if (p != null && !p.isEmpty()) joiner.add(p);
        }
        return joiner.toString();
    }
}
