package com.yerin.notijob.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("캐시 키 규칙 테스트")
class CacheKeysTest {

    @Test
    @DisplayName("쿼리 키는 파라미터를 정렬해 판별자를 만든다")
    void query_key_sorted() {
        String scope = CacheKeys.queryScope("notijob", CacheKeys.FEED, "env1", "sub1");

        assertThat(CacheKeys.query(scope, Map.of("page", 2, "limit", 10)))
                .isEqualTo("notijob:feed:env1:sub1:query=limit=10,page=2");
    }

    @Test
    @DisplayName("splitKey 는 :query= 기준으로 scope 와 판별자를 나눈다")
    void split_key() {
        CacheKeys.SplitKey split = CacheKeys.splitKey("notijob:feed:env1:sub1:query=limit=10");

        assertThat(split.credentials()).isEqualTo("notijob:feed:env1:sub1");
        assertThat(split.query()).isEqualTo("limit=10");
        assertThat(CacheKeys.splitKey("notijob:subscriber:env1:1").query()).isNull();
    }
}
