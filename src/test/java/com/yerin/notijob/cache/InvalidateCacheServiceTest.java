package com.yerin.notijob.cache;

import com.yerin.notijob.global.exception.BackendTransientException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("InvalidateCacheService 단위 테스트")
class InvalidateCacheServiceTest {

    CacheService cache = mock(CacheService.class);
    InvalidateCacheService sut = new InvalidateCacheService(cache);

    @Test
    @DisplayName("캐시가 꺼져 있으면 즉시 반환")
    void short_circuit_when_disabled() {
        when(cache.cacheEnabled()).thenReturn(false);

        sut.invalidateByKey("k");
        sut.invalidateQuery("scope");
        sut.clearByPattern("p*");

        verify(cache, times(3)).cacheEnabled();
        verifyNoMoreInteractions(cache);
    }

    @Test
    @DisplayName("백엔드 오류는 로그만 남기고 삼킨다")
    void backend_errors_swallowed() {
        when(cache.cacheEnabled()).thenReturn(true);
        BackendTransientException down = new BackendTransientException("down", new RuntimeException("io"));
        when(cache.del("k")).thenThrow(down);
        doThrow(down).when(cache).delQuery("scope");
        when(cache.delByPattern("p*")).thenThrow(down);

        assertThatCode(() -> {
            sut.invalidateByKey("k");
            sut.invalidateQuery("scope");
            sut.clearByPattern("p*");
        }).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("빈 패턴은 아무것도 지우지 않는다")
    void blank_pattern_ignored() {
        when(cache.cacheEnabled()).thenReturn(true);

        sut.clearByPattern(" ");

        verify(cache, never()).delByPattern(anyString());
    }

    @Test
    @DisplayName("정상 경로는 CacheService 로 위임")
    void delegates() {
        when(cache.cacheEnabled()).thenReturn(true);

        sut.invalidateByKey("k");
        sut.invalidateQuery("scope");
        sut.clearByPattern("p*");

        verify(cache).del("k");
        verify(cache).delQuery("scope");
        verify(cache).delByPattern("p*");
    }
}
