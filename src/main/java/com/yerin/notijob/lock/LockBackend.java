package com.yerin.notijob.lock;

/**
 * 쿼럼을 구성하는 락 노드 하나.
 * 구현체는 통신 실패 시 {@link com.yerin.notijob.global.exception.BackendTransientException} 을 던진다.
 */
public interface LockBackend {

    String name();

    /** 키가 비어 있으면 token 으로 ttl 동안 점유한다. */
    boolean tryAcquire(String resource, String token, long ttlMillis);

    /** 현재 값이 token 일 때만 삭제한다. */
    boolean release(String resource, String token);

    void close();
}
