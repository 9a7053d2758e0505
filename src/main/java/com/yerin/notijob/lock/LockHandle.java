package com.yerin.notijob.lock;

/**
 * 획득한 락. 락 서비스가 비활성화된 경우에는 release 가 아무 일도 하지 않는 핸들이 돌아온다.
 */
public interface LockHandle {

    String resource();

    long ttlMillis();

    void release();

    static LockHandle noop(String resource, long ttlMillis) {
        return new LockHandle() {
            @Override
            public String resource() {
                return resource;
            }

            @Override
            public long ttlMillis() {
                return ttlMillis;
            }

            @Override
            public void release() {
            }
        };
    }
}
