package com.yerin.notijob.infra.redis;

import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.List;
import java.util.function.Consumer;

public final class RedisTransactions {
    private RedisTransactions() {}

    /**
     * commands 가 보낸 명령을 MULTI/EXEC 한 묶음으로 실행한다.
     * execute 가 연결을 스레드에 묶어 두므로 같은 템플릿으로 보낸 명령은 모두 트랜잭션 안에 들어간다.
     */
    public static List<Object> multiExec(StringRedisTemplate redis, Consumer<StringRedisTemplate> commands) {
        return redis.execute(new SessionCallback<List<Object>>() {
            @Override
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) {
                redis.multi();
                commands.accept(redis);
                return redis.exec();
            }
        });
    }
}
