package com.yerin.notijob.config;

import com.yerin.notijob.infra.redis.RedisLockBackend;
import com.yerin.notijob.lock.DistributedLockService;
import com.yerin.notijob.lock.LockBackend;
import com.yerin.notijob.lock.LockSettings;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 기본 Redis 연결과 notijob.lock.extra-nodes 에 적힌 노드들로 락 백엔드를 구성해 락 서비스를 기동한다.
 */
@Slf4j
@Component
@Profile("!local-inmem")
@RequiredArgsConstructor
public class LockBackendInitializer {

    private final DistributedLockService lockService;
    private final ObjectProvider<StringRedisTemplate> redisProvider;

    @Value("${notijob.lock.enabled:true}")
    private boolean enabled;

    @Value("${notijob.lock.key-prefix:notijob:lock:}")
    private String keyPrefix;

    // host:port 목록 (쉼표 구분)
    @Value("${notijob.lock.extra-nodes:}")
    private List<String> extraNodes;

    @Value("${notijob.lock.drift-factor:0.01}")
    private double driftFactor;

    @Value("${notijob.lock.retry-count:50}")
    private int retryCount;

    @Value("${notijob.lock.retry-delay-millis:100}")
    private long retryDelayMillis;

    @Value("${notijob.lock.retry-jitter-millis:200}")
    private long retryJitterMillis;

    @PostConstruct
    void start() {
        if (!enabled) {
            log.info("[LockInit] distributed lock disabled by configuration");
            return;
        }
        List<LockBackend> backends = new ArrayList<>();

        StringRedisTemplate primary = redisProvider.getIfAvailable();
        if (primary != null) {
            // 기본 연결은 스프링이 관리하므로 close 시 아무것도 하지 않는다
            backends.add(new RedisLockBackend("primary", primary, keyPrefix, () -> {}));
        }
        for (String node : extraNodes) {
            if (node == null || node.isBlank()) continue;
            backends.add(extraNodeBackend(node.trim()));
        }

        lockService.startup(backends,
                new LockSettings(driftFactor, retryCount, retryDelayMillis, retryJitterMillis));
    }

    private LockBackend extraNodeBackend(String node) {
        int idx = node.lastIndexOf(':');
        if (idx <= 0) {
            throw new IllegalArgumentException("notijob.lock.extra-nodes entry must be host:port, got " + node);
        }
        String host = node.substring(0, idx);
        int port = Integer.parseInt(node.substring(idx + 1));

        LettuceConnectionFactory factory = new LettuceConnectionFactory(new RedisStandaloneConfiguration(host, port));
        factory.afterPropertiesSet();
        factory.start();
        StringRedisTemplate template = new StringRedisTemplate(factory);
        return new RedisLockBackend(node, template, keyPrefix, factory::destroy);
    }
}
