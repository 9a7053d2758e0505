package com.yerin.notijob.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.notijob.domain.JobQueuePort;
import com.yerin.notijob.domain.queue.QueuedJob;
import com.yerin.notijob.global.exception.BackendTransientException;
import com.yerin.notijob.infra.redis.RedisTransactions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.PendingMessages;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Redis Streams 기반 워크플로 큐.
 * <ul>
 *   <li>즉시 실행 잡: 스트림 {@code {prefix}:{queue}} 에 XADD, 컨슈머 그룹으로 claim</li>
 *   <li>지연 잡: ZSET {@code {prefix}:{queue}:delayed} 에 실행 시각을 score 로 적재</li>
 *   <li>promoteDue 가 due 항목을 ZREM 으로 선점한 노드만 스트림으로 옮긴다</li>
 *   <li>requeueStalled 가 죽은 컨슈머의 PEL 항목을 XCLAIM 해 스트림 끝에 다시 넣는다</li>
 * </ul>
 */
@Slf4j
@Component
@Profile("!local-inmem")
public class RedisStreamsQueueAdapter implements JobQueuePort {

    static final String FIELD_JOB = "job";
    static final String REAPER_CONSUMER = "stalled-reaper";

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final String streamKey;
    private final String delayedKey;
    private final String groupName;
    private final int promoteBatch;

    private volatile boolean grouped = false; // 그룹 준비 1회 보장

    public RedisStreamsQueueAdapter(StringRedisTemplate redis,
                                    ObjectMapper objectMapper,
                                    @Value("${notijob.queue.prefix:notijob:stream}") String streamPrefix,
                                    @Value("${notijob.queue.name:standard}") String queueName,
                                    @Value("${notijob.queue.group:notijob:cg}") String groupName,
                                    @Value("${notijob.queue.promote-batch:100}") int promoteBatch) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.streamKey = streamPrefix + ":" + queueName;
        this.delayedKey = streamKey + ":delayed";
        this.groupName = groupName;
        this.promoteBatch = promoteBatch;
    }

    @Override
    public void add(QueuedJob job) {
        long delay = job.options() == null ? 0 : job.options().delayMillis();
        if (delay > 0) {
            schedule(job, delay);
            return;
        }
        xadd(toJson(job), job.id());
    }

    @Override
    public List<QueuedJob> claim(String consumer, int max, Duration block) throws InterruptedException {
        ensureGroupOnce();

        List<MapRecord<String, Object, Object>> records;
        try {
            records = redis.opsForStream().read(
                    Consumer.from(groupName, consumer),
                    StreamReadOptions.empty().count(max).block(block),
                    StreamOffset.create(streamKey, ReadOffset.lastConsumed())
            );
        } catch (DataAccessException e) {
            if (Thread.currentThread().isInterrupted()) throw new InterruptedException("claim interrupted");
            throw new BackendTransientException("XREADGROUP failed key=" + streamKey, e);
        }
        if (records == null || records.isEmpty()) return List.of();

        List<QueuedJob> claimed = new ArrayList<>(records.size());
        for (MapRecord<String, Object, Object> rec : records) {
            Object raw = rec.getValue().get(FIELD_JOB);
            if (raw == null) {
                removeRecord(rec.getId());
                log.debug("[RedisStream] skip bootstrap/invalid rec id={}", rec.getId());
                continue;
            }
            try {
                QueuedJob job = objectMapper.readValue(String.valueOf(raw), QueuedJob.class);
                claimed.add(job.withReceipt(rec.getId().getValue()));
            } catch (JsonProcessingException e) {
                removeRecord(rec.getId());
                log.error("[RedisStream] drop unreadable rec id={}, err={}", rec.getId(), e.getOriginalMessage());
            }
        }
        return claimed;
    }

    @Override
    public void ack(QueuedJob job, boolean remove) {
        if (job.receipt() == null) return;
        RecordId id = RecordId.of(job.receipt());
        try {
            redis.opsForStream().acknowledge(streamKey, groupName, id);
            if (remove) {
                redis.opsForStream().delete(streamKey, id);
            }
        } catch (DataAccessException e) {
            throw new BackendTransientException("XACK failed id=" + job.receipt(), e);
        }
        log.debug("[RedisStream] ACK key={}, id={}, jobId={}", streamKey, id, job.id());
    }

    @Override
    public void retry(QueuedJob job, long delayMillis) {
        long delay = Math.max(0, delayMillis);
        if (job.receipt() == null) {
            schedule(job, delay);
            return;
        }
        RecordId id = RecordId.of(job.receipt());
        String json = toJson(job);
        long dueAt = Instant.now().toEpochMilli() + delay;
        // ZADD 와 XACK/XDEL 을 한 트랜잭션으로 보내 재적재 없이 지워지는 일이 없게 한다
        try {
            RedisTransactions.multiExec(redis, ops -> {
                ops.opsForZSet().add(delayedKey, json, dueAt);
                ops.opsForStream().acknowledge(streamKey, groupName, id);
                ops.opsForStream().delete(streamKey, id);
            });
        } catch (DataAccessException e) {
            throw new BackendTransientException("retry failed jobId=" + job.id() + ", id=" + id, e);
        }
        log.info("[RedisStream] retry key={}, id={}, jobId={}, delay={}ms", delayedKey, id, job.id(), delay);
    }

    @Override
    public int requeueStalled(Duration minIdle, int max) {
        ensureGroupOnce();

        RecordId[] idle;
        try {
            PendingMessages pending = redis.opsForStream().pending(streamKey, groupName, Range.unbounded(), max);
            idle = pending.stream()
                    .filter(p -> p.getElapsedTimeSinceLastDelivery().compareTo(minIdle) >= 0)
                    .map(PendingMessage::getId)
                    .toArray(RecordId[]::new);
        } catch (DataAccessException e) {
            throw new BackendTransientException("XPENDING failed key=" + streamKey, e);
        }
        if (idle.length == 0) return 0;

        // XCLAIM 이 idle 시간을 다시 확인하므로 여러 노드가 돌아도 한 노드만 가져간다
        List<MapRecord<String, Object, Object>> reclaimed;
        try {
            reclaimed = redis.opsForStream().claim(streamKey, groupName, REAPER_CONSUMER, minIdle, idle);
        } catch (DataAccessException e) {
            throw new BackendTransientException("XCLAIM failed key=" + streamKey, e);
        }

        int requeued = 0;
        for (MapRecord<String, Object, Object> rec : reclaimed) {
            try {
                Object raw = rec.getValue().get(FIELD_JOB);
                if (raw != null) {
                    xadd(String.valueOf(raw), null);
                    requeued++;
                }
                removeRecord(rec.getId());
                log.warn("[RedisStream] requeued stalled rec id={}", rec.getId());
            } catch (RuntimeException e) {
                // 실패한 항목은 reaper 소유로 PEL 에 남아 다음 주기에 다시 잡힌다
                log.warn("[RedisStream] requeue stalled failed id={}, err={}", rec.getId(), e.toString());
            }
        }
        return requeued;
    }

    @Override
    public long size() {
        try {
            Long stream = redis.opsForStream().size(streamKey);
            Long delayed = redis.opsForZSet().zCard(delayedKey);
            return (stream == null ? 0 : stream) + (delayed == null ? 0 : delayed);
        } catch (DataAccessException e) {
            throw new BackendTransientException("queue size failed key=" + streamKey, e);
        }
    }

    @Override
    public synchronized void drain() {
        try {
            redis.delete(List.of(streamKey, delayedKey));
        } catch (DataAccessException e) {
            throw new BackendTransientException("queue drain failed key=" + streamKey, e);
        }
        grouped = false;
        log.info("[RedisStream] drained key={}", streamKey);
    }

    /**
     * 실행 시각이 지난 지연 잡을 스트림으로 옮긴다. ZREM 이 1 을 돌려준 노드만 XADD 하므로 여러 노드가 돌아도 한 번만 옮겨진다.
     */
    @Scheduled(fixedDelayString = "${notijob.queue.promote-interval-millis:500}")
    public int promoteDue() {
        Set<String> due;
        try {
            due = redis.opsForZSet().rangeByScore(delayedKey, 0, Instant.now().toEpochMilli(), 0, promoteBatch);
        } catch (DataAccessException e) {
            log.warn("[RedisStream] promote scan failed key={}, err={}", delayedKey, e.toString());
            return 0;
        }
        if (due == null || due.isEmpty()) return 0;

        int promoted = 0;
        for (String member : due) {
            try {
                Long removed = redis.opsForZSet().remove(delayedKey, member);
                if (removed == null || removed == 0) continue; // 다른 노드가 선점
                xadd(member, null);
                promoted++;
            } catch (RuntimeException e) {
                log.warn("[RedisStream] promote failed key={}, err={}", delayedKey, e.toString());
            }
        }
        if (promoted > 0) log.debug("[RedisStream] promoted {} delayed jobs", promoted);
        return promoted;
    }

    private void schedule(QueuedJob job, long delayMillis) {
        long dueAt = Instant.now().toEpochMilli() + delayMillis;
        try {
            redis.opsForZSet().add(delayedKey, toJson(job), dueAt);
        } catch (DataAccessException e) {
            throw new BackendTransientException("ZADD failed key=" + delayedKey, e);
        }
        log.info("[RedisStream] ZADD key={}, jobId={}, delay={}ms", delayedKey, job.id(), delayMillis);
    }

    private void xadd(String json, String jobId) {
        ensureGroupOnce();

        Map<String, String> fields = new HashMap<>();
        fields.put(FIELD_JOB, json);
        fields.put("enqueuedAt", Instant.now().toString());
        try {
            RecordId rid = redis.opsForStream().add(StreamRecords.mapBacked(fields).withStreamKey(streamKey));
            log.info("[RedisStream] XADD key={}, id={}, jobId={}", streamKey, rid, jobId);
        } catch (DataAccessException e) {
            throw new BackendTransientException("XADD failed key=" + streamKey, e);
        }
    }

    private void removeRecord(RecordId id) {
        redis.opsForStream().acknowledge(streamKey, groupName, id);
        redis.opsForStream().delete(streamKey, id);
    }

    private String toJson(QueuedJob job) {
        try {
            return objectMapper.writeValueAsString(job.withReceipt(null));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("queued job not serializable id=" + job.id(), e);
        }
    }

    private void ensureGroupOnce() {
        if (grouped) return;
        synchronized (this) {
            if (grouped) return;

            try {
                // 빈 스트림에는 그룹을 만들 수 없어 부트스트랩 레코드를 넣었다 지운다
                RecordId rid = redis.opsForStream().add(
                        StreamRecords.mapBacked(Map.of("bootstrap", "1")).withStreamKey(streamKey)
                );
                redis.opsForStream().createGroup(streamKey, ReadOffset.from("0-0"), groupName);
                redis.opsForStream().delete(streamKey, rid);

                log.info("[RedisStream] group prepared key={}, group={}, rec={}", streamKey, groupName, rid);
            } catch (RuntimeException e) {
                String msg = e.getMessage() == null ? "" : e.getMessage();
                Throwable cause = e.getCause();
                String causeMsg = cause == null || cause.getMessage() == null ? "" : cause.getMessage();
                if (!(msg.contains("BUSYGROUP") || causeMsg.contains("BUSYGROUP") || msg.contains("already exists"))) {
                    log.warn("[RedisStream] createGroup ignored key={}, group={}, cause={}", streamKey, groupName, msg);
                }
            }
            grouped = true;
        }
    }
}
