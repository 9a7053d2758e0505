package com.yerin.notijob.domain;

import com.yerin.notijob.domain.queue.QueuedJob;

import java.time.Duration;
import java.util.List;

public interface JobQueuePort {

    /** options.delayMillis 가 0보다 크면 지연 적재. */
    void add(QueuedJob job);

    List<QueuedJob> claim(String consumer, int max, Duration block) throws InterruptedException;

    void ack(QueuedJob job, boolean remove);

    /**
     * 현재 claim 을 정리하고 delayMillis 뒤에 다시 꺼낼 수 있게 재적재한다.
     * 예외가 나면 아무것도 바뀌지 않은 상태여야 한다.
     */
    void retry(QueuedJob job, long delayMillis);

    /**
     * minIdle 넘게 ack 되지 않은 claim 을 다른 컨슈머가 꺼낼 수 있게 되돌린다.
     *
     * @return 되돌린 잡 수
     */
    int requeueStalled(Duration minIdle, int max);

    long size();

    /** 대기/지연 중인 잡을 모두 비운다. */
    void drain();
}
