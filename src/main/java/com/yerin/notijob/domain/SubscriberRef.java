package com.yerin.notijob.domain;

/**
 * @param id           내부 구독자 참조 id
 * @param subscriberId 고객사가 부여한 외부 구독자 id
 */
public record SubscriberRef(String id, String subscriberId) {}
