package com.yerin.notijob.infra;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

public final class WorkerId {
    private WorkerId() {}

    /** 컨슈머 그룹 안에서 프로세스를 구분하는 이름. 재기동마다 새로 만든다. */
    public static String consumerName() {
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + UUID.randomUUID().toString().substring(0, 8);
        } catch (UnknownHostException e) {
            return "worker-" + UUID.randomUUID();
        }
    }
}
