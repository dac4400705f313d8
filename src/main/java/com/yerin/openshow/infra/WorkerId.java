package com.yerin.openshow.infra;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

public final class WorkerId {
    private WorkerId() {}
    public static String consumerName() {
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + UUID.randomUUID();
        } catch (UnknownHostException e) {
            return "worker-" + UUID.randomUUID();
        }
    }
}
