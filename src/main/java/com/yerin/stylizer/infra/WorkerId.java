package com.yerin.stylizer.infra;

import java.net.InetAddress;
import java.util.UUID;

public final class WorkerId {
    private static final String HOST = hostName();

    private WorkerId() {}

    public static String slotName(int index) {
        return HOST + "-slot-" + index;
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            return "worker-" + UUID.randomUUID().toString().substring(0, 8);
        }
    }
}
