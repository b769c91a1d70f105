package com.signalengine.lease;

import java.lang.management.ManagementFactory;
import java.util.UUID;

/**
 * Owner ids of lease holders: {@code {process id}:{thread id}}. The process part carries a
 * random suffix per store instance so two processes on one host never collide.
 */
final class LeaseOwner {

    private final String processId =
            ManagementFactory.getRuntimeMXBean().getName() + "-" + UUID.randomUUID().toString().substring(0, 8);

    String current() {
        return processId + ":" + Thread.currentThread().getId();
    }
}
