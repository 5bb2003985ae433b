package com.omniva.dbwatch.engine.crankshaft;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ThreadFactory for detection threads (polling loops, notification listeners):
 * - Meaningful thread names
 * - Daemon threads, a forgotten session must not keep the JVM alive
 * - Below normal priority, detection is background work
 */
public class DbWatchThreadFactory implements ThreadFactory {

    private final AtomicInteger threadCounter = new AtomicInteger(0);
    private final String namePrefix;

    /**
     * @param namePrefix Prefix for thread names (e.g., "DbWatch-poll")
     */
    public DbWatchThreadFactory(String namePrefix) {
        this.namePrefix = namePrefix;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r, namePrefix + "-" + threadCounter.getAndIncrement());
        t.setDaemon(true);
        t.setPriority(Thread.NORM_PRIORITY - 1);
        return t;
    }

    public String getNamePrefix() {
        return namePrefix;
    }
}
