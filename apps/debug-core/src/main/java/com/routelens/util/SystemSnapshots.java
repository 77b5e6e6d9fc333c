package com.routelens.util;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.util.LinkedHashMap;
import java.util.Map;

/** 进程资源占用快照，随性能记录一起落盘 */
public final class SystemSnapshots {
    private SystemSnapshots() {}

    public static Map<String, Object> capture() {
        Map<String, Object> m = new LinkedHashMap<>();
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        m.put("heapUsed", heap.getUsed());
        m.put("heapCommitted", heap.getCommitted());
        m.put("heapMax", heap.getMax());
        m.put("nonHeapUsed", ManagementFactory.getMemoryMXBean().getNonHeapMemoryUsage().getUsed());
        m.put("availableProcessors", Runtime.getRuntime().availableProcessors());
        m.put("threadCount", ManagementFactory.getThreadMXBean().getThreadCount());
        m.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime());
        m.put("pid", ProcessHandle.current().pid());
        double load = ManagementFactory.getOperatingSystemMXBean().getSystemLoadAverage();
        if (load >= 0) m.put("systemLoadAverage", load);
        return m;
    }
}
