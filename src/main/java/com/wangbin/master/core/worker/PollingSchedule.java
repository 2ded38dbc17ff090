package com.wangbin.master.core.worker;

import com.wangbin.master.core.config.IoPoint;

import java.util.List;

/**
 * 多周期轮询调度：以所有点位周期的最大公约数为基准节拍
 */
public final class PollingSchedule {

    public static final long DEFAULT_BASE_TICK_MS = 1000;

    private final long baseTickMs;

    private PollingSchedule(long baseTickMs) {
        this.baseTickMs = baseTickMs;
    }

    public static PollingSchedule of(List<IoPoint> points) {
        long gcd = 0;
        for (IoPoint point : points) {
            if (point.getCycleTimeMs() > 0) {
                gcd = gcd(gcd, point.getCycleTimeMs());
            }
        }
        return new PollingSchedule(gcd > 0 ? gcd : DEFAULT_BASE_TICK_MS);
    }

    static long gcd(long a, long b) {
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    public long getBaseTickMs() {
        return baseTickMs;
    }

    /**
     * 点位周期对应的节拍倍数，至少为 1
     */
    public long multipleOf(IoPoint point) {
        return Math.max(1, point.getCycleTimeMs() / baseTickMs);
    }

    public boolean isDue(IoPoint point, long tick) {
        return tick % multipleOf(point) == 0;
    }
}
