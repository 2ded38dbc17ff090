package com.wangbin.master.common.utils;

/**
 * 按切片休眠，每个切片结束检查一次停止信号
 */
public class CancellableSleeper {

    private final long incrementMs;

    public CancellableSleeper(long incrementMs) {
        this.incrementMs = Math.max(1, incrementMs);
    }

    /**
     * @return 完整睡满返回 true，被取消或中断返回 false
     */
    public boolean sleep(long millis, CancelSignal cancel) {
        long deadline = System.nanoTime() + millis * 1_000_000L;
        while (!cancel.isCancelled()) {
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMs <= 0) {
                return true;
            }
            try {
                Thread.sleep(Math.min(incrementMs, remainingMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return false;
    }

    public long getIncrementMs() {
        return incrementMs;
    }
}
