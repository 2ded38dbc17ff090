package com.wangbin.master.core.buffer;

import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 进程内PLC内存映像
 * <p>
 * 独立运行时替代宿主运行时的共享内存。位缓冲区每个下标对应一个字节的8个位。
 */
@Slf4j
public class InMemoryPlcBuffer implements SharedBufferAccess {

    private final int size;
    private final long lockTimeoutMs;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<BufferKind, long[]> buffers = new EnumMap<>(BufferKind.class);

    public InMemoryPlcBuffer(int size, long lockTimeoutMs) {
        if (size <= 0) {
            throw new IllegalArgumentException("缓冲区大小必须大于0: " + size);
        }
        this.size = size;
        this.lockTimeoutMs = lockTimeoutMs;
        for (BufferKind kind : BufferKind.values()) {
            buffers.put(kind, new long[size]);
        }
        log.info("PLC内存映像初始化完成，每个缓冲区 {} 个元素", size);
    }

    @Override
    public boolean acquire() {
        try {
            return lock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void release() {
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
        } else {
            log.warn("释放未持有的缓冲区锁，已忽略");
        }
    }

    @Override
    public BufferResult<Boolean> readBit(BufferKind kind, int index, int bit, boolean lockHeld) {
        if (!kind.isBoolean()) {
            return BufferResult.failure(BufferStatus.INVALID_BUFFER_KIND, kind + " 不是位缓冲区");
        }
        if (bit < 0 || bit > 7) {
            return BufferResult.failure(BufferStatus.INDEX_OUT_OF_RANGE, "位下标越界: " + bit);
        }
        return guarded(lockHeld, () -> {
            if (!inRange(index)) {
                return outOfRange(kind, index);
            }
            long current = buffers.get(kind)[index];
            return BufferResult.success(((current >> bit) & 0x01L) == 1L);
        });
    }

    @Override
    public BufferResult<Void> writeBit(BufferKind kind, int index, int bit, boolean value, boolean lockHeld) {
        if (!kind.isBoolean()) {
            return BufferResult.failure(BufferStatus.INVALID_BUFFER_KIND, kind + " 不是位缓冲区");
        }
        if (bit < 0 || bit > 7) {
            return BufferResult.failure(BufferStatus.INDEX_OUT_OF_RANGE, "位下标越界: " + bit);
        }
        return guarded(lockHeld, () -> {
            if (!inRange(index)) {
                return outOfRange(kind, index);
            }
            long[] data = buffers.get(kind);
            if (value) {
                data[index] |= (1L << bit);
            } else {
                data[index] &= ~(1L << bit);
            }
            return BufferResult.success();
        });
    }

    @Override
    public BufferResult<Long> readByte(BufferKind kind, int index, boolean lockHeld) {
        return readValue(kind, ElementType.BYTE, index, lockHeld);
    }

    @Override
    public BufferResult<Void> writeByte(BufferKind kind, int index, long value, boolean lockHeld) {
        return writeValue(kind, ElementType.BYTE, index, value, lockHeld);
    }

    @Override
    public BufferResult<Long> readWord(BufferKind kind, int index, boolean lockHeld) {
        return readValue(kind, ElementType.INT, index, lockHeld);
    }

    @Override
    public BufferResult<Void> writeWord(BufferKind kind, int index, long value, boolean lockHeld) {
        return writeValue(kind, ElementType.INT, index, value, lockHeld);
    }

    @Override
    public BufferResult<Long> readDWord(BufferKind kind, int index, boolean lockHeld) {
        return readValue(kind, ElementType.DINT, index, lockHeld);
    }

    @Override
    public BufferResult<Void> writeDWord(BufferKind kind, int index, long value, boolean lockHeld) {
        return writeValue(kind, ElementType.DINT, index, value, lockHeld);
    }

    @Override
    public BufferResult<Long> readLWord(BufferKind kind, int index, boolean lockHeld) {
        return readValue(kind, ElementType.LINT, index, lockHeld);
    }

    @Override
    public BufferResult<Void> writeLWord(BufferKind kind, int index, long value, boolean lockHeld) {
        return writeValue(kind, ElementType.LINT, index, value, lockHeld);
    }

    private BufferResult<Long> readValue(BufferKind kind, ElementType expected, int index, boolean lockHeld) {
        if (kind.getElementType() != expected) {
            return BufferResult.failure(BufferStatus.INVALID_BUFFER_KIND,
                    kind + " 与 " + expected + " 读取不匹配");
        }
        return guarded(lockHeld, () -> {
            if (!inRange(index)) {
                return outOfRange(kind, index);
            }
            return BufferResult.success(buffers.get(kind)[index] & expected.getMask());
        });
    }

    private BufferResult<Void> writeValue(BufferKind kind, ElementType expected, int index, long value, boolean lockHeld) {
        if (kind.getElementType() != expected) {
            return BufferResult.failure(BufferStatus.INVALID_BUFFER_KIND,
                    kind + " 与 " + expected + " 写入不匹配");
        }
        return guarded(lockHeld, () -> {
            if (!inRange(index)) {
                return outOfRange(kind, index);
            }
            buffers.get(kind)[index] = value & expected.getMask();
            return BufferResult.success();
        });
    }

    private <T> BufferResult<T> guarded(boolean lockHeld, Supplier<BufferResult<T>> operation) {
        if (lockHeld) {
            if (!lock.isHeldByCurrentThread()) {
                return BufferResult.failure(BufferStatus.LOCK_NOT_HELD, BufferStatus.LOCK_NOT_HELD.getDescription());
            }
            return operation.get();
        }

        if (!acquire()) {
            return BufferResult.failure(BufferStatus.LOCK_FAILED, BufferStatus.LOCK_FAILED.getDescription());
        }
        try {
            return operation.get();
        } finally {
            lock.unlock();
        }
    }

    private boolean inRange(int index) {
        return index >= 0 && index < size;
    }

    private <T> BufferResult<T> outOfRange(BufferKind kind, int index) {
        return BufferResult.failure(BufferStatus.INDEX_OUT_OF_RANGE,
                kind + " 下标越界: " + index + " (容量 " + size + ")");
    }
}
