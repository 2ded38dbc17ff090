package com.wangbin.master.core.buffer;

/**
 * PLC共享内存访问接口
 * <p>
 * 内存与互斥锁归宿主运行时所有。批量操作先 {@link #acquire()}，
 * 随后以 lockHeld=true 调用读写方法，最后 {@link #release()}。
 * lockHeld=false 时由实现自行加锁。
 */
public interface SharedBufferAccess {

    /**
     * 获取互斥锁，失败时返回 false，调用方必须放弃本批操作
     */
    boolean acquire();

    void release();

    BufferResult<Boolean> readBit(BufferKind kind, int index, int bit, boolean lockHeld);

    BufferResult<Void> writeBit(BufferKind kind, int index, int bit, boolean value, boolean lockHeld);

    BufferResult<Long> readByte(BufferKind kind, int index, boolean lockHeld);

    BufferResult<Void> writeByte(BufferKind kind, int index, long value, boolean lockHeld);

    BufferResult<Long> readWord(BufferKind kind, int index, boolean lockHeld);

    BufferResult<Void> writeWord(BufferKind kind, int index, long value, boolean lockHeld);

    BufferResult<Long> readDWord(BufferKind kind, int index, boolean lockHeld);

    BufferResult<Void> writeDWord(BufferKind kind, int index, long value, boolean lockHeld);

    BufferResult<Long> readLWord(BufferKind kind, int index, boolean lockHeld);

    BufferResult<Void> writeLWord(BufferKind kind, int index, long value, boolean lockHeld);
}
