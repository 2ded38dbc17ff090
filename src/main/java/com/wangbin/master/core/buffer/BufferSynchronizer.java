package com.wangbin.master.core.buffer;

import com.wangbin.master.common.exception.MasterException;
import com.wangbin.master.common.exception.MutexAcquisitionException;
import com.wangbin.master.core.address.AccessDirection;
import com.wangbin.master.core.address.AddressResolver;
import com.wangbin.master.core.address.BufferAccessDescriptor;
import com.wangbin.master.core.codec.RegisterCodec;
import com.wangbin.master.core.config.IoPoint;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 设备与PLC共享缓冲区之间的批量同步
 * <p>
 * 每个阶段只获取一次锁；锁内不做任何网络操作。
 */
@Slf4j
public class BufferSynchronizer {

    private final SharedBufferAccess buffer;
    private final String deviceName;
    private final boolean bigEndian;

    public BufferSynchronizer(SharedBufferAccess buffer, String deviceName, boolean bigEndian) {
        this.buffer = buffer;
        this.deviceName = deviceName;
        this.bigEndian = bigEndian;
    }

    /**
     * 把本轮暂存的读结果写入缓冲区
     *
     * @return 成功写入的点位数
     * @throws MutexAcquisitionException 获取锁失败，整批放弃
     */
    public int applyReads(List<StagedRead> reads) {
        if (reads.isEmpty()) {
            return 0;
        }
        if (!buffer.acquire()) {
            throw new MutexAcquisitionException("设备 " + deviceName + " 更新缓冲区时获取锁失败, 放弃 " + reads.size() + " 个点位");
        }

        int applied = 0;
        try {
            for (StagedRead read : reads) {
                if (applyRead(read)) {
                    applied++;
                }
            }
        } finally {
            buffer.release();
        }
        return applied;
    }

    /**
     * 读取本轮所有到期写点位的源数据，失败的点位被跳过
     *
     * @throws MutexAcquisitionException 获取锁失败，整批放弃
     */
    public List<WriteSource> readWriteSources(List<IoPoint> points) {
        if (points.isEmpty()) {
            return Collections.emptyList();
        }
        if (!buffer.acquire()) {
            throw new MutexAcquisitionException("设备 " + deviceName + " 读取写源数据时获取锁失败, 放弃 " + points.size() + " 个点位");
        }

        List<WriteSource> sources = new ArrayList<>(points.size());
        try {
            for (IoPoint point : points) {
                WriteSource source = readSource(point);
                if (source != null) {
                    sources.add(source);
                }
            }
        } finally {
            buffer.release();
        }
        return sources;
    }

    private boolean applyRead(StagedRead read) {
        IoPoint point = read.point();
        BufferAccessDescriptor descriptor = read.descriptor();
        try {
            if (descriptor.isBoolean()) {
                boolean[] bits = read.bits();
                int count = Math.min(point.getLength(), bits.length);
                for (int i = 0; i < count; i++) {
                    int bitPosition = descriptor.bitIndex() + i;
                    BufferResult<Void> result = buffer.writeBit(descriptor.bufferKind(),
                            descriptor.bufferIndex() + bitPosition / 8, bitPosition % 8, bits[i], true);
                    if (!check(result, point, i)) {
                        return false;
                    }
                }
                return true;
            }

            int needed = RegisterCodec.registersNeeded(point.getLocation().size());
            for (int i = 0; i < point.getLength(); i++) {
                long value = RegisterCodec.decode(read.registers(), i * needed, point.getLocation().size(), bigEndian);
                BufferResult<Void> result = writeValue(descriptor, descriptor.bufferIndex() + i, value);
                if (!check(result, point, i)) {
                    return false;
                }
            }
            return true;
        } catch (MasterException e) {
            log.warn("设备 {} 点位 [{}] 写入缓冲区失败: {}", deviceName, point, e.getMessage());
            return false;
        }
    }

    private WriteSource readSource(IoPoint point) {
        try {
            BufferAccessDescriptor descriptor = AddressResolver.resolve(point.getLocation(), AccessDirection.WRITE);
            int count = point.getFunctionCode().isSingleWrite() ? 1 : point.getLength();

            if (descriptor.isBoolean()) {
                boolean[] bits = new boolean[count];
                for (int i = 0; i < count; i++) {
                    int bitPosition = descriptor.bitIndex() + i;
                    BufferResult<Boolean> result = buffer.readBit(descriptor.bufferKind(),
                            descriptor.bufferIndex() + bitPosition / 8, bitPosition % 8, true);
                    if (!check(result, point, i)) {
                        return null;
                    }
                    bits[i] = result.value();
                }
                return new WriteSource(point, descriptor, bits, null);
            }

            long[] values = new long[count];
            for (int i = 0; i < count; i++) {
                BufferResult<Long> result = readValue(descriptor, descriptor.bufferIndex() + i);
                if (!check(result, point, i)) {
                    return null;
                }
                values[i] = result.value();
            }
            return new WriteSource(point, descriptor, null, values);
        } catch (MasterException e) {
            log.warn("设备 {} 点位 [{}] 读取写源数据失败: {}", deviceName, point, e.getMessage());
            return null;
        }
    }

    private BufferResult<Void> writeValue(BufferAccessDescriptor descriptor, int index, long value) {
        BufferKind kind = descriptor.bufferKind();
        return switch (kind.getElementType()) {
            case BYTE -> buffer.writeByte(kind, index, value, true);
            case INT -> buffer.writeWord(kind, index, value, true);
            case DINT -> buffer.writeDWord(kind, index, value, true);
            case LINT -> buffer.writeLWord(kind, index, value, true);
            case BOOL -> BufferResult.failure(BufferStatus.INVALID_BUFFER_KIND, kind + " 不能按数值写入");
        };
    }

    private BufferResult<Long> readValue(BufferAccessDescriptor descriptor, int index) {
        BufferKind kind = descriptor.bufferKind();
        return switch (kind.getElementType()) {
            case BYTE -> buffer.readByte(kind, index, true);
            case INT -> buffer.readWord(kind, index, true);
            case DINT -> buffer.readDWord(kind, index, true);
            case LINT -> buffer.readLWord(kind, index, true);
            case BOOL -> BufferResult.failure(BufferStatus.INVALID_BUFFER_KIND, kind + " 不能按数值读取");
        };
    }

    private boolean check(BufferResult<?> result, IoPoint point, int element) {
        if (result.isSuccess()) {
            return true;
        }
        log.warn("设备 {} 点位 [{}] 第 {} 个元素访问缓冲区失败: {} {}",
                deviceName, point, element, result.status(), result.message());
        return false;
    }
}
