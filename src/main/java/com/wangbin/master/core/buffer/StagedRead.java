package com.wangbin.master.core.buffer;

import com.wangbin.master.core.address.BufferAccessDescriptor;
import com.wangbin.master.core.config.IoPoint;

/**
 * 读阶段暂存的一次成功读取，等待统一写入缓冲区
 *
 * @param point      点位
 * @param descriptor 缓冲区定位
 * @param bits       线圈/离散输入结果，寄存器读取时为 null
 * @param registers  寄存器结果，位读取时为 null
 */
public record StagedRead(IoPoint point, BufferAccessDescriptor descriptor, boolean[] bits, int[] registers) {

    public static StagedRead ofBits(IoPoint point, BufferAccessDescriptor descriptor, boolean[] bits) {
        return new StagedRead(point, descriptor, bits, null);
    }

    public static StagedRead ofRegisters(IoPoint point, BufferAccessDescriptor descriptor, int[] registers) {
        return new StagedRead(point, descriptor, null, registers);
    }
}
