package com.wangbin.master.core.buffer;

import com.wangbin.master.core.address.BufferAccessDescriptor;
import com.wangbin.master.core.codec.RegisterCodec;
import com.wangbin.master.core.config.IoPoint;

/**
 * 写阶段从缓冲区取出的源数据
 *
 * @param point      点位
 * @param descriptor 缓冲区定位
 * @param bits       位数据，寄存器写时为 null
 * @param values     数值数据，位写时为 null
 */
public record WriteSource(IoPoint point, BufferAccessDescriptor descriptor, boolean[] bits, long[] values) {

    /**
     * 数值按点位宽度编码为寄存器序列，按元素顺序拼接
     */
    public int[] toRegisters(boolean bigEndian) {
        int needed = RegisterCodec.registersNeeded(point.getLocation().size());
        int[] registers = new int[values.length * needed];
        for (int i = 0; i < values.length; i++) {
            int[] encoded = RegisterCodec.encode(values[i], point.getLocation().size(), bigEndian);
            System.arraycopy(encoded, 0, registers, i * needed, needed);
        }
        return registers;
    }
}
