package com.wangbin.master.core.codec;

import com.wangbin.master.common.exception.CodecException;
import com.wangbin.master.core.address.IecSize;

/**
 * IEC数值与16位Modbus寄存器之间的转换
 * <p>
 * 小端模式下下标最大的寄存器存放最高16位，大端模式下第一个寄存器存放最高16位。
 * 所有数值按无符号处理，64位值使用 long 的全部位。
 */
public final class RegisterCodec {

    private RegisterCodec() {
    }

    /**
     * 获取数据宽度对应的寄存器数量，位类型不走寄存器返回0
     */
    public static int registersNeeded(IecSize size) {
        return switch (size) {
            case BIT -> 0;
            case BYTE, WORD -> 1;
            case DOUBLE_WORD -> 2;
            case LONG_WORD -> 4;
        };
    }

    /**
     * 寄存器转换为IEC数值
     */
    public static long decode(int[] registers, IecSize size, boolean bigEndian) {
        return decode(registers, 0, size, bigEndian);
    }

    /**
     * 从指定寄存器下标开始转换一个IEC元素
     */
    public static long decode(int[] registers, int offset, IecSize size, boolean bigEndian) {
        int needed = registersNeeded(size);
        if (needed == 0) {
            throw CodecException.invalidSize(size.name());
        }
        int available = registers == null ? 0 : Math.max(0, registers.length - offset);
        if (available < needed) {
            throw CodecException.insufficientRegisters(size.name(), needed, available);
        }

        if (size == IecSize.BYTE) {
            return registers[offset] & 0xFFL;
        }

        long value = 0L;
        for (int i = 0; i < needed; i++) {
            // 从最高16位开始拼接
            int index = bigEndian ? offset + i : offset + needed - 1 - i;
            value = (value << 16) | (registers[index] & 0xFFFFL);
        }
        return value;
    }

    /**
     * IEC数值转换为寄存器
     */
    public static int[] encode(long value, IecSize size, boolean bigEndian) {
        int needed = registersNeeded(size);
        if (needed == 0) {
            throw CodecException.invalidSize(size.name());
        }

        if (size == IecSize.BYTE) {
            return new int[]{(int) (value & 0xFFL)};
        }

        int[] registers = new int[needed];
        for (int i = 0; i < needed; i++) {
            // i=0 为最低16位
            int word = (int) ((value >>> (16 * i)) & 0xFFFFL);
            int index = bigEndian ? needed - 1 - i : i;
            registers[index] = word;
        }
        return registers;
    }
}
