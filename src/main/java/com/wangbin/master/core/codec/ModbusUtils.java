package com.wangbin.master.core.codec;

/**
 * Modbus报文数据辅助方法
 */
public final class ModbusUtils {

    private ModbusUtils() {
    }

    /**
     * 解析Modbus偏移字符串，支持十进制和 0x 十六进制
     */
    public static int parseOffset(String offset) {
        if (offset == null || offset.isBlank()) {
            throw new IllegalArgumentException("Modbus偏移不能为空: " + offset);
        }

        String text = offset.trim();
        long address;
        try {
            if (text.toLowerCase().startsWith("0x")) {
                address = Long.parseLong(text.substring(2), 16);
            } else {
                address = Long.parseLong(text, 10);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Modbus偏移格式错误(支持十进制或0x十六进制): " + offset, e);
        }

        if (address < 0) {
            throw new IllegalArgumentException("Modbus偏移不能小于0: " + offset);
        }
        if (address > 65535) {
            throw new IllegalArgumentException("Modbus偏移不能超过65535: " + offset);
        }
        return (int) address;
    }

    /**
     * 解析线圈/离散输入字节，低位在前
     */
    public static boolean[] getCoilValues(byte[] coilBytes, int quantity) {
        boolean[] values = new boolean[Math.max(0, quantity)];
        if (coilBytes == null) {
            return values;
        }
        for (int i = 0; i < values.length; i++) {
            int byteIndex = i / 8;
            if (byteIndex >= coilBytes.length) {
                break;
            }
            values[i] = ((coilBytes[byteIndex] >> (i % 8)) & 0x01) == 1;
        }
        return values;
    }

    /**
     * 构建写多个线圈的数据字节
     */
    public static byte[] buildCoilBytes(boolean[] values) {
        if (values == null || values.length == 0) {
            return new byte[0];
        }

        byte[] coilBytes = new byte[(values.length + 7) / 8];
        for (int i = 0; i < values.length; i++) {
            if (values[i]) {
                coilBytes[i / 8] |= (byte) (1 << (i % 8));
            }
        }
        return coilBytes;
    }

    /**
     * 大端寄存器字节转换为无符号16位寄存器值
     */
    public static int[] getRegisterValues(byte[] raw, int quantity) {
        int[] registers = new int[Math.max(0, quantity)];
        if (raw == null) {
            return registers;
        }
        for (int i = 0; i < registers.length && (i * 2 + 1) < raw.length; i++) {
            registers[i] = ((raw[i * 2] & 0xFF) << 8) | (raw[i * 2 + 1] & 0xFF);
        }
        return registers;
    }

    /**
     * 寄存器值转换为大端字节，用于写多个寄存器
     */
    public static byte[] buildRegisterBytes(int[] registers) {
        if (registers == null) {
            return new byte[0];
        }
        byte[] raw = new byte[registers.length * 2];
        for (int i = 0; i < registers.length; i++) {
            raw[i * 2] = (byte) ((registers[i] >> 8) & 0xFF);
            raw[i * 2 + 1] = (byte) (registers[i] & 0xFF);
        }
        return raw;
    }
}
