package com.wangbin.master.core.codec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModbusUtilsTest {

    @Test
    void parsesDecimalAndHexOffsets() {
        assertEquals(100, ModbusUtils.parseOffset("100"));
        assertEquals(0x10, ModbusUtils.parseOffset("0x10"));
        assertEquals(0xFFFF, ModbusUtils.parseOffset(" 0XFFFF "));
        assertEquals(0, ModbusUtils.parseOffset("0"));
    }

    @Test
    void rejectsInvalidOffsets() {
        for (String text : new String[]{"", "  ", "-1", "abc", "0x", "0xZZ", "65536"}) {
            assertThrows(IllegalArgumentException.class, () -> ModbusUtils.parseOffset(text), text);
        }
        assertThrows(IllegalArgumentException.class, () -> ModbusUtils.parseOffset(null));
    }

    @Test
    void coilBytesAreLeastSignificantBitFirst() {
        boolean[] values = ModbusUtils.getCoilValues(new byte[]{0b0000_0101, 0b0000_0001}, 10);
        assertArrayEquals(new boolean[]{true, false, true, false, false, false, false, false, true, false}, values);

        assertArrayEquals(new byte[]{0b0000_0101, 0b0000_0001},
                ModbusUtils.buildCoilBytes(new boolean[]{true, false, true, false, false, false, false, false, true}));
    }

    @Test
    void shortCoilPayloadLeavesRemainingFalse() {
        boolean[] values = ModbusUtils.getCoilValues(new byte[]{(byte) 0xFF}, 12);
        assertTrue(values[7]);
        assertFalse(values[8]);
        assertEquals(12, values.length);
    }

    @Test
    void registerBytesAreBigEndianUnsigned() {
        int[] registers = ModbusUtils.getRegisterValues(new byte[]{(byte) 0x12, (byte) 0x34, (byte) 0xFF, (byte) 0xFE}, 2);
        assertArrayEquals(new int[]{0x1234, 0xFFFE}, registers);
        assertArrayEquals(new byte[]{(byte) 0x12, (byte) 0x34, (byte) 0xFF, (byte) 0xFE},
                ModbusUtils.buildRegisterBytes(new int[]{0x1234, 0xFFFE}));
    }
}
