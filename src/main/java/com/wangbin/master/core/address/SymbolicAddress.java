package com.wangbin.master.core.address;

/**
 * 解析后的IEC符号地址，如 %QW10、%IX0.3、%MD4
 *
 * @param area       存储区
 * @param size       数据宽度
 * @param byteOffset 字节偏移
 * @param bitOffset  位偏移，仅位类型有值
 */
public record SymbolicAddress(IecArea area, IecSize size, int byteOffset, Integer bitOffset) {

    public SymbolicAddress {
        if (area == null || size == null) {
            throw new IllegalArgumentException("area 和 size 不能为空");
        }
        if (byteOffset < 0) {
            throw new IllegalArgumentException("byteOffset 不能小于0: " + byteOffset);
        }
        if (size == IecSize.BIT) {
            if (bitOffset == null || bitOffset < 0 || bitOffset > 7) {
                throw new IllegalArgumentException("位地址需要 0-7 的位偏移: " + bitOffset);
            }
        } else if (bitOffset != null) {
            throw new IllegalArgumentException("只有位地址可以带位偏移: " + size);
        }
    }

    public boolean isBit() {
        return size == IecSize.BIT;
    }

    @Override
    public String toString() {
        String base = "%" + area.getCode() + size.getCode() + byteOffset;
        return bitOffset != null ? base + "." + bitOffset : base;
    }
}
