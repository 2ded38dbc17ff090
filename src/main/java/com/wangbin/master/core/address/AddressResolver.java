package com.wangbin.master.core.address;

import com.wangbin.master.common.exception.AddressParseException;
import com.wangbin.master.common.exception.UnsupportedAddressException;
import com.wangbin.master.core.buffer.BufferKind;
import com.wangbin.master.core.buffer.ElementType;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * IEC地址解析与缓冲区定位
 */
public final class AddressResolver {

    // %<区域><宽度><字节>[.<位>]
    private static final Pattern IEC_PATTERN = Pattern.compile("^%([A-Z])([A-Z])(\\d+)(?:\\.(\\d+))?$");

    private AddressResolver() {
    }

    /**
     * 解析IEC地址字符串
     */
    public static SymbolicAddress parse(String address) {
        if (address == null || address.isBlank()) {
            throw new AddressParseException(String.valueOf(address), "地址不能为空");
        }

        String text = address.trim().toUpperCase();
        Matcher matcher = IEC_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new AddressParseException(address, "应为 %<I|Q|M><X|B|W|D|L><偏移>[.<位>]");
        }

        IecArea area = IecArea.fromCode(matcher.group(1).charAt(0));
        if (area == null) {
            throw new AddressParseException(address, "未知的存储区: " + matcher.group(1));
        }
        IecSize size = IecSize.fromCode(matcher.group(2).charAt(0));
        if (size == null) {
            throw new AddressParseException(address, "未知的数据宽度: " + matcher.group(2));
        }

        int byteOffset;
        Integer bitOffset = null;
        try {
            byteOffset = Integer.parseInt(matcher.group(3));
            if (matcher.group(4) != null) {
                bitOffset = Integer.parseInt(matcher.group(4));
            }
        } catch (NumberFormatException e) {
            throw new AddressParseException(address, "偏移超出范围");
        }

        if (size == IecSize.BIT) {
            if (bitOffset == null) {
                throw new AddressParseException(address, "位地址缺少位偏移");
            }
            if (bitOffset > 7) {
                throw new AddressParseException(address, "位偏移必须在 0-7 之间: " + bitOffset);
            }
        } else if (bitOffset != null) {
            throw new AddressParseException(address, "宽度 " + size.getCode() + " 不能带位偏移");
        }

        return new SymbolicAddress(area, size, byteOffset, bitOffset);
    }

    /**
     * 把符号地址映射到共享缓冲区位置
     */
    public static BufferAccessDescriptor resolve(SymbolicAddress address, AccessDirection direction) {
        IecSize size = address.size();
        ElementType elementType = switch (size) {
            case BIT -> ElementType.BOOL;
            case BYTE -> ElementType.BYTE;
            case WORD -> ElementType.INT;
            case DOUBLE_WORD -> ElementType.DINT;
            case LONG_WORD -> ElementType.LINT;
        };

        BufferKind kind = BufferKind.of(elementType, address.area());
        if (kind == null) {
            throw new UnsupportedAddressException(address.toString(),
                    address.area().getDescription() + " 不支持宽度 " + size + " (" + direction + ")");
        }

        if (kind.isBoolean()) {
            return new BufferAccessDescriptor(kind, address.byteOffset(), address.bitOffset(), 1, true);
        }

        int width = elementType.getSizeBytes();
        return new BufferAccessDescriptor(kind, address.byteOffset() / width, null, width, false);
    }

    /**
     * 解析并定位
     */
    public static BufferAccessDescriptor resolve(String address, AccessDirection direction) {
        return resolve(parse(address), direction);
    }
}
