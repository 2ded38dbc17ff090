package com.wangbin.master.core.buffer;

import com.wangbin.master.core.address.IecArea;
import lombok.Getter;

/**
 * 共享缓冲区类型：元素类型 × 存储区
 */
@Getter
public enum BufferKind {
    BOOL_INPUT(ElementType.BOOL, IecArea.INPUT),
    BOOL_OUTPUT(ElementType.BOOL, IecArea.OUTPUT),

    BYTE_INPUT(ElementType.BYTE, IecArea.INPUT),
    BYTE_OUTPUT(ElementType.BYTE, IecArea.OUTPUT),
    BYTE_MEMORY(ElementType.BYTE, IecArea.MEMORY),

    INT_INPUT(ElementType.INT, IecArea.INPUT),
    INT_OUTPUT(ElementType.INT, IecArea.OUTPUT),
    INT_MEMORY(ElementType.INT, IecArea.MEMORY),

    DINT_INPUT(ElementType.DINT, IecArea.INPUT),
    DINT_OUTPUT(ElementType.DINT, IecArea.OUTPUT),
    DINT_MEMORY(ElementType.DINT, IecArea.MEMORY),

    LINT_INPUT(ElementType.LINT, IecArea.INPUT),
    LINT_OUTPUT(ElementType.LINT, IecArea.OUTPUT),
    LINT_MEMORY(ElementType.LINT, IecArea.MEMORY);

    private final ElementType elementType;
    private final IecArea area;

    BufferKind(ElementType elementType, IecArea area) {
        this.elementType = elementType;
        this.area = area;
    }

    public boolean isBoolean() {
        return elementType == ElementType.BOOL;
    }

    /**
     * 按元素类型和存储区查找，不存在的组合返回 null
     */
    public static BufferKind of(ElementType elementType, IecArea area) {
        for (BufferKind kind : values()) {
            if (kind.elementType == elementType && kind.area == area) {
                return kind;
            }
        }
        return null;
    }
}
