package com.wangbin.master.core.config;

import com.wangbin.master.core.address.SymbolicAddress;
import lombok.Builder;
import lombok.Getter;

/**
 * 设备轮询表中的一行
 */
@Getter
@Builder
public class IoPoint {

    private final FunctionCode functionCode;

    /**
     * 配置中的原始偏移文本，用于日志
     */
    private final String rawOffset;

    /**
     * 解析后的Modbus协议地址
     */
    private final int offset;

    private final SymbolicAddress location;

    /**
     * IEC元素个数
     */
    private final int length;

    private final long cycleTimeMs;

    public boolean isRead() {
        return functionCode.isRead();
    }

    @Override
    public String toString() {
        return "fc=" + functionCode.getCode() + ", offset=" + rawOffset + ", iec=" + location
                + ", len=" + length + ", cycle=" + cycleTimeMs + "ms";
    }
}
