package com.wangbin.master.core.address;

import com.wangbin.master.core.buffer.BufferKind;

/**
 * 一个点位在共享缓冲区中的定位结果
 *
 * @param bufferKind       缓冲区类型
 * @param bufferIndex      元素下标
 * @param bitIndex         位下标，非位类型为 null
 * @param elementSizeBytes 元素字节数
 * @param isBoolean        是否位类型
 */
public record BufferAccessDescriptor(BufferKind bufferKind,
                                     int bufferIndex,
                                     Integer bitIndex,
                                     int elementSizeBytes,
                                     boolean isBoolean) {
}
