package com.wangbin.master.core.address;

/**
 * 数据流向：READ 表示从站数据写入PLC内存，WRITE 表示PLC内存数据发往从站
 */
public enum AccessDirection {
    READ,
    WRITE
}
