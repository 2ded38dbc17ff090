package com.wangbin.master.core.connection;

import com.wangbin.master.common.exception.ModbusTransactionException;

/**
 * 单个从站的Modbus传输
 * <p>
 * 所有方法失败时抛出 {@link ModbusTransactionException}，区分连接错误和协议错误。
 * 读方法返回的数组长度等于请求数量。
 */
public interface ModbusTransport {

    void connect();

    boolean isConnected();

    void close();

    boolean[] readCoils(int address, int count);

    boolean[] readDiscreteInputs(int address, int count);

    int[] readHoldingRegisters(int address, int count);

    int[] readInputRegisters(int address, int count);

    void writeSingleCoil(int address, boolean value);

    void writeSingleRegister(int address, int value);

    void writeMultipleCoils(int address, boolean[] values);

    void writeMultipleRegisters(int address, int[] values);
}
