package com.wangbin.master.core.connection;

import com.digitalpetri.modbus.client.ModbusTcpClient;
import com.digitalpetri.modbus.exceptions.ModbusResponseException;
import com.digitalpetri.modbus.pdu.ReadCoilsRequest;
import com.digitalpetri.modbus.pdu.ReadDiscreteInputsRequest;
import com.digitalpetri.modbus.pdu.ReadHoldingRegistersRequest;
import com.digitalpetri.modbus.pdu.ReadInputRegistersRequest;
import com.digitalpetri.modbus.pdu.WriteMultipleCoilsRequest;
import com.digitalpetri.modbus.pdu.WriteMultipleRegistersRequest;
import com.digitalpetri.modbus.pdu.WriteSingleCoilRequest;
import com.digitalpetri.modbus.pdu.WriteSingleRegisterRequest;
import com.digitalpetri.modbus.tcp.client.NettyTcpClientTransport;
import com.wangbin.master.common.exception.ModbusTransactionException;
import com.wangbin.master.core.codec.ModbusUtils;
import com.wangbin.master.core.config.DeviceConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 基于 digitalpetri ModbusTcpClient 的传输实现
 */
@Slf4j
public class NettyModbusTransport implements ModbusTransport {

    private final DeviceConfig device;
    private final long timeout;
    private volatile ModbusTcpClient client;

    public NettyModbusTransport(DeviceConfig device) {
        this.device = device;
        this.timeout = device.getTimeoutMs();
    }

    @Override
    public void connect() {
        // 重连由连接管理器负责，底层传输不做后台重连
        NettyTcpClientTransport transport = NettyTcpClientTransport.create(cfg -> {
            cfg.hostname = device.getHost();
            cfg.port = device.getPort();
            cfg.connectTimeout = Duration.ofMillis(timeout);
            cfg.connectPersistent = false;
        });
        ModbusTcpClient newClient = ModbusTcpClient.create(transport,
                cfg -> cfg.requestTimeout = Duration.ofMillis(timeout));
        try {
            newClient.connect();
        } catch (Exception e) {
            discard(newClient);
            throw ModbusTransactionException.connectionError(
                    "连接 " + device.getName() + "(" + device.endpoint() + ") 失败: " + e.getMessage(), e);
        }
        this.client = newClient;
        log.debug("Modbus TCP 客户端创建完成: {}", device.endpoint());
    }

    @Override
    public boolean isConnected() {
        ModbusTcpClient current = client;
        return current != null && current.isConnected();
    }

    @Override
    public void close() {
        ModbusTcpClient current = client;
        client = null;
        if (current == null) {
            return;
        }
        try {
            current.disconnect();
        } catch (Exception e) {
            throw ModbusTransactionException.connectionError("关闭 Modbus TCP 客户端异常: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean[] readCoils(int address, int count) {
        byte[] coils = execute("读线圈", address, c -> c.readCoilsAsync(
                        device.getUnitId(), new ReadCoilsRequest(address, count))
                .toCompletableFuture().get(timeout, TimeUnit.MILLISECONDS).coils());
        return ModbusUtils.getCoilValues(coils, count);
    }

    @Override
    public boolean[] readDiscreteInputs(int address, int count) {
        byte[] inputs = execute("读离散输入", address, c -> c.readDiscreteInputsAsync(
                        device.getUnitId(), new ReadDiscreteInputsRequest(address, count))
                .toCompletableFuture().get(timeout, TimeUnit.MILLISECONDS).inputs());
        return ModbusUtils.getCoilValues(inputs, count);
    }

    @Override
    public int[] readHoldingRegisters(int address, int count) {
        byte[] registers = execute("读保持寄存器", address, c -> c.readHoldingRegistersAsync(
                        device.getUnitId(), new ReadHoldingRegistersRequest(address, count))
                .toCompletableFuture().get(timeout, TimeUnit.MILLISECONDS).registers());
        return checkedRegisters(registers, count);
    }

    @Override
    public int[] readInputRegisters(int address, int count) {
        byte[] registers = execute("读输入寄存器", address, c -> c.readInputRegistersAsync(
                        device.getUnitId(), new ReadInputRegistersRequest(address, count))
                .toCompletableFuture().get(timeout, TimeUnit.MILLISECONDS).registers());
        return checkedRegisters(registers, count);
    }

    @Override
    public void writeSingleCoil(int address, boolean value) {
        execute("写单个线圈", address, c -> c.writeSingleCoilAsync(
                        device.getUnitId(), new WriteSingleCoilRequest(address, value))
                .toCompletableFuture().get(timeout, TimeUnit.MILLISECONDS));
    }

    @Override
    public void writeSingleRegister(int address, int value) {
        execute("写单个寄存器", address, c -> c.writeSingleRegisterAsync(
                        device.getUnitId(), new WriteSingleRegisterRequest(address, value & 0xFFFF))
                .toCompletableFuture().get(timeout, TimeUnit.MILLISECONDS));
    }

    @Override
    public void writeMultipleCoils(int address, boolean[] values) {
        byte[] coilBytes = ModbusUtils.buildCoilBytes(values);
        execute("写多个线圈", address, c -> c.writeMultipleCoilsAsync(
                        device.getUnitId(), new WriteMultipleCoilsRequest(address, values.length, coilBytes))
                .toCompletableFuture().get(timeout, TimeUnit.MILLISECONDS));
    }

    @Override
    public void writeMultipleRegisters(int address, int[] values) {
        byte[] raw = ModbusUtils.buildRegisterBytes(values);
        execute("写多个寄存器", address, c -> c.writeMultipleRegistersAsync(
                        device.getUnitId(), new WriteMultipleRegistersRequest(address, values.length, raw))
                .toCompletableFuture().get(timeout, TimeUnit.MILLISECONDS));
    }

    private void discard(ModbusTcpClient failed) {
        try {
            failed.disconnect();
        } catch (Exception e) {
            log.warn("释放连接失败的客户端异常: {}, {}", device.endpoint(), e.getMessage());
        }
    }

    private int[] checkedRegisters(byte[] raw, int count) {
        if (raw == null || raw.length < count * 2) {
            throw ModbusTransactionException.protocolError(
                    "寄存器响应长度不足: 期望 " + count * 2 + " 字节, 实际 " + (raw == null ? 0 : raw.length), null);
        }
        return ModbusUtils.getRegisterValues(raw, count);
    }

    private <T> T execute(String operation, int address, ModbusCall<T> call) {
        ModbusTcpClient current = client;
        if (current == null) {
            throw ModbusTransactionException.connectionError("Modbus TCP 客户端尚未连接: " + device.endpoint(), null);
        }
        try {
            return call.apply(current);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ModbusTransactionException.connectionError(operation + " 被中断, 地址 " + address, e);
        } catch (TimeoutException e) {
            throw ModbusTransactionException.connectionError(operation + " 超时(" + timeout + "ms), 地址 " + address, e);
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            if (cause instanceof ModbusResponseException) {
                throw ModbusTransactionException.protocolError(
                        operation + " 从站异常响应, 地址 " + address + ": " + cause.getMessage(), cause);
            }
            throw ModbusTransactionException.connectionError(
                    operation + " 失败, 地址 " + address + ": " + cause.getMessage(), cause);
        }
    }

    private static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @FunctionalInterface
    private interface ModbusCall<T> {
        T apply(ModbusTcpClient client) throws Exception;
    }
}
