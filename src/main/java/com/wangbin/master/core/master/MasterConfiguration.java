package com.wangbin.master.core.master;

import com.wangbin.master.core.buffer.InMemoryPlcBuffer;
import com.wangbin.master.core.buffer.SharedBufferAccess;
import com.wangbin.master.core.config.MasterProperties;
import com.wangbin.master.core.connection.ModbusTransportFactory;
import com.wangbin.master.core.connection.NettyModbusTransport;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ThreadFactory;

/**
 * 主站组件装配
 */
@Configuration
public class MasterConfiguration {

    /**
     * 独立运行时使用进程内PLC内存映像，嵌入宿主时由宿主提供实现
     */
    @Bean
    @ConditionalOnMissingBean(SharedBufferAccess.class)
    public SharedBufferAccess sharedBufferAccess(MasterProperties properties) {
        MasterProperties.BufferConfig buffer = properties.getBuffer();
        return new InMemoryPlcBuffer(buffer.getSize(), buffer.getLockTimeoutMs());
    }

    @Bean
    @ConditionalOnMissingBean(ModbusTransportFactory.class)
    public ModbusTransportFactory modbusTransportFactory() {
        return NettyModbusTransport::new;
    }

    @Bean
    public MasterSupervisor masterSupervisor(SharedBufferAccess sharedBufferAccess,
                                             MasterProperties properties,
                                             ModbusTransportFactory modbusTransportFactory,
                                             @Qualifier("deviceWorkerThreadFactory") ThreadFactory threadFactory) {
        return new MasterSupervisor(sharedBufferAccess, properties, modbusTransportFactory, threadFactory);
    }
}
