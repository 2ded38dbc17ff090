package com.wangbin.master.common.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ThreadFactory;

@Configuration
public class ThreadPoolConfig {

    static ThreadFactory buildNamedThreadFactory(String prefix, boolean daemon) {
        return new ThreadFactoryBuilder()
                .setNameFormat(prefix + "-%d")
                .setDaemon(daemon)
                .setPriority(Thread.NORM_PRIORITY)
                .build();
    }

    /**
     * 设备轮询线程，每个从站设备一个
     */
    @Bean(name = "deviceWorkerThreadFactory")
    public ThreadFactory deviceWorkerThreadFactory() {
        return buildNamedThreadFactory("modbus-device", true);
    }
}
