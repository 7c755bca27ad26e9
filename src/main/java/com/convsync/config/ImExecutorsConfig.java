package com.convsync.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableConfigurationProperties(ImSyncExecutorProperties.class)
public class ImExecutorsConfig {

    /**
     * 所有可能阻塞的存储调用都在这里执行，结果再切回连接的 event loop；拒绝时由调用方按失败处理。
     */
    @Bean("imSyncExecutor")
    @Primary
    public Executor imSyncExecutor(ImSyncExecutorProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("im-sync-");
        int core = props == null ? 8 : props.corePoolSizeEffective();
        int max = props == null ? 32 : props.maxPoolSizeEffective();
        if (max < core) {
            max = core;
        }
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(props == null ? 10_000 : props.queueCapacityEffective());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setAwaitTerminationSeconds(10);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
