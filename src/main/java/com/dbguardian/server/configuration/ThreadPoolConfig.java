package com.dbguardian.server.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
@Slf4j
public class ThreadPoolConfig {

    @Primary
    @Bean(name = "generalTaskScheduler")
    public ThreadPoolTaskScheduler generalTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("General-Task-Scheduled-Thread-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        return scheduler;
    }

    // 只负责触发, 备份本身交给 backupTaskExecutor
    @Bean(name = "dispatcherTaskScheduler")
    public ThreadPoolTaskScheduler dispatcherTaskScheduler(
            @Value("${dbguardian.server.dispatcher.poolSize:2}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("Dispatcher-Thread-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Bean(name = "backupTaskExecutor")
    public ThreadPoolTaskExecutor backupTaskExecutor(
            @Value("${dbguardian.server.backup.concurrency:4}") int concurrency,
            @Value("${dbguardian.server.backup.queueCapacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("Backup-Worker-Thread-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        log.info("backup pool size {}, queue capacity {}", concurrency, queueCapacity);
        return executor;
    }
}
