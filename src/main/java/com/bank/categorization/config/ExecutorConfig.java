package com.bank.categorization.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated pools so that slow inference, feedback dispatch and semantic
 * writes never queue behind each other.
 */
@Configuration
public class ExecutorConfig {

    @Bean
    public ThreadPoolTaskExecutor routerExecutor(RoutingConfig routingConfig) {
        return build("router-", routingConfig.getMaxParallelism(), 1000);
    }

    @Bean
    public ThreadPoolTaskExecutor inferenceExecutor(RoutingConfig routingConfig) {
        return build("inference-", routingConfig.getMaxParallelism(), 1000);
    }

    @Bean
    public ThreadPoolTaskExecutor learningExecutor(LearningConfig learningConfig) {
        return build("feedback-", learningConfig.getDispatchPoolSize(), 500);
    }

    @Bean
    public ThreadPoolTaskExecutor memoryExecutor(MemoryConfig memoryConfig) {
        return build("reasoning-", memoryConfig.getWritePoolSize(), 5000);
    }

    private ThreadPoolTaskExecutor build(String prefix, int size, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
