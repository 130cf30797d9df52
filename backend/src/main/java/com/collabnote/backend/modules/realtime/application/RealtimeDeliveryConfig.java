package com.collabnote.backend.modules.realtime.application;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Delivery pool for outbound queues. There is no task queue: when every thread is busy writing, a new
 * thread is started up to {@code maxDeliveryThreads}, so a client that stops reading holds at most one
 * thread and never delays anyone else's drain.
 */
@Configuration
public class RealtimeDeliveryConfig {

    public static final String DELIVERY_EXECUTOR = "collaborationDeliveryExecutor";

    @Bean(name = DELIVERY_EXECUTOR)
    public ThreadPoolTaskExecutor collaborationDeliveryExecutor(RealtimeProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.deliveryThreads());
        executor.setMaxPoolSize(properties.maxDeliveryThreads());
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("collab-delivery-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
