package com.tradinggateway.config;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools used by the connectivity core.
 *
 * <ul>
 *   <li>{@code gatewayIoExecutor}: runs gateway calls (probes, snapshots, historical bars,
 *       qualification) so callers can enforce deadlines and cancel them</li>
 *   <li>{@code taskScheduler}: drives {@code @Scheduled} probes, recovery ticks and restarts</li>
 * </ul>
 *
 * <p>The session supervisor thread is owned by {@link com.tradinggateway.session.SessionManager}
 * itself, not by this configuration.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${gateway.io.core-pool-size:8}")
    private int corePoolSize;

    @Value("${gateway.io.max-pool-size:16}")
    private int maxPoolSize;

    @Value("${gateway.io.queue-capacity:64}")
    private int queueCapacity;

    @Bean("gatewayIoExecutor")
    public ThreadPoolTaskExecutor gatewayIoExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("gateway-io-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("gateway-sched-");
        scheduler.setErrorHandler(t -> LoggerFactory.getLogger(AsyncConfig.class)
                .error("Scheduled task failed: {}", t.getMessage(), t));
        return scheduler;
    }

    @Override
    public Executor getAsyncExecutor() {
        return gatewayIoExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
