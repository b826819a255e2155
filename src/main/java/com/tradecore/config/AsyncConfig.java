package com.tradecore.config;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors shared across the application, plus the builder the repository factory uses for
 * the per-repository sync and dump pools.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${tradecore.async.core-pool-size:2}")
    private int corePoolSize;

    @Value("${tradecore.async.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${tradecore.async.queue-capacity:1000}")
    private int queueCapacity;

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        return boundedExecutor(
                "event-", corePoolSize, maxPoolSize, queueCapacity, new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /** Runs exchange calls so they can be abandoned by their time limiter. */
    @Bean("exchangeExecutor")
    public ThreadPoolTaskExecutor exchangeExecutor(ExchangeConfig exchangeConfig) {
        return boundedExecutor(
                "exchange-",
                exchangeConfig.getCallPoolSize(),
                exchangeConfig.getCallPoolSize(),
                100,
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Builds a bounded pool. With {@link ThreadPoolExecutor.AbortPolicy} a full queue surfaces as
     * a rejection to the submitter. Spring initialises bean executors; callers creating one
     * outside the context must call {@code initialize()} themselves.
     */
    public static ThreadPoolTaskExecutor boundedExecutor(
            String threadNamePrefix,
            int corePoolSize,
            int maxPoolSize,
            int queueCapacity,
            RejectedExecutionHandler rejectedExecutionHandler) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setRejectedExecutionHandler(rejectedExecutionHandler);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return eventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
