package com.company.obscalc.config;

import com.company.obscalc.service.CalcCacheService;
import com.company.obscalc.service.CalcDispatcher;
import com.company.obscalc.service.ObscalcWorker;
import com.company.obscalc.service.TelluricResolutionService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class WorkerConfig {

    @Bean
    public ThreadPoolTaskExecutor obscalcWorkerExecutor(@Value("${obscalc.worker.threads:8}") int threads) {
        return boundedExecutor("obscalc-worker-", threads);
    }

    /**
     * Runs the remote calculator call so the time limiter can stop waiting on it.
     */
    @Bean
    public ThreadPoolTaskExecutor calculatorCallExecutor(@Value("${obscalc.worker.threads:8}") int threads) {
        return boundedExecutor("obscalc-call-", threads);
    }

    @Bean
    public ThreadPoolTaskExecutor telluricWorkerExecutor(@Value("${obscalc.telluric.threads:4}") int threads) {
        return boundedExecutor("telluric-worker-", threads);
    }

    // Used by @Async event listeners
    @Bean
    public ThreadPoolTaskExecutor taskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("obscalc-async-");
        executor.initialize();
        return executor;
    }

    /**
     * Delivers change notifications to subscribers. One thread keeps them in
     * commit order.
     */
    @Bean
    public ThreadPoolTaskExecutor changeNotifierExecutor(
            @Value("${obscalc.notifier.queue-capacity:10000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("obscalc-notify-");
        executor.initialize();
        return executor;
    }

    @Bean
    public CalcDispatcher obscalcDispatcher(@Qualifier("obscalcService") CalcCacheService obscalcService,
                                            @Qualifier("obscalcWorkerExecutor") ThreadPoolTaskExecutor executor,
                                            @Value("${obscalc.worker.threads:8}") int threads,
                                            ObscalcWorker worker) {
        return new CalcDispatcher(obscalcService, executor, threads, worker::process);
    }

    @Bean
    public CalcDispatcher telluricDispatcher(@Qualifier("telluricService") CalcCacheService telluricService,
                                             @Qualifier("telluricWorkerExecutor") ThreadPoolTaskExecutor executor,
                                             @Value("${obscalc.telluric.threads:4}") int threads,
                                             TelluricResolutionService telluricResolutionService) {
        return new CalcDispatcher(telluricService, executor, threads, telluricResolutionService::resolve);
    }

    private static ThreadPoolTaskExecutor boundedExecutor(String prefix, int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(threads);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
