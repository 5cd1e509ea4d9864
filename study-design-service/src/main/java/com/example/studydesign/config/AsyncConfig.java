package com.example.studydesign.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded executors for pipeline runs and report rendering.
 *
 * Without explicit executors Spring falls back to an unbounded thread-per-task executor.
 * Both pools use AbortPolicy: a full queue rejects the task, and the caller marks the project
 * failed and answers 503 instead of blocking the request thread (CallerRunsPolicy would run a
 * whole pipeline on the HTTP thread).
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig {

    @Bean(name = "pipelineTaskExecutor")
    public Executor pipelineTaskExecutor(
            @Value("${pipeline.async.core-pool-size:2}") int corePoolSize,
            @Value("${pipeline.async.max-pool-size:4}") int maxPoolSize,
            @Value("${pipeline.async.queue-capacity:50}") int queueCapacity,
            @Value("${pipeline.async.thread-name-prefix:pipeline-}") String threadNamePrefix) {
        return buildExecutor("pipelineTaskExecutor", corePoolSize, maxPoolSize, queueCapacity, threadNamePrefix);
    }

    @Bean(name = "reportTaskExecutor")
    public Executor reportTaskExecutor(
            @Value("${pipeline.report.async.core-pool-size:1}") int corePoolSize,
            @Value("${pipeline.report.async.max-pool-size:2}") int maxPoolSize,
            @Value("${pipeline.report.async.queue-capacity:20}") int queueCapacity,
            @Value("${pipeline.report.async.thread-name-prefix:report-}") String threadNamePrefix) {
        return buildExecutor("reportTaskExecutor", corePoolSize, maxPoolSize, queueCapacity, threadNamePrefix);
    }

    private static Executor buildExecutor(String name, int corePoolSize, int maxPoolSize,
                                          int queueCapacity, String threadNamePrefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        // Let in-flight stages commit before shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();

        log.info("✅ Initialized {} - core={}, max={}, queue={}, prefix='{}', rejection=AbortPolicy",
                name, corePoolSize, maxPoolSize, queueCapacity, threadNamePrefix);
        return executor;
    }
}
