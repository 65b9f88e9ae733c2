package com.dcruver.notesindex.app;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Executors for index jobs: a worker pool for parsing and writing, and a
 * single-thread scheduler that fires debounce timers.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "indexWorkerExecutor")
    public ThreadPoolTaskExecutor indexWorkerExecutor(NotesIndexProperties properties) {
        return workerExecutor(properties.getWorkers());
    }

    @Bean(name = "indexDebounceScheduler")
    public ThreadPoolTaskScheduler indexDebounceScheduler() {
        return debounceScheduler();
    }

    public static ThreadPoolTaskExecutor workerExecutor(NotesIndexProperties.Workers workers) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, workers.getThreads()));
        executor.setMaxPoolSize(Math.max(1, workers.getThreads()));
        executor.setThreadNamePrefix(workers.getThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    public static ThreadPoolTaskScheduler debounceScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("index-debounce-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }
}
