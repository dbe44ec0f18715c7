package com.phillippitts.mediaqueue.config;

import com.phillippitts.mediaqueue.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for the queue.
 *
 * <ul>
 *   <li>{@code runnerExecutor}: waits on analysis processes ({@code threadpool.runner.*})</li>
 *   <li>{@code engineExecutor}: single thread that applies run results to the job list</li>
 *   <li>{@code ingestExecutor}: runs outbox drain passes ({@code threadpool.ingest.*})</li>
 * </ul>
 *
 * <p>Every executor copies the Log4j2 ThreadContext from the submitting thread so the
 * {@code jobId} survives the hop.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Pool that blocks on child processes.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}, providing backpressure
     * instead of failing a job.
     */
    @Bean(name = "runnerExecutor")
    public ThreadPoolTaskExecutor runnerExecutor() {
        return pool(threadPoolProperties.getRunner());
    }

    @Bean(name = "ingestExecutor")
    public ThreadPoolTaskExecutor ingestExecutor() {
        return pool(threadPoolProperties.getIngest());
    }

    /**
     * Single writer for run results. Unbounded queue: results must never be dropped or run on
     * the runner's thread.
     */
    @Bean(name = "engineExecutor")
    public Executor engineExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("queue-engine-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(contextPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    private static ThreadPoolTaskExecutor pool(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(contextPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator contextPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
