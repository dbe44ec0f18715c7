package com.phillippitts.mediaqueue.config;

import com.phillippitts.mediaqueue.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
    private ThreadPoolTaskExecutor runner;
    private Executor engine;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        if (runner != null) {
            runner.shutdown();
        }
        if (engine instanceof ThreadPoolTaskExecutor pool) {
            pool.shutdown();
        }
    }

    @Test
    void runnerPoolUsesConfiguredSizing() {
        runner = config.runnerExecutor();

        assertThat(runner.getCorePoolSize()).isEqualTo(1);
        assertThat(runner.getMaxPoolSize()).isEqualTo(2);
        assertThat(runner.getThreadNamePrefix()).isEqualTo("runner-");
    }

    @Test
    void jobIdFollowsTaskOntoEngineThread() throws Exception {
        // Arrange
        engine = config.engineExecutor();
        ThreadContext.put("jobId", "job-42");

        // Act
        CompletableFuture<String> seen = CompletableFuture.supplyAsync(
                () -> Thread.currentThread().getName() + "|" + ThreadContext.get("jobId"), engine);

        // Assert
        assertThat(seen.get(5, TimeUnit.SECONDS)).startsWith("queue-engine-").endsWith("|job-42");
    }

    @Test
    void decoratorRestoresWorkerContextAfterTask() {
        ThreadContext.put("jobId", "outer");
        Runnable decorated = ThreadPoolConfig.contextPropagatingDecorator().decorate(
                () -> assertThat(ThreadContext.get("jobId")).isEqualTo("outer"));

        ThreadContext.clearAll();
        ThreadContext.put("jobId", "worker");
        decorated.run();

        assertThat(ThreadContext.get("jobId")).isEqualTo("worker");
    }
}
