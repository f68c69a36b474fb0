package com.colorcorrection.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for batch processing. All of them propagate MDC so log lines
 * from worker threads keep the traceId and batchId of the request.
 *
 * Three kinds of threads:
 * - batch launcher: one thread running the fan-out/fan-in loop of the active batch
 * - workers: bounded per-batch pool, sized by WorkerPolicy
 * - attempts: where the pipeline call actually runs, so a worker can give up
 *   at its deadline without waiting for compute that cannot be interrupted
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Bean("batchLauncherExecutor")
    public ExecutorService batchLauncherExecutor() {
        log.info("Creating batch launcher executor with MDC propagation");
        return new MdcPropagatingExecutorService(
                Executors.newSingleThreadExecutor(namedThreadFactory("cc-batch-", false)));
    }

    @Bean("itemAttemptExecutor")
    public ExecutorService itemAttemptExecutor() {
        log.info("Creating item attempt executor with MDC propagation");
        return new MdcPropagatingExecutorService(
                Executors.newCachedThreadPool(namedThreadFactory("cc-attempt-", true)));
    }

    @Bean
    public WorkerPoolFactory workerPoolFactory() {
        return (workers, threadPrefix) -> {
            log.debug("Creating worker pool '{}' with {} threads", threadPrefix, workers);
            return new MdcPropagatingExecutorService(
                    Executors.newFixedThreadPool(workers, namedThreadFactory(threadPrefix, true)));
        };
    }

    // Worker threads are daemons: a wedged pipeline call must not keep the JVM alive
    static ThreadFactory namedThreadFactory(String prefix, boolean daemon) {
        return new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + counter.incrementAndGet());
                t.setDaemon(daemon);
                return t;
            }
        };
    }
}
