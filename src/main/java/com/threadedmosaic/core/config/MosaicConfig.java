package com.threadedmosaic.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for mosaic builds.
 * <p>
 * {@code operationExecutor} runs one task per accepted request; requests beyond
 * {@code mosaic.processing.max-concurrent-operations} wait in its queue.
 * {@code tileExecutor} is shared by all running builds for per-tile work.
 * Both are shut down when the context closes.
 */
@Configuration
@EnableScheduling
public class MosaicConfig {

    public static final String OPERATION_EXECUTOR = "operationExecutor";
    public static final String TILE_EXECUTOR = "tileExecutor";

    @Bean(name = OPERATION_EXECUTOR, destroyMethod = "shutdown")
    public ThreadPoolExecutor operationExecutor(MosaicProperties properties) {
        int size = Math.max(1, properties.getMaxConcurrentOperations());
        return new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), namedThreads("mosaic-op-"));
    }

    @Bean(name = TILE_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService tileExecutor(MosaicProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getTileParallelism()),
                namedThreads("mosaic-tile-"));
    }

    static ThreadFactory namedThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
