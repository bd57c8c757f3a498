package com.jreinhal.tieredrag.config;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Thread pools for dense/sparse retrieval, reranking, tier extraction and LLM generation.
 *
 * <p>Saturated pools reject with {@link RejectedExecutionException} instead of running the
 * task on the caller, so request threads are never blocked by a full queue. Callers map the
 * rejection to "backend unavailable".</p>
 */
@Configuration
public class RagPerformanceConfig {

    private static final Logger log = LoggerFactory.getLogger(RagPerformanceConfig.class);

    @Bean(name = {"retrievalExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor retrievalExecutor(
            @Value("${tieredrag.performance.retrieval-core-threads:4}") int coreThreads,
            @Value("${tieredrag.performance.retrieval-max-threads:8}") int maxThreads,
            @Value("${tieredrag.performance.retrieval-queue-capacity:200}") int queueCapacity) {
        return this.buildExecutor("retrieval-exec-", coreThreads, maxThreads, queueCapacity);
    }

    @Bean(name = {"rerankerExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor rerankerExecutor(
            @Value("${tieredrag.performance.reranker-threads:4}") int threads) {
        return this.buildExecutor("rerank-exec-", threads, threads, Math.max(50, threads * 10));
    }

    @Bean(name = {"extractionExecutor"}, destroyMethod = "shutdownNow")
    public ThreadPoolExecutor extractionExecutor(
            @Value("${tieredrag.performance.extraction-threads:4}") int threads) {
        return this.buildExecutor("extract-exec-", threads, threads, Math.max(20, threads * 5));
    }

    @Bean(name = {"generationExecutor"}, destroyMethod = "shutdownNow")
    public ThreadPoolExecutor generationExecutor(
            @Value("${tieredrag.performance.generation-threads:4}") int threads) {
        return this.buildExecutor("generation-exec-", threads, threads, Math.max(20, threads * 5));
    }

    private ThreadPoolExecutor buildExecutor(String prefix, int coreThreads, int maxThreads, int queueCapacity) {
        int core = Math.max(1, coreThreads);
        int max = Math.max(core, maxThreads);
        int queue = Math.max(10, queueCapacity);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(core, max, 30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queue), new NamedThreadFactory(prefix), new MonitoredRejectionHandler(prefix));
        executor.allowCoreThreadTimeOut(true);
        log.info("Thread pool '{}' initialized: core={}, max={}, queue={}", prefix, core, max, queue);
        return executor;
    }

    public static final class MonitoredRejectionHandler implements RejectedExecutionHandler {
        private final String poolName;
        private final AtomicLong rejectionCount = new AtomicLong(0);

        public MonitoredRejectionHandler(String poolName) {
            this.poolName = poolName;
        }

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            long count = this.rejectionCount.incrementAndGet();
            log.warn("Task rejected from pool '{}', queue full: active={}, poolSize={}, queueSize={}, totalRejections={}",
                    this.poolName, executor.getActiveCount(), executor.getPoolSize(),
                    executor.getQueue().size(), count);
            throw new RejectedExecutionException(
                    "Thread pool '" + this.poolName + "' overloaded (rejected " + count + " tasks)");
        }

        public long getRejectionCount() {
            return this.rejectionCount.get();
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(this.prefix + this.counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
