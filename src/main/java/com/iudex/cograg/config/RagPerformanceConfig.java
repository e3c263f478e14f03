package com.iudex.cograg.config;

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
 * Bounded thread pools for backend fan-out, leaf branches, rerank scoring and language-model calls.
 *
 * <p>Rejections are logged and rethrown instead of running on the caller, so a saturated pool
 * degrades a request (the task counts as a soft failure) rather than blocking it.</p>
 */
@Configuration
public class RagPerformanceConfig {

    private static final Logger log = LoggerFactory.getLogger(RagPerformanceConfig.class);

    @Bean(name = {"ragExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor ragExecutor(
            @Value("${iudex.performance.rag-core-threads:8}") int coreThreads,
            @Value("${iudex.performance.rag-max-threads:16}") int maxThreads,
            @Value("${iudex.performance.rag-queue-capacity:200}") int queueCapacity) {
        return buildExecutor("rag-exec-", coreThreads, maxThreads, queueCapacity);
    }

    /**
     * Leaf branches, sibling expansions and sub-answers. These tasks block on work submitted to
     * {@code ragExecutor} and {@code llmExecutor}, so they never share a pool with it.
     */
    @Bean(name = {"branchExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor branchExecutor(
            @Value("${iudex.performance.branch-threads:8}") int threads) {
        return buildExecutor("branch-exec-", threads, threads, Math.max(50, threads * 10));
    }

    @Bean(name = {"rerankerExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor rerankerExecutor(
            @Value("${iudex.performance.reranker-threads:4}") int threads) {
        return buildExecutor("rerank-exec-", threads, threads, Math.max(50, threads * 10));
    }

    @Bean(name = {"llmExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor llmExecutor(
            @Value("${iudex.performance.llm-threads:8}") int threads) {
        return buildExecutor("llm-exec-", threads, threads, Math.max(50, threads * 10));
    }

    public static ThreadPoolExecutor buildExecutor(String prefix, int coreThreads, int maxThreads, int queueCapacity) {
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
            log.warn("Task rejected from pool '{}': active={}, poolSize={}, queueSize={}, totalRejections={}",
                    this.poolName, executor.getActiveCount(), executor.getPoolSize(), executor.getQueue().size(), count);
            throw new RejectedExecutionException("Thread pool '" + this.poolName + "' saturated (rejected " + count + " tasks)");
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
