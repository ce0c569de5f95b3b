package com.enterprise.workflow.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Thread pool running task handlers and workflow dispatch units, with attempt statistics.
 * <p>
 * The default pool grows on demand so that a dispatch unit blocked on its
 * handler never starves another; per-run concurrency is bounded by the engine.
 */
public class AsyncTaskExecutor implements Executor {
    
    private static final Logger logger = LoggerFactory.getLogger(AsyncTaskExecutor.class);
    
    private final ThreadPoolExecutor executor;
    private final AtomicLong totalAttempts = new AtomicLong(0);
    private final AtomicLong totalCompleted = new AtomicLong(0);
    private final AtomicLong totalFailed = new AtomicLong(0);
    private final AtomicLong totalTimedOut = new AtomicLong(0);
    private final AtomicLong totalExecutionTime = new AtomicLong(0);
    
    public AsyncTaskExecutor(Duration keepAliveTime) {
        this(0, Integer.MAX_VALUE, keepAliveTime.toMillis(), TimeUnit.MILLISECONDS, new SynchronousQueue<>());
    }
    
    public AsyncTaskExecutor(int corePoolSize, int maximumPoolSize,
                             long keepAliveTime, TimeUnit unit,
                             BlockingQueue<Runnable> workQueue) {
        
        this.executor = new ThreadPoolExecutor(
            corePoolSize,
            maximumPoolSize,
            keepAliveTime,
            unit,
            workQueue,
            new WorkerThreadFactory(),
            new WorkerRejectedExecutionHandler()
        );
        
        logger.info("AsyncTaskExecutor initialized with core={}, max={}, keepAlive={}ms",
                   corePoolSize, maximumPoolSize, unit.toMillis(keepAliveTime));
    }
    
    @Override
    public void execute(Runnable command) {
        executor.execute(command);
    }
    
    /**
     * Run a supplier on the pool
     */
    public <T> CompletableFuture<T> submit(Supplier<T> supplier) {
        return CompletableFuture.supplyAsync(supplier, executor);
    }
    
    /**
     * Run one attempt of a task on the pool, bounded by {@code timeout}, and record its outcome
     */
    public TaskResult runAttempt(Task task, TaskContext context, Duration timeout) {
        totalAttempts.incrementAndGet();
        logger.debug("Executing task {} ({})", task.getName(), task.getId());
        
        TaskResult result = task.execute(context, executor, timeout);
        totalExecutionTime.addAndGet(result.getDurationMs());
        
        switch (result.getStatus()) {
            case COMPLETED:
                totalCompleted.incrementAndGet();
                logger.debug("Task {} completed successfully in {}ms", task.getName(), result.getDurationMs());
                break;
            case TIMED_OUT:
                totalTimedOut.incrementAndGet();
                totalFailed.incrementAndGet();
                break;
            default:
                totalFailed.incrementAndGet();
                logger.debug("Task {} ended {}: {}", task.getName(), result.getStatus(), result.getError());
                break;
        }
        return result;
    }
    
    /**
     * Get executor statistics
     */
    public ExecutorStatistics getStatistics() {
        return new ExecutorStatistics() {
            @Override
            public long getTotalAttempts() {
                return totalAttempts.get();
            }
            
            @Override
            public long getTotalCompleted() {
                return totalCompleted.get();
            }
            
            @Override
            public long getTotalFailed() {
                return totalFailed.get();
            }
            
            @Override
            public long getTotalTimedOut() {
                return totalTimedOut.get();
            }
            
            @Override
            public double getAverageExecutionTimeMs() {
                long attempts = totalAttempts.get();
                return attempts > 0 ? (double) totalExecutionTime.get() / attempts : 0.0;
            }
            
            @Override
            public int getActiveThreadCount() {
                return executor.getActiveCount();
            }
            
            @Override
            public int getPoolSize() {
                return executor.getPoolSize();
            }
            
            @Override
            public int getLargestPoolSize() {
                return executor.getLargestPoolSize();
            }
        };
    }
    
    /**
     * Shutdown the executor, waiting up to {@code timeout} for running work
     */
    public CompletableFuture<Void> shutdown(Duration timeout) {
        return CompletableFuture.runAsync(() -> {
            logger.info("Shutting down AsyncTaskExecutor...");
            
            executor.shutdown();
            
            try {
                if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("Executor did not terminate gracefully, forcing shutdown");
                    executor.shutdownNow();
                }
                
                logger.info("AsyncTaskExecutor shutdown completed");
                
            } catch (InterruptedException e) {
                logger.error("Interrupted during shutdown", e);
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        });
    }
    
    /**
     * Check if executor is running
     */
    public boolean isRunning() {
        return !executor.isShutdown() && !executor.isTerminated();
    }
    
    /**
     * Daemon threads named workflow-worker-N
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicLong threadNumber = new AtomicLong(1);
        private final String namePrefix = "workflow-worker-";
        
        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + threadNumber.getAndIncrement());
            t.setDaemon(true);
            t.setPriority(Thread.NORM_PRIORITY);
            return t;
        }
    }
    
    private static class WorkerRejectedExecutionHandler implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            if (executor.isShutdown()) {
                throw new RejectedExecutionException("Executor has been shut down");
            }
            logger.error("Task execution rejected - thread pool is full and queue is full");
            throw new RejectedExecutionException("Task execution rejected - system overloaded");
        }
    }
    
    /**
     * Statistics interface for the executor
     */
    public interface ExecutorStatistics {
        long getTotalAttempts();
        long getTotalCompleted();
        long getTotalFailed();
        long getTotalTimedOut();
        double getAverageExecutionTimeMs();
        int getActiveThreadCount();
        int getPoolSize();
        int getLargestPoolSize();
    }
}
