package im.arun.tocclassifier.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pools for classifying a batch of TOC files. Each pool belongs to the run that asked
 * for it; the caller shuts it down when the batch is done.
 */
public final class ExecutorProvider {
    static final String THREAD_NAME_PREFIX = "toc-classifier-worker-";

    private ExecutorProvider() {}

    /**
     * Classification is CPU-bound, so never more threads than documents or processors.
     */
    public static int poolSize(int documentCount) {
        return Math.max(1, Math.min(documentCount, Runtime.getRuntime().availableProcessors()));
    }

    public static ExecutorService newBatchExecutor(int documentCount) {
        AtomicInteger counter = new AtomicInteger(0);
        return Executors.newFixedThreadPool(poolSize(documentCount), runnable -> {
            Thread thread = new Thread(runnable, THREAD_NAME_PREFIX + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
