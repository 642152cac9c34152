package com.nilsson.imagecropper.service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 Factory for the fixed worker pools behind the preloader and the saver.
 */
final class WorkerThreads {

    private WorkerThreads() {}

    /**
     A fixed pool of daemon threads named {@code <prefix>-N}. All threads take jobs from the pool's
     single shared queue.
     */
    static ExecutorService newPool(String prefix, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException(prefix + " pool needs at least one thread, got " + threads);
        }
        return Executors.newFixedThreadPool(threads, new ThreadFactory() {
            private final AtomicInteger count = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r);
                t.setDaemon(true); // a forced exit must not wait on workers
                t.setName(prefix + "-" + count.getAndIncrement());
                return t;
            }
        });
    }
}
