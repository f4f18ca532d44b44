// Part of Batchless
package com.machinezoo.batchless;

import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;

/*
 * Batch caches need some executor to run automatic dispatches on.
 * Dispatch invokes application-defined fetch functions, which usually block on a database or remote API.
 * Compute-optimized pools like ForkJoinPool.commonPool() are therefore a poor default.
 * We will instead keep one shared cached thread pool that grows as needed and shrinks when idle.
 */
/**
 * Default executor for automatic dispatches of {@link BatchCache}.
 */
@StubDocs
@NoTests
public class BatchExecutor {
	private BatchExecutor() {
	}
	private static final AtomicLong threadCounter = new AtomicLong();
	private static final ThreadPoolExecutor common = new ThreadPoolExecutor(0, Integer.MAX_VALUE, 60, TimeUnit.SECONDS, new SynchronousQueue<>(), new ThreadFactory() {
		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable);
			/*
			 * Pending dispatches must not keep the process alive.
			 */
			thread.setDaemon(true);
			thread.setName("batchless-" + threadCounter.incrementAndGet());
			return thread;
		}
	});
	static {
		Metrics.gauge("batchless.executor.threads", common, x -> x.getPoolSize());
		Metrics.gauge("batchless.executor.active", common, x -> x.getActiveCount());
	}
	public static ExecutorService common() {
		return common;
	}
}
