package org.springaicommunity.github.contributions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an analysis on a worker thread under a deadline. On expiry the worker is
 * interrupted, which unwinds any in-flight request or backoff sleep.
 */
public class DeadlineRunner implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(DeadlineRunner.class);

	private static final AtomicInteger THREAD_COUNT = new AtomicInteger();

	private final ExecutorService executor;

	public DeadlineRunner() {
		ThreadFactory threads = runnable -> {
			Thread thread = new Thread(runnable, "contributions-analysis-" + THREAD_COUNT.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
		this.executor = Executors.newCachedThreadPool(threads);
	}

	/**
	 * Run {@code task}, waiting at most {@code deadline} for it.
	 * @param deadline maximum time to wait
	 * @param task the work
	 * @return the task's result
	 * @throws AnalysisTimeoutException if the deadline passed first
	 * @throws CancellationException if the calling thread was interrupted while waiting
	 */
	public <T> T call(Duration deadline, Callable<T> task) {
		Future<T> future = executor.submit(task);
		try {
			return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (TimeoutException e) {
			future.cancel(true);
			logger.warn("Analysis exceeded its {}s deadline and was cancelled", deadline.toSeconds());
			throw new AnalysisTimeoutException(deadline, e);
		}
		catch (InterruptedException e) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			CancellationException cancelled = new CancellationException("Interrupted while waiting for analysis");
			cancelled.initCause(e);
			throw cancelled;
		}
		catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException runtime) {
				throw runtime;
			}
			if (cause instanceof Error error) {
				throw error;
			}
			throw new IllegalStateException("Analysis failed", cause);
		}
	}

	@Override
	public void close() {
		executor.shutdownNow();
	}

}
