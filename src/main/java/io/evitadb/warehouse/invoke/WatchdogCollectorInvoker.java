package io.evitadb.warehouse.invoke;

import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs each collector callback on a daemon worker thread and waits at most the configured budget for it.
 *
 * On timeout the call is cancelled with interruption and the worker is replaced, so the next call never
 * queues behind a stuck one. The JVM cannot pre-empt a thread: a callback that ignores interruption keeps
 * running on its abandoned daemon thread until it returns on its own.
 */
public final class WatchdogCollectorInvoker implements CollectorInvoker {

	private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

	@Nonnull
	private final Duration timeout;
	@Nonnull
	private final Log log;
	@Nonnull
	private ExecutorService worker;
	private int abandonedWorkers;

	/**
	 * Creates a watchdog invoker.
	 *
	 * @param timeout budget of a single call, must be positive
	 * @param log     Maven log for output
	 */
	public WatchdogCollectorInvoker(@Nonnull Duration timeout, @Nonnull Log log) {
		this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
		if (timeout.isZero() || timeout.isNegative()) {
			throw new IllegalArgumentException("timeout must be positive");
		}
		this.worker = newWorker();
	}

	@Override
	public <T> T invoke(@Nonnull String collectorName, @Nonnull Callable<T> call) throws Exception {
		final Future<T> future = this.worker.submit(call);
		try {
			return future.get(this.timeout.toNanos(), TimeUnit.NANOSECONDS);
		} catch (TimeoutException e) {
			future.cancel(true);
			replaceWorker(collectorName);
			throw new CollectorTimeoutException(collectorName, this.timeout);
		} catch (ExecutionException e) {
			final Throwable cause = e.getCause();
			if (cause instanceof Exception) {
				throw (Exception) cause;
			} else if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw e;
		} catch (InterruptedException e) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			throw e;
		}
	}

	/**
	 * Returns how many workers were abandoned because a call outlived its budget.
	 *
	 * @return number of replaced workers
	 */
	public int getAbandonedWorkers() {
		return this.abandonedWorkers;
	}

	@Nonnull
	public Duration getTimeout() {
		return this.timeout;
	}

	@Override
	public void close() {
		this.worker.shutdownNow();
	}

	private void replaceWorker(@Nonnull String collectorName) {
		this.worker.shutdownNow();
		this.abandonedWorkers++;
		this.log.debug("Replacing collector worker abandoned by '" + collectorName + "'");
		this.worker = newWorker();
	}

	@Nonnull
	private static ExecutorService newWorker() {
		final ThreadFactory factory = runnable -> {
			final Thread thread = new Thread(runnable, "token-warehouse-collector-" + THREAD_COUNTER.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
		return Executors.newSingleThreadExecutor(factory);
	}
}
