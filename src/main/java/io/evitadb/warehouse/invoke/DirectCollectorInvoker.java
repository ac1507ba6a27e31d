package io.evitadb.warehouse.invoke;

import javax.annotation.Nonnull;
import java.util.concurrent.Callable;

/**
 * Runs collector callbacks inline on the dispatching thread, without any time budget.
 */
public final class DirectCollectorInvoker implements CollectorInvoker {

	public static final DirectCollectorInvoker INSTANCE = new DirectCollectorInvoker();

	private DirectCollectorInvoker() {
	}

	@Override
	public <T> T invoke(@Nonnull String collectorName, @Nonnull Callable<T> call) throws Exception {
		return call.call();
	}

	@Override
	public void close() {
		// nothing to release
	}
}
