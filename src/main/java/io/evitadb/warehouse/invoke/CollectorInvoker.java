package io.evitadb.warehouse.invoke;

import javax.annotation.Nonnull;
import java.util.concurrent.Callable;

/**
 * Runs a single collector callback behind the warehouse's timeout boundary.
 */
public interface CollectorInvoker extends AutoCloseable {

	/**
	 * Runs the call and returns its result.
	 *
	 * @param collectorName name of the collector the call belongs to
	 * @param call          the collector callback
	 * @param <T>           result type
	 * @return result of the call
	 * @throws CollectorTimeoutException when the call exceeds its time budget
	 * @throws Exception                 whatever the call itself throws
	 */
	<T> T invoke(@Nonnull String collectorName, @Nonnull Callable<T> call) throws Exception;

	/**
	 * Releases threads held by the invoker.
	 */
	@Override
	void close();
}
