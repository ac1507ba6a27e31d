package io.evitadb.warehouse.invoke;

import io.evitadb.warehouse.CapturingLog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("WatchdogCollectorInvoker bounds the wall-clock time of collector calls")
public class WatchdogCollectorInvokerTest {

	private CapturingLog log;
	private WatchdogCollectorInvoker invoker;

	@BeforeEach
	public void setUp() {
		this.log = new CapturingLog();
		this.invoker = new WatchdogCollectorInvoker(Duration.ofMillis(200), this.log);
	}

	@AfterEach
	public void tearDown() {
		this.invoker.close();
	}

	@Test
	@DisplayName("returns the value of a fast call")
	public void shouldReturnValue() throws Exception {
		assertEquals(42, this.invoker.invoke("fast", () -> 42));
	}

	@Test
	@DisplayName("runs calls on a named daemon thread")
	public void shouldUseDaemonThread() throws Exception {
		final Thread thread = this.invoker.invoke("probe", Thread::currentThread);

		assertTrue(thread.isDaemon());
		assertTrue(thread.getName().startsWith("token-warehouse-collector-"));
	}

	@Test
	@DisplayName("rethrows checked and unchecked failures unwrapped")
	public void shouldUnwrapFailures() {
		assertThrows(IOException.class, () -> this.invoker.invoke("io", () -> {
			throw new IOException("disk");
		}));
		assertThrows(IllegalStateException.class, () -> this.invoker.invoke("state", () -> {
			throw new IllegalStateException("state");
		}));
		assertThrows(StackOverflowError.class, () -> this.invoker.invoke("error", () -> {
			throw new StackOverflowError();
		}));
	}

	@Test
	@DisplayName("interrupts a slow call and keeps serving later calls")
	public void shouldTimeOutAndRecover() throws Exception {
		final CountDownLatch interrupted = new CountDownLatch(1);
		final CollectorTimeoutException ex = assertThrows(CollectorTimeoutException.class, () -> this.invoker.invoke("slow", () -> {
			try {
				Thread.sleep(10_000);
			} catch (InterruptedException e) {
				interrupted.countDown();
			}
			return null;
		}));

		assertEquals("slow", ex.getCollectorName());
		assertEquals(Duration.ofMillis(200), ex.getTimeout());
		assertTrue(interrupted.await(5, TimeUnit.SECONDS), "slow call should have been interrupted");
		assertEquals(1, this.invoker.getAbandonedWorkers());
		assertEquals("ok", this.invoker.invoke("next", () -> "ok"));
		assertTrue(this.log.getOutput().contains("Replacing collector worker abandoned by 'slow'"));
	}

	@Test
	@DisplayName("a call ignoring interruption does not block the next call")
	public void shouldNotBlockBehindUninterruptibleCall() throws Exception {
		final AtomicReference<Boolean> release = new AtomicReference<>(false);
		try {
			assertThrows(CollectorTimeoutException.class, () -> this.invoker.invoke("spinning", () -> {
				while (!release.get()) {
					Thread.onSpinWait();
				}
				return null;
			}));
			assertEquals("ok", this.invoker.invoke("next", () -> "ok"));
		} finally {
			release.set(true);
		}
	}

	@Test
	@DisplayName("rejects non-positive budgets")
	public void shouldRejectNonPositiveTimeout() {
		assertThrows(IllegalArgumentException.class, () -> new WatchdogCollectorInvoker(Duration.ZERO, this.log));
		assertThrows(IllegalArgumentException.class, () -> new WatchdogCollectorInvoker(Duration.ofMillis(-1), this.log));
	}

	@Test
	@DisplayName("the direct invoker calls through on the caller thread")
	public void shouldCallDirectly() throws Exception {
		assertEquals(Thread.currentThread(), DirectCollectorInvoker.INSTANCE.invoke("direct", Thread::currentThread));
	}
}
