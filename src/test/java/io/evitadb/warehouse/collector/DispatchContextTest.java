package io.evitadb.warehouse.collector;

import io.evitadb.warehouse.CollectorError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DispatchContext tracks per-pass collector state")
public class DispatchContextTest {

	@Test
	@DisplayName("keeps errors in order and exposes them read-only")
	public void shouldRecordErrors() {
		final DispatchContext ctx = new DispatchContext();
		final CollectorError first = CollectorError.of(
			"b", 1, CollectorError.Phase.ON_TOKEN, new IllegalStateException("one"), CollectorError.Kind.EXCEPTION
		);
		final CollectorError second = CollectorError.of(
			"a", -1, CollectorError.Phase.FINISH, new IllegalStateException("two"), CollectorError.Kind.EXCEPTION
		);
		ctx.recordError(first);
		ctx.recordError(second);

		assertEquals(List.of(first, second), ctx.getErrors());
		assertThrows(UnsupportedOperationException.class, () -> ctx.getErrors().clear());
	}

	@Test
	@DisplayName("tracks truncated and disabled collectors independently")
	public void shouldTrackFlags() {
		final DispatchContext ctx = new DispatchContext();
		ctx.markTruncated("links");
		ctx.disable("slow");

		assertTrue(ctx.isTruncated("links"));
		assertFalse(ctx.isDisabled("links"));
		assertTrue(ctx.isDisabled("slow"));
		assertFalse(ctx.isTruncated("slow"));
	}
}
