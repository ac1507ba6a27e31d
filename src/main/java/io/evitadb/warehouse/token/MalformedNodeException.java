package io.evitadb.warehouse.token;

import javax.annotation.Nonnull;

/**
 * Exception thrown when a node cannot be turned into a {@link TokenView} at all.
 * Unreadable or out-of-range fields never cause this exception; they are defaulted or clamped instead.
 */
public final class MalformedNodeException extends RuntimeException {

	private final int position;

	/**
	 * Creates a new MalformedNodeException.
	 *
	 * @param message  description of the problem
	 * @param position position of the node in the raw stream
	 */
	public MalformedNodeException(@Nonnull String message, int position) {
		super(message + " (node #" + position + ")");
		this.position = position;
	}

	/**
	 * Returns the position of the offending node in the raw stream.
	 *
	 * @return zero-based node position
	 */
	public int getPosition() {
		return this.position;
	}
}
