package io.github.unitable;

/**
 * Thrown when the bucket arrays for a resize cannot be allocated.
 * The table keeps its previous arrays and every entry in them.
 */
public class TableAllocationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int requestedCapacity;

	public TableAllocationException(int requestedCapacity, Throwable cause) {
		super("failed to allocate " + requestedCapacity + " slots", cause);
		this.requestedCapacity = requestedCapacity;
	}

	public int requestedCapacity() {
		return requestedCapacity;
	}
}
