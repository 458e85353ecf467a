package io.github.unitable;

/**
 * Thrown when a table would have to grow past its maximum capacity.
 * The table is left unchanged.
 */
public class CapacityOverflowException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	private final int maximumCapacity;

	public CapacityOverflowException(int maximumCapacity) {
		super("cannot grow beyond maximum capacity " + maximumCapacity);
		this.maximumCapacity = maximumCapacity;
	}

	public int maximumCapacity() {
		return maximumCapacity;
	}
}
