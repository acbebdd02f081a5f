package dev.jbang.harvest.error;

/**
 * Base class of every failure raised by the harvesting core. Failures are unchecked so they can be
 * thrown while a caller advances a lazy record iterator.
 */
public class HarvestException extends RuntimeException {

	public HarvestException(String message) {
		super(message);
	}

	public HarvestException(String message, Throwable cause) {
		super(message, cause);
	}
}
