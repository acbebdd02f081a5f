package dev.jbang.harvest.error;

/** The item cache is missing or unusable. */
public class CacheException extends HarvestException {

	public CacheException(String message) {
		super(message);
	}

	public CacheException(String message, Throwable cause) {
		super(message, cause);
	}
}
