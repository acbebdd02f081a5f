package dev.jbang.harvest.error;

public class CacheRecoveryException extends CacheException {

	public CacheRecoveryException(String message) {
		super(message);
	}

	public CacheRecoveryException(String message, Throwable cause) {
		super(message, cause);
	}
}
