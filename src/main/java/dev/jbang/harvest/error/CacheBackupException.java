package dev.jbang.harvest.error;

public class CacheBackupException extends CacheException {

	public CacheBackupException(String message, Throwable cause) {
		super(message, cause);
	}
}
