package dev.jbang.harvest.cache;

import java.util.Iterator;
import java.util.Map;

/**
 * Write-ahead cache of raw records. Records are first staged in memory by {@link #push(Map)} and
 * then appended to durable storage by {@link #flush()}. A cache instance is not thread safe and must
 * be used by one fetch at a time.
 */
public interface ItemCache {

	/** Stage a record. Never performs I/O. */
	void push(Map<String, Object> record);

	/** Write the staged records if the staging buffer is full */
	default void flush() {
		flush(false);
	}

	/**
	 * Append the staged records to durable storage, in order, and clear the staging buffer.
	 *
	 * @param force Write even if the staging buffer has not reached its threshold
	 * @throws dev.jbang.harvest.error.CacheException If the write fails. Entries are either fully
	 *     durable or not durable at all, and the staged records are kept.
	 */
	void flush(boolean force);

	/** Drop the staged records without writing them */
	void purgeQueue();

	/**
	 * Snapshot the current durable content.
	 *
	 * @throws dev.jbang.harvest.error.CacheBackupException If the snapshot cannot be written
	 */
	void backup();

	/** Delete the durable content and any backup. Does nothing if there is nothing to delete. */
	void clean();

	/**
	 * Restore the durable content of the last {@link #backup()}, discarding everything written since.
	 *
	 * @throws dev.jbang.harvest.error.CacheRecoveryException If there is no backup
	 */
	void recover();

	/**
	 * Read the durable records in the order they were appended. Every call starts from the
	 * beginning; reading never modifies the cache.
	 */
	Iterator<Map<String, Object>> retrieve();

	/** Whether this cache actually stores anything */
	default boolean isEnabled() {
		return true;
	}

	/** A cache that stores nothing, for connectors running without caching */
	static ItemCache none() {
		return NoOpItemCache.INSTANCE;
	}
}
