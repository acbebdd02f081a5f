package dev.jbang.harvest.cache;

import java.nio.file.Path;

/**
 * Configuration of a {@link FileItemCache}.
 *
 * @param directory Directory holding the durable log and its backup, one per connector origin
 * @param flushThreshold Number of staged records that makes {@link ItemCache#flush()} write them out
 */
public record CacheConfig(Path directory, int flushThreshold) {
	public static final int DEFAULT_FLUSH_THRESHOLD = 1;

	public CacheConfig {
		if (directory == null) {
			throw new IllegalArgumentException("Cache directory is required");
		}
		if (flushThreshold < 1) {
			throw new IllegalArgumentException("Flush threshold must be at least 1, got " + flushThreshold);
		}
	}

	public CacheConfig(Path directory) {
		this(directory, DEFAULT_FLUSH_THRESHOLD);
	}
}
