package dev.jbang.harvest.connector;

import dev.jbang.harvest.cache.ItemCache;
import dev.jbang.harvest.model.StampedRecord;
import java.time.Instant;
import java.util.Iterator;

/**
 * A source of harvested records. Implementations fetch raw records from one external source, stamp
 * them with their identity and keep them in the connector's {@link ItemCache} before handing them
 * to the caller.
 */
public interface Connector {

	/** The lower bound meaning "fetch everything" */
	Instant BEGINNING_OF_TIME = Instant.EPOCH;

	/** Name of the connector implementation, e.g. "stackexchange" */
	String name();

	/** Version of the connector implementation, part of every record identifier */
	String version();

	/** The source instance this connector reads from */
	String origin();

	/** The cache records are written to; {@link ItemCache#none()} when caching is disabled */
	ItemCache cache();

	/**
	 * Fetch the records updated at or after {@code since}.
	 *
	 * <p>The returned iterator is lazy and single use. Each record is written to the cache before it
	 * is returned, so records already returned survive a failure or an abandoned iteration. Failures
	 * are thrown from {@code hasNext()} or {@code next()} as {@link dev.jbang.harvest.error.HarvestException}s.
	 *
	 * @param since Lower bound of the update timestamps; null means {@link #BEGINNING_OF_TIME}
	 */
	Iterator<StampedRecord> fetch(Instant since);

	default Iterator<StampedRecord> fetch() {
		return fetch(BEGINNING_OF_TIME);
	}

	/**
	 * Replay the records stored in the cache, in their original order. Never touches the source.
	 *
	 * @throws dev.jbang.harvest.error.CacheException If the connector has no cache
	 */
	Iterator<StampedRecord> fetchFromCache();

	/** Factory interface for connector discovery */
	interface Discovery {
		String name();

		String description();

		/** The origin a connector created from these parameters would have */
		String origin(ConnectorConfig config);

		Connector create(ConnectorConfig config);
	}
}
