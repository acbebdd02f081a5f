package dev.jbang.harvest.connector;

import dev.jbang.harvest.cache.ItemCache;
import dev.jbang.harvest.model.StampedRecord;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Turns a lazy source of raw records into the stamped records a {@link Connector} hands out.
 *
 * <p>When fetching, the cache's staging buffer is purged once before the source is opened, and every
 * record is stamped, pushed and flushed before it is returned. Remaining staged records are flushed
 * when the source is exhausted. When replaying, the cache is left untouched.
 *
 * <p>{@code hasNext() == false} means the source is exhausted. A failure is thrown from
 * {@code hasNext()} or {@code next()} and ends the iteration.
 */
public final class HarvestIterator implements Iterator<StampedRecord> {
	private final Supplier<Iterator<Map<String, Object>>> source;
	private final Function<Map<String, Object>, StampedRecord> stamper;
	private final ItemCache cache;
	private final Instant since;

	private Iterator<Map<String, Object>> records;
	private StampedRecord next;
	private boolean done;

	private HarvestIterator(
			Supplier<Iterator<Map<String, Object>>> source,
			Function<Map<String, Object>, StampedRecord> stamper,
			ItemCache cache,
			Instant since) {
		this.source = source;
		this.stamper = stamper;
		this.cache = cache;
		this.since = since;
	}

	/**
	 * Iterate over freshly fetched records, writing each one to the cache before returning it.
	 *
	 * @param source Opens the connector's retrieval; called on the first {@code hasNext()}
	 * @param since Records updated before this instant are skipped; null keeps everything
	 */
	public static HarvestIterator fetching(
			Supplier<Iterator<Map<String, Object>>> source,
			Function<Map<String, Object>, StampedRecord> stamper,
			ItemCache cache,
			Instant since) {
		return new HarvestIterator(source, stamper, cache, since);
	}

	/** Iterate over records read back from a cache */
	public static HarvestIterator replaying(
			Supplier<Iterator<Map<String, Object>>> source, Function<Map<String, Object>, StampedRecord> stamper) {
		return new HarvestIterator(source, stamper, null, null);
	}

	@Override
	public boolean hasNext() {
		if (next != null) {
			return true;
		}
		if (done) {
			return false;
		}
		try {
			return advance();
		} catch (RuntimeException e) {
			done = true;
			throw e;
		}
	}

	@Override
	public StampedRecord next() {
		if (!hasNext()) {
			throw new NoSuchElementException();
		}
		StampedRecord record = next;
		next = null;
		return record;
	}

	private boolean advance() {
		if (records == null) {
			if (cache != null) {
				cache.purgeQueue();
			}
			records = source.get();
		}
		while (records.hasNext()) {
			Map<String, Object> raw = records.next();
			StampedRecord stamped = stamper.apply(raw);
			if (since != null && stamped.updatedAt().isBefore(since)) {
				continue;
			}
			if (cache != null) {
				cache.push(raw);
				cache.flush();
			}
			next = stamped;
			return true;
		}
		done = true;
		if (cache != null) {
			cache.flush(true);
		}
		return false;
	}
}
