package dev.jbang.harvest.connector;

import dev.jbang.harvest.cache.ItemCache;
import dev.jbang.harvest.error.CacheException;
import dev.jbang.harvest.error.RetrievalException;
import dev.jbang.harvest.identity.IdentityStamper;
import dev.jbang.harvest.identity.TimestampExtractor;
import dev.jbang.harvest.model.StampedRecord;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/** Connector serving a fixed list of records, optionally failing part way through */
public class DummyConnector implements Connector {
	public static final String NAME = "dummy";
	public static final String VERSION = "1.0";

	private final List<Map<String, Object>> records;
	private final int failAfter;
	private final ItemCache cache;
	private final IdentityStamper stamper;
	private int sourceOpened;

	/**
	 * @param failAfter Number of records served before the source fails, or -1 to never fail
	 */
	public DummyConnector(String origin, List<Map<String, Object>> records, int failAfter, ItemCache cache) {
		this.records = records;
		this.failAfter = failAfter;
		this.cache = cache == null ? ItemCache.none() : cache;
		this.stamper = new IdentityStamper(origin, NAME, VERSION);
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public String version() {
		return VERSION;
	}

	@Override
	public String origin() {
		return stamper.origin();
	}

	@Override
	public ItemCache cache() {
		return cache;
	}

	/** How many times the source was opened */
	public int sourceOpened() {
		return sourceOpened;
	}

	@Override
	public Iterator<StampedRecord> fetch(Instant since) {
		return HarvestIterator.fetching(this::open, this::stamp, cache, since);
	}

	@Override
	public Iterator<StampedRecord> fetchFromCache() {
		if (!cache.isEnabled()) {
			throw new CacheException("cache instance was not provided");
		}
		return HarvestIterator.replaying(cache::retrieve, this::stamp);
	}

	private Iterator<Map<String, Object>> open() {
		sourceOpened++;
		Iterator<Map<String, Object>> it = records.iterator();
		return new Iterator<>() {
			private int served;

			@Override
			public boolean hasNext() {
				if (failAfter >= 0 && served >= failAfter) {
					throw new RetrievalException("https://example.com/items", 500, "{\"error\":\"boom\"}");
				}
				return it.hasNext();
			}

			@Override
			public Map<String, Object> next() {
				if (!hasNext()) {
					throw new NoSuchElementException();
				}
				served++;
				return it.next();
			}
		};
	}

	private StampedRecord stamp(Map<String, Object> record) {
		return stamper.stamp(
				record, r -> Objects.toString(r.get("id"), null), TimestampExtractor.epochSeconds("updated"));
	}

	public static List<Map<String, Object>> records(int count) {
		List<Map<String, Object>> records = new ArrayList<>();
		for (int i = 1; i <= count; i++) {
			Map<String, Object> record = new LinkedHashMap<>();
			record.put("id", i);
			record.put("updated", 1_000 * i);
			record.put("title", "Item " + i);
			records.add(record);
		}
		return records;
	}

	/** Discovery implementation for ServiceLoader */
	public static class Discovery implements Connector.Discovery {
		@Override
		public String name() {
			return NAME;
		}

		@Override
		public String description() {
			return "Dummy connector for testing";
		}

		@Override
		public String origin(ConnectorConfig config) {
			return config.get("origin", "dummy-origin");
		}

		@Override
		public Connector create(ConnectorConfig config) {
			return new DummyConnector(
					origin(config),
					records(config.getInt("count", 3)),
					config.getInt("fail-after", -1),
					config.cache());
		}
	}
}
