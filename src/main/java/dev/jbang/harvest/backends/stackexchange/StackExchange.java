package dev.jbang.harvest.backends.stackexchange;

import dev.jbang.harvest.cache.ItemCache;
import dev.jbang.harvest.connector.Connector;
import dev.jbang.harvest.connector.ConnectorConfig;
import dev.jbang.harvest.connector.HarvestIterator;
import dev.jbang.harvest.error.CacheException;
import dev.jbang.harvest.identity.IdentityStamper;
import dev.jbang.harvest.identity.TimestampExtractor;
import dev.jbang.harvest.model.StampedRecord;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Connector harvesting the questions of a StackExchange site, filtered by tag. */
public final class StackExchange implements Connector {
	private static final Logger logger = LoggerFactory.getLogger(StackExchange.class);

	public static final String NAME = "stackexchange";
	public static final String VERSION = "0.1.0";

	static final TimestampExtractor UPDATE_TIME = TimestampExtractor.epochSeconds("last_activity_date");

	private final StackExchangeClient client;
	private final ItemCache cache;
	private final IdentityStamper stamper;

	public StackExchange(String site, String tagged, String token, int maxQuestions, ItemCache cache) {
		this(new StackExchangeClient(site, tagged, token, maxQuestions), cache);
	}

	public StackExchange(StackExchangeClient client, ItemCache cache) {
		this.client = client;
		this.cache = cache == null ? ItemCache.none() : cache;
		this.stamper = new IdentityStamper(client.site(), NAME, VERSION);
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

	@Override
	public Iterator<StampedRecord> fetch(Instant since) {
		Instant from = since == null ? BEGINNING_OF_TIME : since;
		logger.info(
				"Looking for questions at site '{}', with tag '{}' and updated from '{}'",
				client.site(),
				client.tagged(),
				from);
		return HarvestIterator.fetching(() -> client.questions(from), this::stamp, cache, from);
	}

	@Override
	public Iterator<StampedRecord> fetchFromCache() {
		if (!cache.isEnabled()) {
			throw new CacheException("cache instance was not provided");
		}
		return HarvestIterator.replaying(cache::retrieve, this::stamp);
	}

	private StampedRecord stamp(Map<String, Object> question) {
		return stamper.stamp(question, q -> Objects.toString(q.get("question_id"), null), UPDATE_TIME);
	}

	/** Discovery implementation for ServiceLoader */
	public static class Discovery implements Connector.Discovery {
		@Override
		public String name() {
			return NAME;
		}

		@Override
		public String description() {
			return "Questions of a StackExchange site (parameters: site, tagged, token, max-questions)";
		}

		@Override
		public String origin(ConnectorConfig config) {
			return config.require("site");
		}

		@Override
		public Connector create(ConnectorConfig config) {
			return new StackExchange(
					config.require("site"),
					config.get("tagged", null),
					config.get("token", null),
					config.getInt("max-questions", StackExchangeClient.MAX_QUESTIONS),
					config.cache());
		}
	}
}
