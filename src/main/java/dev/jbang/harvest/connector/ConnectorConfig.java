package dev.jbang.harvest.connector;

import dev.jbang.harvest.cache.ItemCache;
import java.util.Map;

/**
 * Configuration handed to a {@link Connector.Discovery}.
 *
 * @param parameters Connector specific settings, e.g. {@code site} or {@code uri}
 * @param cache The cache the connector writes to
 */
public record ConnectorConfig(Map<String, String> parameters, ItemCache cache) {

	public ConnectorConfig {
		parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
		cache = cache == null ? ItemCache.none() : cache;
	}

	public ConnectorConfig withCache(ItemCache cache) {
		return new ConnectorConfig(parameters, cache);
	}

	/** Get a parameter, or the default value when it is not set */
	public String get(String name, String defaultValue) {
		String value = parameters.get(name);
		return value == null || value.isBlank() ? defaultValue : value;
	}

	/** Get a parameter that must be set */
	public String require(String name) {
		String value = get(name, null);
		if (value == null) {
			throw new IllegalArgumentException("Missing required parameter: " + name);
		}
		return value;
	}

	public int getInt(String name, int defaultValue) {
		String value = get(name, null);
		if (value == null) {
			return defaultValue;
		}
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Parameter " + name + " must be a number, got: " + value, e);
		}
	}
}
