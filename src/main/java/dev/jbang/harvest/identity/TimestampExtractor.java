package dev.jbang.harvest.identity;

import java.time.Instant;
import java.util.Map;

/** Extracts the moment a record was last updated. Used as the watermark of incremental fetches. */
@FunctionalInterface
public interface TimestampExtractor {

	/**
	 * @return The update instant, or null if the record does not carry one
	 * @throws RuntimeException If the record carries an invalid value
	 */
	Instant extract(Map<String, Object> record);

	/** Extractor reading a field holding seconds since the epoch, as a number or a numeric string */
	static TimestampExtractor epochSeconds(String field) {
		return record -> {
			Object value = record.get(field);
			if (value == null) {
				return null;
			}
			if (value instanceof Number number) {
				return Instant.ofEpochSecond(number.longValue());
			}
			return Instant.ofEpochSecond(Long.parseLong(value.toString().trim()));
		};
	}
}
