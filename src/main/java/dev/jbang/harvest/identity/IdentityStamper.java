package dev.jbang.harvest.identity;

import dev.jbang.harvest.error.MalformedRecordException;
import dev.jbang.harvest.model.StampedRecord;
import dev.jbang.harvest.util.HashUtils;
import java.time.Instant;
import java.util.Map;
import java.util.function.Function;

/**
 * Derives identifiers and update timestamps for the records of one connector. Stamping has no side
 * effects: the same raw record always gets the same identifier and timestamp.
 */
public class IdentityStamper {
	private static final String ID_ALGORITHM = "SHA-1";

	private final String origin;
	private final String backendName;
	private final String backendVersion;

	public IdentityStamper(String origin, String backendName, String backendVersion) {
		if (origin == null || backendName == null || backendVersion == null) {
			throw new IllegalArgumentException("origin, backend name and backend version are required");
		}
		this.origin = origin;
		this.backendName = backendName;
		this.backendVersion = backendVersion;
	}

	/**
	 * Compute the identifier of a record.
	 *
	 * @param discriminator Value that tells records of the same origin apart (an item id, a line
	 *     range, ...)
	 * @return A 40 character hex SHA-1 digest
	 * @throws IllegalArgumentException If any of the inputs is null
	 */
	public static String computeId(String origin, String backendName, String backendVersion, String discriminator) {
		return HashUtils.computeHash(ID_ALGORITHM, origin, backendName, backendVersion, discriminator);
	}

	/**
	 * Extract the update timestamp of a record.
	 *
	 * @throws MalformedRecordException If the extractor finds no value or an invalid one
	 */
	public static Instant extractTimestamp(Map<String, Object> record, TimestampExtractor extractor) {
		Instant updated;
		try {
			updated = extractor.extract(record);
		} catch (RuntimeException e) {
			throw new MalformedRecordException("Invalid update timestamp in record " + record, e);
		}
		if (updated == null) {
			throw new MalformedRecordException("Missing update timestamp in record " + record);
		}
		return updated;
	}

	/**
	 * Wrap a raw record with its identity.
	 *
	 * @param discriminator Function deriving the connector specific discriminator from the record
	 * @throws MalformedRecordException If the discriminator or the timestamp cannot be derived
	 */
	public StampedRecord stamp(
			Map<String, Object> record, Function<Map<String, Object>, String> discriminator, TimestampExtractor extractor) {
		String key = discriminator.apply(record);
		if (key == null) {
			throw new MalformedRecordException("Cannot derive an identifier for record " + record);
		}
		Instant updated = extractTimestamp(record, extractor);
		return new StampedRecord(
				backendName,
				backendVersion,
				origin,
				updated.getEpochSecond(),
				computeId(origin, backendName, backendVersion, key),
				record);
	}

	public String origin() {
		return origin;
	}

	public String backendName() {
		return backendName;
	}

	public String backendVersion() {
		return backendVersion;
	}
}
