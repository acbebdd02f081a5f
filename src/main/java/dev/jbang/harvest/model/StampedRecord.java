package dev.jbang.harvest.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A harvested record wrapped with the identity and watermark data added by the core. This is the
 * only shape in which records leave a connector.
 *
 * @param backendName Name of the connector that produced the record
 * @param backendVersion Version of that connector
 * @param origin The source instance (site, repository URI, ...)
 * @param updatedOn Last update of the record, in seconds since the epoch (UTC)
 * @param uuid Stable identifier of the record
 * @param data The raw record as produced by the connector
 */
@JsonPropertyOrder({"backend_name", "backend_version", "origin", "updated_on", "uuid", "data"})
public record StampedRecord(
		@JsonProperty("backend_name") String backendName,
		@JsonProperty("backend_version") String backendVersion,
		@JsonProperty("origin") String origin,
		@JsonProperty("updated_on") long updatedOn,
		@JsonProperty("uuid") String uuid,
		@JsonProperty("data") Map<String, Object> data) {

	public StampedRecord {
		data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
	}

	@JsonIgnore
	public Instant updatedAt() {
		return Instant.ofEpochSecond(updatedOn);
	}
}
