package dev.jbang.harvest.backends.gitblame;

import dev.jbang.harvest.identity.TimestampExtractor;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Reads the {@code committer-time} of attribution records. Abbreviated records carry no commit
 * metadata, so they get the time of the same commit seen earlier in the stream. One instance per
 * pass over the records.
 */
class BlameTimestampExtractor implements TimestampExtractor {
	static final String COMMITTER_TIME = "committer-time";

	private final TimestampExtractor committerTime = TimestampExtractor.epochSeconds(COMMITTER_TIME);
	private final Map<Object, Instant> commitTimes = new HashMap<>();

	@Override
	public Instant extract(Map<String, Object> record) {
		Instant time = committerTime.extract(record);
		Object hash = record.get(BlameOutput.HASH);
		if (time != null) {
			commitTimes.put(hash, time);
			return time;
		}
		return commitTimes.get(hash);
	}
}
