package dev.jbang.harvest.backends.gitblame;

import dev.jbang.harvest.cache.ItemCache;
import dev.jbang.harvest.connector.Connector;
import dev.jbang.harvest.connector.ConnectorConfig;
import dev.jbang.harvest.connector.HarvestIterator;
import dev.jbang.harvest.error.CacheException;
import dev.jbang.harvest.identity.IdentityStamper;
import dev.jbang.harvest.model.StampedRecord;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connector harvesting line attribution records of a git repository. The repository is cloned into,
 * or updated in, a local working copy; then every tracked file of every configured revision is
 * blamed. A record's update time is the committer time of the commit it is attributed to.
 */
public final class GitBlame implements Connector {
	private static final Logger logger = LoggerFactory.getLogger(GitBlame.class);

	public static final String NAME = "gitblame";
	public static final String VERSION = "0.1.0";
	public static final String DEFAULT_REVISION = "HEAD";

	/** Path of the blamed file; differs from {@code filename} when git followed a rename */
	static final String FILE_BLAMED = "file_blamed";

	private final String uri;
	private final Path gitPath;
	private final List<String> revisions;
	private final ItemCache cache;
	private final IdentityStamper stamper;

	public GitBlame(String uri, Path gitPath, ItemCache cache) {
		this(uri, gitPath, List.of(DEFAULT_REVISION), uri, cache);
	}

	/**
	 * @param uri URI of the repository to clone
	 * @param gitPath Location of the local working copy
	 * @param revisions Revisions to blame, in order
	 * @param origin Origin of the records; the URI when null
	 */
	public GitBlame(String uri, Path gitPath, List<String> revisions, String origin, ItemCache cache) {
		if (revisions == null || revisions.isEmpty()) {
			throw new IllegalArgumentException("At least one revision is required");
		}
		this.uri = uri;
		this.gitPath = gitPath;
		this.revisions = List.copyOf(revisions);
		this.cache = cache == null ? ItemCache.none() : cache;
		this.stamper = new IdentityStamper(origin == null ? uri : origin, NAME, VERSION);
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

	public String uri() {
		return uri;
	}

	public Path gitPath() {
		return gitPath;
	}

	@Override
	public Iterator<StampedRecord> fetch(Instant since) {
		Instant from = since == null ? BEGINNING_OF_TIME : since;
		logger.info("Looking for attributions in '{}' at {} committed from '{}'", uri, revisions, from);
		return HarvestIterator.fetching(() -> new BlameRecords(prepareRepository()), stamper(), cache, from);
	}

	@Override
	public Iterator<StampedRecord> fetchFromCache() {
		if (!cache.isEnabled()) {
			throw new CacheException("cache instance was not provided");
		}
		return HarvestIterator.replaying(cache::retrieve, stamper());
	}

	/** Update the existing working copy, or clone a new one */
	GitRepository prepareRepository() {
		if (Files.exists(gitPath.resolve(".git"))) {
			GitRepository repository = GitRepository.open(uri, gitPath);
			repository.pull();
			return repository;
		}
		return GitRepository.clone(uri, gitPath);
	}

	// a new extractor per pass, since it remembers commit times of the records it has seen
	private Function<Map<String, Object>, StampedRecord> stamper() {
		BlameTimestampExtractor updateTime = new BlameTimestampExtractor();
		return record -> stamper.stamp(record, GitBlame::discriminator, updateTime);
	}

	private static String discriminator(Map<String, Object> record) {
		Object hash = record.get(BlameOutput.HASH);
		Object filename = record.get(BlameOutput.FILENAME);
		Object line = record.get(BlameOutput.THIS_LINE);
		if (hash == null || filename == null || line == null) {
			return null;
		}
		return hash + ":" + filename + ":" + line;
	}

	/** Blames the tracked files of each revision in turn, one file per step */
	private final class BlameRecords implements Iterator<Map<String, Object>> {
		private final GitRepository repository;
		private final Iterator<String> pendingRevisions = revisions.iterator();
		private Iterator<String> files = Collections.emptyIterator();
		private Iterator<Map<String, String>> batch = Collections.emptyIterator();
		private String blamed;

		BlameRecords(GitRepository repository) {
			this.repository = repository;
		}

		@Override
		public boolean hasNext() {
			while (!batch.hasNext()) {
				if (files.hasNext()) {
					blamed = files.next();
					batch = new BlameOutput(repository.blame(blamed)).analyze().iterator();
				} else if (pendingRevisions.hasNext()) {
					String revision = pendingRevisions.next();
					repository.checkout(revision);
					List<String> tracked = repository.trackedFiles();
					logger.info("Blaming {} files at revision {} ({})", tracked.size(), revision, repository.head());
					files = tracked.iterator();
				} else {
					return false;
				}
			}
			return true;
		}

		@Override
		public Map<String, Object> next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			Map<String, Object> record = new LinkedHashMap<>(batch.next());
			record.put(FILE_BLAMED, blamed);
			return record;
		}
	}

	/** Discovery implementation for ServiceLoader */
	public static class Discovery implements Connector.Discovery {
		@Override
		public String name() {
			return NAME;
		}

		@Override
		public String description() {
			return "Line attributions of a git repository (parameters: uri, git-path, revisions, origin)";
		}

		@Override
		public String origin(ConnectorConfig config) {
			return config.get("origin", config.require("uri"));
		}

		@Override
		public Connector create(ConnectorConfig config) {
			List<String> revisions = Arrays.stream(
							config.get("revisions", DEFAULT_REVISION).split(","))
					.map(String::trim)
					.filter(r -> !r.isEmpty())
					.toList();
			return new GitBlame(
					config.require("uri"),
					Path.of(config.require("git-path")),
					revisions,
					origin(config),
					config.cache());
		}
	}
}
