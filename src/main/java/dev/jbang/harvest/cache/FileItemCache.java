package dev.jbang.harvest.cache;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jbang.harvest.error.CacheBackupException;
import dev.jbang.harvest.error.CacheException;
import dev.jbang.harvest.error.CacheRecoveryException;
import dev.jbang.harvest.util.FileUtils;
import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cache backed by a JSON Lines append log in a directory of its own.
 *
 * <pre>
 * directory/
 *   items.jsonl          durable log, one record per line, in fetch order
 *   backup/items.jsonl   snapshot taken by backup()
 * </pre>
 */
public class FileItemCache implements ItemCache {
	private static final Logger logger = LoggerFactory.getLogger(FileItemCache.class);

	static final String LOG_FILE = "items.jsonl";
	static final String BACKUP_DIR = "backup";
	static final int READ_CHUNK_LINES = 1000;

	private static final TypeReference<LinkedHashMap<String, Object>> RECORD_TYPE = new TypeReference<>() {};

	private static final ObjectMapper mapper =
			new ObjectMapper().configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);

	private final CacheConfig config;
	private final Path logFile;
	private final Path backupDir;
	private final Path backupFile;
	private final List<Map<String, Object>> staged = new ArrayList<>();

	/**
	 * Create a cache in the configured directory, creating the directory if needed.
	 *
	 * @throws CacheException If the directory cannot be created or is not writable
	 */
	public FileItemCache(CacheConfig config) {
		this.config = config;
		Path directory = config.directory();
		try {
			FileUtils.ensureDirectory(directory);
		} catch (IOException e) {
			throw new CacheException("Cannot create cache directory " + directory, e);
		}
		if (!Files.isDirectory(directory) || !Files.isWritable(directory)) {
			throw new CacheException("Cache directory " + directory + " is not a writable directory");
		}
		this.logFile = directory.resolve(LOG_FILE);
		this.backupDir = directory.resolve(BACKUP_DIR);
		this.backupFile = backupDir.resolve(LOG_FILE);
	}

	public FileItemCache(Path directory) {
		this(new CacheConfig(directory));
	}

	public Path directory() {
		return config.directory();
	}

	/** Number of records pushed but not yet flushed */
	public int stagedCount() {
		return staged.size();
	}

	@Override
	public void push(Map<String, Object> record) {
		staged.add(record);
	}

	@Override
	public void flush(boolean force) {
		if (staged.isEmpty() || (!force && staged.size() < config.flushThreshold())) {
			return;
		}

		ByteArrayOutputStream buffer = new ByteArrayOutputStream();
		try {
			for (Map<String, Object> record : staged) {
				buffer.write(mapper.writeValueAsBytes(record));
				buffer.write('\n');
			}
		} catch (IOException e) {
			throw new CacheException("Cannot serialize staged records", e);
		}

		try (FileChannel channel = FileChannel.open(
				logFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
			long sizeBefore = channel.size();
			try {
				ByteBuffer bytes = ByteBuffer.wrap(buffer.toByteArray());
				while (bytes.hasRemaining()) {
					channel.write(bytes);
				}
				channel.force(false);
			} catch (IOException e) {
				// roll back to the last complete entry
				try {
					channel.truncate(sizeBefore);
				} catch (IOException truncateError) {
					e.addSuppressed(truncateError);
				}
				throw e;
			}
		} catch (IOException e) {
			throw new CacheException("Failed to write " + staged.size() + " records to " + logFile, e);
		}

		logger.trace("Flushed {} records to {}", staged.size(), logFile);
		staged.clear();
	}

	@Override
	public void purgeQueue() {
		if (!staged.isEmpty()) {
			logger.debug("Purging {} staged records", staged.size());
		}
		staged.clear();
	}

	@Override
	public void backup() {
		try {
			if (Files.exists(logFile)) {
				FileUtils.copyReplacing(logFile, backupFile);
			} else {
				FileUtils.ensureDirectory(backupDir);
				Files.write(backupFile, new byte[0]);
			}
			logger.info("Cache backed up to {}", backupFile);
		} catch (IOException e) {
			throw new CacheBackupException("Cannot back up cache to " + backupFile, e);
		}
	}

	@Override
	public void clean() {
		try {
			Files.deleteIfExists(logFile);
			FileUtils.deleteDirectory(backupDir);
			logger.info("Cache {} cleaned", config.directory());
		} catch (IOException e) {
			throw new CacheException("Cannot clean cache " + config.directory(), e);
		}
	}

	@Override
	public void recover() {
		if (!Files.exists(backupFile)) {
			throw new CacheRecoveryException("No backup found in " + config.directory());
		}
		try {
			FileUtils.copyReplacing(backupFile, logFile);
		} catch (IOException e) {
			throw new CacheRecoveryException("Cannot restore cache from " + backupFile, e);
		}
		staged.clear();
		logger.info("Cache {} recovered from backup", config.directory());
	}

	@Override
	public Iterator<Map<String, Object>> retrieve() {
		return new LogIterator();
	}

	@Override
	public String toString() {
		return "FileItemCache[" + config.directory() + "]";
	}

	/**
	 * Lazily reads the log, one line per record. Lines are read in chunks of {@link #READ_CHUNK_LINES};
	 * the file is open only while a chunk is read, so an abandoned iteration holds no file handle.
	 */
	private final class LogIterator implements Iterator<Map<String, Object>> {
		private final Deque<String> lines = new ArrayDeque<>();
		private long offset;
		private boolean endOfFile;
		private Map<String, Object> next;
		private boolean done;
		private int lineNumber;

		@Override
		public boolean hasNext() {
			if (next != null) {
				return true;
			}
			if (done) {
				return false;
			}
			advance();
			return next != null;
		}

		@Override
		public Map<String, Object> next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			Map<String, Object> record = next;
			next = null;
			return record;
		}

		private void advance() {
			try {
				String line = nextLine();
				if (line == null) {
					done = true;
					return;
				}
				int entryLine = lineNumber;
				try {
					next = mapper.readValue(line, RECORD_TYPE);
				} catch (JsonProcessingException e) {
					done = true;
					if (nextLine() == null) {
						// a crash while appending can leave a torn last entry
						logger.warn("Ignoring incomplete entry at line {} of {}", entryLine, logFile);
						return;
					}
					throw new CacheException("Corrupted entry at line " + entryLine + " of " + logFile, e);
				}
			} catch (IOException e) {
				done = true;
				throw new CacheException("Cannot read cache " + logFile, e);
			}
		}

		/** The next non-blank line, or null at the end of the log */
		private String nextLine() throws IOException {
			while (true) {
				if (lines.isEmpty()) {
					if (endOfFile) {
						return null;
					}
					readChunk();
					continue;
				}
				String line = lines.poll();
				lineNumber++;
				if (!line.isBlank()) {
					return line;
				}
			}
		}

		private void readChunk() throws IOException {
			if (!Files.exists(logFile)) {
				endOfFile = true;
				return;
			}
			try (FileChannel channel = FileChannel.open(logFile, StandardOpenOption.READ)) {
				channel.position(offset);
				InputStream in = new BufferedInputStream(Channels.newInputStream(channel));
				ByteArrayOutputStream line = new ByteArrayOutputStream();
				int b;
				while (lines.size() < READ_CHUNK_LINES && (b = in.read()) != -1) {
					if (b == '\n') {
						offset += line.size() + 1;
						lines.add(line.toString(StandardCharsets.UTF_8));
						line.reset();
					} else {
						line.write(b);
					}
				}
				if (lines.size() < READ_CHUNK_LINES) {
					// an unterminated last line is handed out as is
					if (line.size() > 0) {
						offset += line.size();
						lines.add(line.toString(StandardCharsets.UTF_8));
					}
					endOfFile = true;
				}
			}
		}
	}
}
