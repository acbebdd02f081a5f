package dev.jbang.harvest;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.jbang.harvest.cache.CacheConfig;
import dev.jbang.harvest.cache.FileItemCache;
import dev.jbang.harvest.cache.ItemCache;
import dev.jbang.harvest.connector.Connector;
import dev.jbang.harvest.connector.ConnectorConfig;
import dev.jbang.harvest.connector.ConnectorFactory;
import dev.jbang.harvest.error.HarvestException;
import dev.jbang.harvest.error.RetrievalException;
import dev.jbang.harvest.model.StampedRecord;
import java.io.FilterWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/** Fetch command running one connector and printing its records as JSON */
@Command(
		name = "fetch",
		description = "Fetch records from a connector and print them as JSON",
		mixinStandardHelpOptions = true)
public class FetchCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	private static final ObjectMapper mapper = new ObjectMapper()
			.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
			.enable(SerializationFeature.INDENT_OUTPUT)
			.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

	@Spec
	CommandSpec spec;

	@Parameters(index = "0", description = "Connector to run (see the list command)")
	private String connectorName;

	@Option(
			names = {"-p", "--param"},
			description = "Connector parameter, e.g. -p site=stackoverflow -p tagged=java")
	private Map<String, String> params = new LinkedHashMap<>();

	@Option(
			names = {"--from-date"},
			description = "Fetch records updated since this date (yyyy-MM-dd or ISO-8601 instant, default: all)")
	private String fromDate;

	@Option(
			names = {"--cache-path"},
			description = "Directory holding one cache per origin (default: ~/.harvest/cache)",
			defaultValue = "${sys:user.home}/.harvest/cache")
	private Path cachePath;

	@Option(
			names = {"--no-cache"},
			description = "Do not cache fetched records")
	private boolean noCache;

	@Option(
			names = {"--clean-cache"},
			description = "Remove previously cached records before fetching")
	private boolean cleanCache;

	@Option(
			names = {"--fetch-cache"},
			description = "Replay the cached records instead of fetching from the source")
	private boolean fetchCache;

	@Option(
			names = {"-o", "--output"},
			description = "File to write the records to (default: standard output)")
	private Path output;

	@Override
	public Integer call() throws Exception {
		Connector.Discovery discovery;
		Instant from;
		try {
			discovery = ConnectorFactory.discovery(connectorName);
			from = parseDate(fromDate);
		} catch (IllegalArgumentException e) {
			logger.error(e.getMessage());
			return 2;
		}

		ConnectorConfig config = new ConnectorConfig(params, null);
		Connector connector;
		try {
			connector = discovery.create(config.withCache(openCache(discovery.origin(config))));
		} catch (IllegalArgumentException | HarvestException e) {
			logger.error("Cannot start connector {}: {}", connectorName, e.getMessage());
			return 1;
		}

		long count = 0;
		try (Writer out = openOutput()) {
			Iterator<StampedRecord> records = fetchCache ? connector.fetchFromCache() : connector.fetch(from);
			while (records.hasNext()) {
				mapper.writeValue(out, records.next());
				out.write('\n');
				count++;
			}
			out.flush();
		} catch (RetrievalException e) {
			logger.error("Retrieval failed: {}", e.body() != null ? e.body() : e.getMessage());
			recover(connector);
			return 1;
		} catch (HarvestException | IOException e) {
			logger.error("Fetch failed after {} records: {}", count, e.getMessage());
			recover(connector);
			return 1;
		}

		logger.info("Fetched {} records from {} ({})", count, connector.origin(), connector.name());
		return 0;
	}

	/** Open the cache of an origin, snapshotting its content so a failed run can be rolled back */
	private ItemCache openCache(String origin) {
		if (noCache) {
			return ItemCache.none();
		}
		FileItemCache cache = new FileItemCache(new CacheConfig(cachePath.resolve(toDirectoryName(origin))));
		if (cleanCache) {
			cache.clean();
		}
		cache.backup();
		return cache;
	}

	private void recover(Connector connector) {
		if (!connector.cache().isEnabled()) {
			return;
		}
		try {
			connector.cache().recover();
		} catch (HarvestException e) {
			logger.error("Cache recovery failed: {}", e.getMessage());
		}
	}

	private Writer openOutput() throws IOException {
		if (output == null) {
			// keep the command's stream open, only the file is ours to close
			return new FilterWriter(spec.commandLine().getOut()) {
				@Override
				public void close() throws IOException {
					flush();
				}
			};
		}
		return Files.newBufferedWriter(output, StandardCharsets.UTF_8);
	}

	/** Parse a date option; no value means the beginning of time */
	static Instant parseDate(String value) {
		if (value == null || value.isBlank()) {
			return Connector.BEGINNING_OF_TIME;
		}
		try {
			return Instant.parse(value);
		} catch (DateTimeParseException e) {
			try {
				return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
			} catch (DateTimeParseException e2) {
				throw new IllegalArgumentException(
						"Invalid date: " + value + " (expected yyyy-MM-dd or an ISO-8601 instant)", e2);
			}
		}
	}

	/** Turn an origin (a site name, a URI, ...) into a single path segment */
	static String toDirectoryName(String origin) {
		return origin.replaceAll("[^A-Za-z0-9._-]", "_");
	}
}
