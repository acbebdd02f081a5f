package dev.jbang.harvest.backends.stackexchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jbang.harvest.connector.Connector;
import dev.jbang.harvest.connector.PaginatedIterator;
import dev.jbang.harvest.error.RetrievalException;
import dev.jbang.harvest.util.HttpUtils;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the questions endpoint of the StackExchange API. Questions are returned most recently
 * active first, one page per request.
 */
public class StackExchangeClient {
	private static final Logger logger = LoggerFactory.getLogger(StackExchangeClient.class);

	public static final String STACKEXCHANGE_API_URL = "https://api.stackexchange.com";
	public static final String VERSION_API = "2.2";
	public static final int MAX_QUESTIONS = 100;

	// Filters are immutable and non-expiring. This one selects every field of a question,
	// including its answers and comments.
	static final String QUESTIONS_FILTER = "Bf*y*ByQD_upZqozgU6lXL_62USGOoV3)MFNgiHqHpmO_Y-jHR";

	private static final TypeReference<LinkedHashMap<String, Object>> RECORD_TYPE = new TypeReference<>() {};
	private static final ObjectMapper mapper = new ObjectMapper();

	private final String site;
	private final String tagged;
	private final String token;
	private final int maxQuestions;
	private final String apiUrl;
	private final HttpUtils httpUtils;

	public StackExchangeClient(String site, String tagged, String token, int maxQuestions) {
		this(site, tagged, token, maxQuestions, STACKEXCHANGE_API_URL, new HttpUtils());
	}

	public StackExchangeClient(
			String site, String tagged, String token, int maxQuestions, String apiUrl, HttpUtils httpUtils) {
		this.site = site;
		this.tagged = tagged;
		this.token = token;
		this.maxQuestions = maxQuestions;
		this.apiUrl = apiUrl;
		this.httpUtils = httpUtils;
	}

	public String site() {
		return site;
	}

	public String tagged() {
		return tagged;
	}

	/**
	 * Iterate over the questions updated since the given instant. Pages are requested while the
	 * iterator is consumed.
	 *
	 * @param since Lower bound of the last activity; null or the epoch means no bound
	 */
	public PaginatedIterator<Map<String, Object>> questions(Instant since) {
		return new PaginatedIterator<>() {
			private long fetched = 0;

			@Override
			protected Page<Map<String, Object>> fetchPage(int pageNumber) {
				String url = HttpUtils.withQuery(questionsUrl(), buildPayload(pageNumber, since));
				JsonNode response = request(url);

				JsonNode items = response.get("items");
				if (items == null || !items.isArray()) {
					throw new RetrievalException("Malformed response from " + questionsUrl() + ": no items", null);
				}
				List<Map<String, Object>> questions = new ArrayList<>(items.size());
				for (JsonNode item : items) {
					questions.add(mapper.convertValue(item, RECORD_TYPE));
				}

				int pageSize = response.path("page_size").asInt();
				int total = response.path("total").asInt();
				fetched += Math.min(pageSize, total);
				logStatus(
						response.path("quota_remaining").asInt(),
						response.path("quota_max").asInt(),
						fetched,
						total);

				return new Page<>(questions, response.path("has_more").asBoolean(false));
			}
		};
	}

	String questionsUrl() {
		return apiUrl + "/" + VERSION_API + "/questions";
	}

	/** Query parameters of one page request */
	Map<String, Object> buildPayload(int page, Instant since) {
		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("page", page);
		payload.put("pagesize", maxQuestions);
		payload.put("order", "desc");
		payload.put("sort", "activity");
		payload.put("tagged", tagged);
		payload.put("site", site);
		payload.put("key", token);
		payload.put("filter", QUESTIONS_FILTER);
		if (since != null && since.isAfter(Connector.BEGINNING_OF_TIME)) {
			payload.put("min", since.getEpochSecond());
		}
		return payload;
	}

	private JsonNode request(String url) {
		logger.debug("Fetching {}", url);
		String body;
		try {
			body = httpUtils.downloadString(url);
		} catch (IOException e) {
			throw new RetrievalException("Failed to fetch " + questionsUrl() + ": " + e.getMessage(), e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RetrievalException("Interrupted while fetching " + questionsUrl(), e);
		}
		try {
			return mapper.readTree(body);
		} catch (JsonProcessingException e) {
			throw new RetrievalException("Malformed response from " + questionsUrl(), e);
		}
	}

	private void logStatus(int quotaRemaining, int quotaMax, long fetched, int total) {
		logger.info("Rate limit: {}/{}", quotaRemaining, quotaMax);
		if (total != 0) {
			logger.info("Fetching questions: {}/{}", fetched, total);
		} else {
			logger.info("No questions were found.");
		}
	}
}
