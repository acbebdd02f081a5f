package dev.jbang.harvest.backends.stackexchange;

import static org.assertj.core.api.Assertions.*;

import com.sun.net.httpserver.HttpServer;
import dev.jbang.harvest.connector.PaginatedIterator;
import dev.jbang.harvest.error.RetrievalException;
import dev.jbang.harvest.util.HttpUtils;
import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StackExchangeClientTest {
	private static final String API_URL = "https://api.example.com";

	private DummyHttpUtils http;
	private StackExchangeClient client;

	@BeforeEach
	void setUp() {
		http = new DummyHttpUtils();
		client = new StackExchangeClient("stackoverflow", "java", "aKey", 2, API_URL, http);
	}

	@Test
	void testFetchesAllPagesInOrder() {
		// Given
		http.respond(DummyHttpUtils.page(true, 5, 5, 4))
				.respond(DummyHttpUtils.page(true, 5, 3, 2))
				.respond(DummyHttpUtils.page(false, 5, 1));

		// When
		PaginatedIterator<Map<String, Object>> questions = client.questions(null);
		List<Object> ids = new ArrayList<>();
		questions.forEachRemaining(q -> ids.add(q.get("question_id")));

		// Then
		assertThat(ids).containsExactly(5, 4, 3, 2, 1);
		assertThat(questions.requestCount()).isEqualTo(3);
		assertThat(http.requestedUrls).hasSize(3);
		assertThat(http.requestedUrls.get(0)).contains("page=1&").doesNotContain("min=");
		assertThat(http.requestedUrls.get(2)).contains("page=3&");
	}

	@Test
	void testRequestParameters() {
		// Given
		http.respond(DummyHttpUtils.page(false, 1, 1));

		// When
		client.questions(Instant.EPOCH).forEachRemaining(q -> {});

		// Then
		assertThat(http.requestedUrls)
				.containsExactly(API_URL + "/2.2/questions?page=1&pagesize=2&order=desc&sort=activity"
						+ "&tagged=java&site=stackoverflow&key=aKey&filter=Bf*y*ByQD_upZqozgU6lXL_62USGOoV3%29MFNgiHqHpmO_Y-jHR");
	}

	@Test
	void testSinceAddsLowerBound() {
		// Given
		http.respond(DummyHttpUtils.page(false, 1, 1));

		// When
		client.questions(Instant.ofEpochSecond(1_459_208_579)).forEachRemaining(q -> {});

		// Then
		assertThat(http.requestedUrls.get(0)).endsWith("&min=1459208579");
	}

	@Test
	void testBuildPayloadOmitsUnsetValues() {
		// Given
		StackExchangeClient anonymous = new StackExchangeClient("askubuntu", null, null, 100, API_URL, http);

		// When
		Map<String, Object> payload = anonymous.buildPayload(1, null);

		// Then
		assertThat(payload).containsEntry("pagesize", 100).containsEntry("site", "askubuntu");
		assertThat(payload.get("tagged")).isNull();
		assertThat(payload).doesNotContainKey("min");
	}

	@Test
	void testEmptyFirstPageStops() {
		// Given
		http.respond(DummyHttpUtils.page(true, 0));

		// When
		PaginatedIterator<Map<String, Object>> questions = client.questions(null);

		// Then
		assertThat(questions.hasNext()).isFalse();
		assertThat(questions.requestCount()).isEqualTo(1);
	}

	@Test
	void testErrorResponse() {
		// Given
		String body = "{\"error_id\":502,\"error_message\":\"too many requests from this IP\",\"error_name\":\"throttle_violation\"}";
		http.respond(DummyHttpUtils.page(true, 4, 4, 3)).fail(400, body);
		PaginatedIterator<Map<String, Object>> questions = client.questions(null);

		// When
		questions.next();
		questions.next();

		// Then
		assertThatThrownBy(questions::hasNext)
				.isInstanceOfSatisfying(RetrievalException.class, e -> assertThat(e.body()).isEqualTo(body));
		assertThat(questions.hasNext()).isFalse();
		assertThat(http.requestedUrls).hasSize(2);
	}

	@Test
	void testMalformedResponse() {
		// Given
		http.respond("{\"quota_max\":10000}");

		// Then
		assertThatThrownBy(() -> client.questions(null).hasNext())
				.isInstanceOf(RetrievalException.class)
				.hasMessageContaining("no items");
	}

	@Test
	void testGzipEncodedPagesFromServer() throws Exception {
		// Given
		HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/2.2/questions", exchange -> {
			boolean firstPage = exchange.getRequestURI().getQuery().startsWith("page=1&");
			String body = firstPage ? DummyHttpUtils.page(true, 3, 3, 2) : DummyHttpUtils.page(false, 3, 1);
			ByteArrayOutputStream compressed = new ByteArrayOutputStream();
			try (OutputStream out = new GZIPOutputStream(compressed)) {
				out.write(body.getBytes(StandardCharsets.UTF_8));
			}
			exchange.getResponseHeaders().add("Content-Encoding", "gzip");
			exchange.sendResponseHeaders(200, compressed.size());
			try (OutputStream out = exchange.getResponseBody()) {
				compressed.writeTo(out);
			}
		});
		server.start();
		try {
			StackExchangeClient remote = new StackExchangeClient(
					"stackoverflow",
					"java",
					null,
					2,
					"http://127.0.0.1:" + server.getAddress().getPort(),
					new HttpUtils());

			// When
			List<Object> ids = new ArrayList<>();
			remote.questions(null).forEachRemaining(q -> ids.add(q.get("question_id")));

			// Then
			assertThat(ids).containsExactly(3, 2, 1);
		} finally {
			server.stop(0);
		}
	}

	@Test
	void testNotJson() {
		// Given
		http.respond("<html>");

		// Then
		assertThatThrownBy(() -> client.questions(null).hasNext())
				.isInstanceOf(RetrievalException.class)
				.hasMessageContaining("Malformed response");
	}
}
