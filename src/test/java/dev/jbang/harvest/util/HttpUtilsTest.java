package dev.jbang.harvest.util;

import static org.assertj.core.api.Assertions.*;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import dev.jbang.harvest.error.RetrievalException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPOutputStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpUtilsTest {

	private HttpServer server;
	private String baseUrl;

	@BeforeEach
	void setUp() throws Exception {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/ok", exchange -> respond(exchange, 200, "{\"items\":[]}"));
		server.createContext("/throttled", exchange -> respond(exchange, 400, "{\"error_id\":502}"));
		server.createContext("/gzip", exchange -> respondCompressed(exchange, 200, "gzip", "{\"items\":[1]}"));
		server.createContext("/deflate", exchange -> respondCompressed(exchange, 200, "deflate", "{\"items\":[2]}"));
		server.createContext(
				"/gzip-throttled", exchange -> respondCompressed(exchange, 400, "gzip", "{\"error_id\":502}"));
		server.start();
		baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
	}

	@AfterEach
	void tearDown() {
		server.stop(0);
	}

	@Test
	void testDownloadString() throws Exception {
		assertThat(new HttpUtils().downloadString(baseUrl + "/ok")).isEqualTo("{\"items\":[]}");
	}

	@Test
	void testErrorStatusCarriesBody() {
		assertThatThrownBy(() -> new HttpUtils().downloadString(baseUrl + "/throttled"))
				.isInstanceOfSatisfying(RetrievalException.class, e -> {
					assertThat(e.statusCode()).isEqualTo(400);
					assertThat(e.body()).isEqualTo("{\"error_id\":502}");
				});
	}

	@Test
	void testGzipBodyIsDecompressed() throws Exception {
		assertThat(new HttpUtils().downloadString(baseUrl + "/gzip")).isEqualTo("{\"items\":[1]}");
	}

	@Test
	void testDeflateBodyIsDecompressed() throws Exception {
		assertThat(new HttpUtils().downloadString(baseUrl + "/deflate")).isEqualTo("{\"items\":[2]}");
	}

	@Test
	void testCompressedErrorBodyIsDecompressed() {
		assertThatThrownBy(() -> new HttpUtils().downloadString(baseUrl + "/gzip-throttled"))
				.isInstanceOfSatisfying(
						RetrievalException.class, e -> assertThat(e.body()).isEqualTo("{\"error_id\":502}"));
	}

	@Test
	void testWithQueryEncodesAndKeepsOrder() {
		// Given
		Map<String, Object> params = new LinkedHashMap<>();
		params.put("page", 2);
		params.put("tagged", "c#;java");
		params.put("key", null);
		params.put("filter", "a)b*c");

		// When
		String url = HttpUtils.withQuery("https://api.example.com/questions", params);

		// Then
		assertThat(url).isEqualTo("https://api.example.com/questions?page=2&tagged=c%23%3Bjava&filter=a%29b*c");
	}

	@Test
	void testWithQueryAppendsToExistingQuery() {
		assertThat(HttpUtils.withQuery("https://example.com/x?a=1", Map.of("b", "2")))
				.isEqualTo("https://example.com/x?a=1&b=2");
		assertThat(HttpUtils.withQuery("https://example.com/x", Map.of())).isEqualTo("https://example.com/x");
	}

	static void respondCompressed(HttpExchange exchange, int status, String encoding, String body)
			throws IOException {
		ByteArrayOutputStream compressed = new ByteArrayOutputStream();
		try (OutputStream out = "gzip".equals(encoding)
				? new GZIPOutputStream(compressed)
				: new DeflaterOutputStream(compressed)) {
			out.write(body.getBytes(StandardCharsets.UTF_8));
		}
		byte[] bytes = compressed.toByteArray();
		exchange.getResponseHeaders().add("Content-Encoding", encoding);
		exchange.sendResponseHeaders(status, bytes.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(bytes);
		}
	}

	private static void respond(HttpExchange exchange, int status, String body)
			throws IOException {
		byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
		exchange.sendResponseHeaders(status, bytes.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(bytes);
		}
	}
}
