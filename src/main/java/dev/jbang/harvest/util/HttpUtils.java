package dev.jbang.harvest.util;

import dev.jbang.harvest.error.RetrievalException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;

/**
 * Utility class for HTTP operations. Requests are issued exactly once: failures are reported to the
 * caller and never retried here.
 */
public class HttpUtils {

	private final HttpClient httpClient;

	public HttpUtils() {
		this.httpClient = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.connectTimeout(Duration.ofSeconds(30))
				.build();
	}

	/**
	 * Download content from a URL as a string. Compressed responses ({@code gzip} or {@code deflate})
	 * are decompressed; the body is read as UTF-8.
	 *
	 * @throws RetrievalException If the server answers with a non-2xx status, carrying its body
	 * @throws IOException If the request could not be sent or the response could not be read
	 * @throws InterruptedException If the thread is interrupted while waiting for the response
	 */
	public String downloadString(String url) throws IOException, InterruptedException {
		HttpRequest request = HttpRequest.newBuilder()
				.uri(URI.create(url))
				.header("Accept", "application/json")
				.header("Accept-Encoding", "gzip, deflate")
				.GET()
				.build();
		HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
		String body;
		try (InputStream in = decode(response)) {
			body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
		if (response.statusCode() < 200 || response.statusCode() >= 300) {
			throw new RetrievalException(url, response.statusCode(), body);
		}
		return body;
	}

	private static InputStream decode(HttpResponse<InputStream> response) throws IOException {
		String encoding = response.headers()
				.firstValue("Content-Encoding")
				.map(e -> e.trim().toLowerCase(Locale.ROOT))
				.orElse("");
		return switch (encoding) {
			case "gzip", "x-gzip" -> new GZIPInputStream(response.body());
			case "deflate" -> new InflaterInputStream(response.body());
			default -> response.body();
		};
	}

	/** Append URL-encoded query parameters to a base URL, keeping the map's iteration order */
	public static String withQuery(String baseUrl, Map<String, ?> params) {
		if (params.isEmpty()) {
			return baseUrl;
		}
		String query = params.entrySet().stream()
				.filter(e -> e.getValue() != null)
				.map(e -> encode(e.getKey()) + "=" + encode(String.valueOf(e.getValue())))
				.collect(Collectors.joining("&"));
		return baseUrl + (baseUrl.contains("?") ? "&" : "?") + query;
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}
}
