package dev.jbang.harvest.error;

/** Network or remote API failure. Carries the HTTP status and error body when the server sent one. */
public class RetrievalException extends HarvestException {
	private final int statusCode;
	private final String body;

	public RetrievalException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.body = null;
	}

	public RetrievalException(String url, int statusCode, String body) {
		super("Request failed: " + url + " - HTTP status: " + statusCode
				+ (body == null || body.isBlank() ? "" : " - " + body));
		this.statusCode = statusCode;
		this.body = body;
	}

	/** HTTP status of the failed response, or -1 if no response was received */
	public int statusCode() {
		return statusCode;
	}

	/** Error body returned by the server, or null */
	public String body() {
		return body;
	}
}
