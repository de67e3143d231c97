package org.wordscope.adapters.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Thin GET wrapper over {@link HttpClient} with fixed connect and read timeouts.
 */
public class HttpTextClient {
	private static final Logger logger = LoggerFactory.getLogger(HttpTextClient.class);
	private static final String USER_AGENT = "wordscope/1.0";

	private final HttpClient httpClient;
	private final Duration readTimeout;

	public HttpTextClient(Duration connectTimeout, Duration readTimeout) {
		this.readTimeout = readTimeout;
		this.httpClient = HttpClient.newBuilder()
				.connectTimeout(connectTimeout)
				.followRedirects(HttpClient.Redirect.NORMAL)
				.build();
	}

	/**
	 * Send GET request; the caller decides which status codes are acceptable
	 */
	public HttpResponse<String> get(String url, String accept) throws IOException, InterruptedException {
		logger.debug("GET {}", url);

		HttpRequest request = HttpRequest.newBuilder()
				.uri(URI.create(url))
				.timeout(readTimeout)
				.header("Accept", accept)
				.header("User-Agent", USER_AGENT)
				.GET()
				.build();

		return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
	}

	static boolean isSuccess(int statusCode) {
		return statusCode >= 200 && statusCode < 300;
	}
}
