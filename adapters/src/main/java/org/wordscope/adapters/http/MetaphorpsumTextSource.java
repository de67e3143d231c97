package org.wordscope.adapters.http;

import org.wordscope.core.error.TextSourceException;
import org.wordscope.core.port.TextSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpResponse;

/**
 * Pulls generated prose from a metaphorpsum-style endpoint that answers plain text,
 * e.g. {@code http://metaphorpsum.com/paragraphs/1/3}.
 */
public class MetaphorpsumTextSource implements TextSource {
	private static final Logger logger = LoggerFactory.getLogger(MetaphorpsumTextSource.class);

	private final HttpTextClient client;
	private final String url;

	public MetaphorpsumTextSource(HttpTextClient client, String url) {
		this.client = client;
		this.url = url;
	}

	@Override
	public String fetchPassage() throws TextSourceException {
		HttpResponse<String> response;
		try {
			response = client.get(url, "text/plain");
		} catch (IOException e) {
			throw new TextSourceException("Text source unreachable at " + url + ": " + e.getMessage(), e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TextSourceException("Interrupted while fetching text from " + url, e);
		}

		if (!HttpTextClient.isSuccess(response.statusCode())) {
			throw new TextSourceException("HTTP " + response.statusCode() + " for URL: " + url);
		}

		String body = response.body();
		if (body == null || body.isBlank()) {
			throw new TextSourceException("Text source returned an empty passage: " + url);
		}

		logger.info("Fetched passage from {} ({} chars)", url, body.length());
		return body.strip();
	}
}
