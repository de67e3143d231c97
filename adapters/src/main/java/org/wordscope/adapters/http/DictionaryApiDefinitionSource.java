package org.wordscope.adapters.http;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.wordscope.core.error.DefinitionException;
import org.wordscope.core.port.DefinitionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Definitions from a dictionaryapi.dev compatible service.
 *
 * <p>The service answers {@code 404} for unknown words and otherwise a JSON array of entries; the
 * first sense of the first meaning of the first entry is used.</p>
 */
public class DictionaryApiDefinitionSource implements DefinitionSource {
	private static final Logger logger = LoggerFactory.getLogger(DictionaryApiDefinitionSource.class);

	private final HttpTextClient client;
	private final String baseUrl;

	/**
	 * @param baseUrl entries endpoint, e.g. {@code https://api.dictionaryapi.dev/api/v2/entries/en}
	 */
	public DictionaryApiDefinitionSource(HttpTextClient client, String baseUrl) {
		this.client = client;
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
	}

	@Override
	public Optional<String> lookup(String word) throws DefinitionException {
		String url = baseUrl + "/" + URLEncoder.encode(word, StandardCharsets.UTF_8);

		HttpResponse<String> response;
		try {
			response = client.get(url, "application/json");
		} catch (IOException e) {
			throw new DefinitionException("Definition source unreachable for '" + word + "': " + e.getMessage(), e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new DefinitionException("Interrupted while looking up '" + word + "'", e);
		}

		if (response.statusCode() == 404) {
			logger.debug("No definition known for '{}'", word);
			return Optional.empty();
		}
		if (!HttpTextClient.isSuccess(response.statusCode())) {
			throw new DefinitionException("HTTP " + response.statusCode() + " for URL: " + url);
		}

		return parseFirstDefinition(word, response.body());
	}

	static Optional<String> parseFirstDefinition(String word, String body) throws DefinitionException {
		try {
			JsonElement root = JsonParser.parseString(body == null ? "" : body);
			if (!root.isJsonArray()) {
				throw new DefinitionException("Expected a JSON array for '" + word + "'");
			}

			JsonObject entry = firstObject(root.getAsJsonArray());
			JsonObject meaning = entry == null ? null : firstObject(entry.getAsJsonArray("meanings"));
			JsonObject sense = meaning == null ? null : firstObject(meaning.getAsJsonArray("definitions"));
			if (sense == null || !sense.has("definition") || !sense.get("definition").isJsonPrimitive()) {
				return Optional.empty();
			}

			String definition = sense.get("definition").getAsString().strip();
			return definition.isEmpty() ? Optional.empty() : Optional.of(definition);
		} catch (JsonParseException | ClassCastException | IllegalStateException e) {
			throw new DefinitionException("Malformed definition payload for '" + word + "': " + e.getMessage(), e);
		}
	}

	private static JsonObject firstObject(JsonArray array) {
		if (array == null || array.isEmpty() || !array.get(0).isJsonObject()) {
			return null;
		}
		return array.get(0).getAsJsonObject();
	}
}
