package org.wordscope.api.config;

import org.wordscope.adapters.hazelcast.HazelcastSettings;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Typed configuration for the API server.
 *
 * <p>Loads {@code application.properties}, then overlays environment variables. An environment variable
 * overrides the property of the same name, and also the dotted lower-case form of its name
 * ({@code STORE_TYPE} overrides {@code store.type}). In addition:
 * <ul>
 *   <li>{@code CURRENT_NODE_IP} overrides {@code hazelcast.current.node.ip}.</li>
 *   <li>{@code CLUSTER_NODES_LIST} overrides {@code hazelcast.members}.</li>
 * </ul>
 * Missing required keys fail fast with {@link IllegalStateException}.</p>
 */
public record ApiConfig(
	int serverPort,
	Store store,
	HazelcastSettings hazelcast,
	Cache cache,
	Index index,
	Sources sources,
	Normalizer normalizer,
	Dictionary dictionary,
	Search search
) {
	/** Durable store. {@code type} is {@code sqlite} or {@code postgresql}. */
	public record Store(String type, String sqlitePath, String url, String user, String password, Duration timeout) {}

	/** TTLs and ranking snapshot size for the cache projections. */
	public record Cache(long rankingTtlSeconds, int rankingSize, long definitionTtlSeconds) {}

	public record Index(String path) {}

	/** External text and definition services. */
	public record Sources(String textUrl, String definitionUrl, Duration connectTimeout, Duration readTimeout) {}

	/** Blank {@code stopWords} selects the built-in English list. */
	public record Normalizer(int minWordLength, String stopWords) {}

	public record Dictionary(int defaultTop, int maxTop) {}

	public record Search(int pageSize, int fuzziness) {}

	/**
	 * Loads configuration from classpath properties plus environment variables.
	 *
	 * @return a fully-initialized {@link ApiConfig}
	 */
	public static ApiConfig load() {
		return load(System.getenv());
	}

	public static ApiConfig load(Map<String, String> environment) {
		Properties properties = loadProperties("application.properties");
		overlayEnvironment(properties, environment);
		normalizeClusterSettings(properties);
		return from(properties);
	}

	public static ApiConfig from(Properties p) {
		return new ApiConfig(
			requireInt(p, "server.port"),
			readStore(p),
			readHazelcast(p),
			readCache(p),
			new Index(requireString(p, "index.path")),
			readSources(p),
			new Normalizer(requireInt(p, "normalizer.min.word.length"), optionalString(p, "normalizer.stop.words")),
			new Dictionary(requireInt(p, "dictionary.default.top"), requireInt(p, "dictionary.max.top")),
			new Search(requireInt(p, "search.page.size"), requireInt(p, "search.fuzziness"))
		);
	}

	private static Store readStore(Properties p) {
		String type = requireString(p, "store.type").toLowerCase(Locale.ROOT);
		Duration timeout = Duration.ofMillis(requireInt(p, "store.timeout.ms"));

		return switch (type) {
			case "sqlite" -> new Store(type, requireString(p, "store.sqlite.path"), null, null, null, timeout);
			case "postgresql" -> new Store(type, null,
				requireString(p, "store.postgresql.url"),
				requireString(p, "store.postgresql.user"),
				requireString(p, "store.postgresql.password"),
				timeout);
			default -> throw new IllegalStateException("Unknown store.type '" + type + "'. Must be sqlite or postgresql.");
		};
	}

	private static HazelcastSettings readHazelcast(Properties p) {
		String mode = requireString(p, "hazelcast.mode").toLowerCase(Locale.ROOT);
		if (!HazelcastSettings.MODE_MEMBER.equals(mode) && !HazelcastSettings.MODE_CLIENT.equals(mode)) {
			throw new IllegalStateException("Unknown hazelcast.mode '" + mode + "'. Must be member or client.");
		}
		return new HazelcastSettings(
			mode,
			requireString(p, "hazelcast.cluster.name"),
			requireString(p, "hazelcast.current.node.ip"),
			requireInt(p, "hazelcast.port"),
			splitCsv(requireString(p, "hazelcast.members")),
			splitCsv(optionalString(p, "hazelcast.member.ports")).stream().map(Integer::parseInt).toList(),
			requireString(p, "hazelcast.map.name"),
			requireInt(p, "hazelcast.backup.count"),
			requireInt(p, "hazelcast.max.entries"),
			requireInt(p, "hazelcast.operation.timeout.ms")
		);
	}

	private static Cache readCache(Properties p) {
		return new Cache(
			requireInt(p, "cache.ranking.ttl.seconds"),
			requireInt(p, "cache.ranking.size"),
			requireInt(p, "cache.definition.ttl.seconds")
		);
	}

	private static Sources readSources(Properties p) {
		return new Sources(
			requireString(p, "text.source.url"),
			requireString(p, "definition.source.url"),
			Duration.ofMillis(requireInt(p, "http.connect.timeout.ms")),
			Duration.ofMillis(requireInt(p, "http.read.timeout.ms"))
		);
	}

	private static Properties loadProperties(String resourceName) {
		Properties properties = new Properties();
		try (InputStream in = ApiConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
			if (in != null) {
				properties.load(in);
			}
		} catch (IOException e) {
			throw new IllegalStateException("Failed to load " + resourceName, e);
		}
		return properties;
	}

	static void overlayEnvironment(Properties properties, Map<String, String> environment) {
		environment.forEach((name, value) -> {
			properties.setProperty(name, value);
			properties.setProperty(name.toLowerCase(Locale.ROOT).replace('_', '.'), value);
		});
	}

	private static void normalizeClusterSettings(Properties properties) {
		String nodeIp = trimToNull(properties.getProperty("CURRENT_NODE_IP"));
		if (nodeIp != null) {
			properties.setProperty("hazelcast.current.node.ip", nodeIp);
		}
		String nodes = trimToNull(properties.getProperty("CLUSTER_NODES_LIST"));
		if (nodes != null) {
			properties.setProperty("hazelcast.members", nodes);
		}
	}

	private static List<String> splitCsv(String csv) {
		if (csv == null) {
			return List.of();
		}
		return Arrays.stream(csv.split(","))
			.map(String::trim)
			.filter(s -> !s.isEmpty())
			.toList();
	}

	private static String optionalString(Properties properties, String key) {
		return trimToNull(properties.getProperty(key));
	}

	private static String requireString(Properties properties, String key) {
		String value = trimToNull(properties.getProperty(key));
		if (value == null) {
			throw new IllegalStateException("Missing required configuration: " + key);
		}
		return value;
	}

	private static int requireInt(Properties properties, String key) {
		String value = requireString(properties, key);
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
		}
	}

	private static String trimToNull(String value) {
		if (value == null) {
			return null;
		}
		String trimmed = value.trim();
		return trimmed.isEmpty() ? null : trimmed;
	}
}
