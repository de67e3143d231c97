package org.wordscope.adapters.jdbc;

import org.wordscope.core.error.StoreException;
import org.wordscope.core.model.Passage;
import org.wordscope.core.model.WordFrequency;
import org.wordscope.core.port.WordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Plain JDBC {@link WordStore}. A connection is opened per operation so concurrent requests never share
 * a transaction; subclasses supply the dialect-specific SQL.
 *
 * <p>Counter updates are single upsert statements ({@code INSERT .. ON CONFLICT .. DO UPDATE}), which the
 * database applies atomically, so concurrent ingestions never lose increments.</p>
 */
public abstract class JdbcWordStore implements WordStore {
	private static final Logger logger = LoggerFactory.getLogger(JdbcWordStore.class);

	private static final String SELECT_COUNT_SQL = "SELECT frequency FROM word_frequencies WHERE word = ?";
	private static final String TOP_WORDS_SQL = """
            SELECT word, frequency FROM word_frequencies
            ORDER BY frequency DESC, word ASC
            LIMIT ?
        """;

	private final Clock clock;

	protected JdbcWordStore(Clock clock) {
		this.clock = clock;
	}

	protected abstract Connection openConnection() throws SQLException;

	protected abstract List<String> schemaStatements();

	/**
	 * Insert the passage row and return the id the database assigned
	 */
	protected abstract long insertPassage(Connection connection, String content, Instant createdAt) throws SQLException;

	/**
	 * Upsert taking (word, occurrences) parameters
	 */
	protected abstract String upsertWordSql();

	protected abstract String describe();

	protected final void createTablesIfNotExist() throws SQLException {
		try (Connection connection = openConnection();
			 Statement stmt = connection.createStatement()) {
			for (String sql : schemaStatements()) {
				stmt.execute(sql);
			}
			logger.info("{} tables and indexes created/verified", describe());
		}
	}

	@Override
	public Passage createPassage(String content) throws StoreException {
		if (content == null || content.isBlank()) {
			throw new IllegalArgumentException("Passage content must not be blank");
		}
		Instant createdAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);

		try (Connection connection = openConnection()) {
			long id = insertPassage(connection, content, createdAt);
			logger.debug("Persisted passage {} ({} chars)", id, content.length());
			return new Passage(id, content, createdAt);
		} catch (SQLException e) {
			throw new StoreException("Failed to persist passage: " + e.getMessage(), e);
		}
	}

	@Override
	public long incrementWord(String word, int occurrences) throws StoreException {
		requirePositive(word, occurrences);

		try (Connection connection = openConnection()) {
			connection.setAutoCommit(false);
			try {
				upsert(connection, word, occurrences);
				long count = readCount(connection, word);
				connection.commit();
				return count;
			} catch (SQLException e) {
				rollback(connection, e);
				throw e;
			}
		} catch (SQLException e) {
			throw new StoreException("Failed to increment word '" + word + "': " + e.getMessage(), e);
		}
	}

	@Override
	public void incrementWords(Map<String, Integer> occurrences) throws StoreException {
		if (occurrences.isEmpty()) {
			return;
		}
		occurrences.forEach(JdbcWordStore::requirePositive);

		// Fixed lock order across concurrent batches
		Map<String, Integer> ordered = new TreeMap<>(occurrences);

		try (Connection connection = openConnection()) {
			connection.setAutoCommit(false);
			try (PreparedStatement stmt = connection.prepareStatement(upsertWordSql())) {
				for (Map.Entry<String, Integer> entry : ordered.entrySet()) {
					stmt.setString(1, entry.getKey());
					stmt.setInt(2, entry.getValue());
					stmt.addBatch();
				}
				stmt.executeBatch();
				connection.commit();
				logger.debug("Incremented {} words in one transaction", ordered.size());
			} catch (SQLException e) {
				rollback(connection, e);
				throw e;
			}
		} catch (SQLException e) {
			throw new StoreException("Failed to increment " + ordered.size() + " words: " + e.getMessage(), e);
		}
	}

	@Override
	public List<WordFrequency> topWords(int limit) throws StoreException {
		if (limit < 1) {
			return List.of();
		}

		List<WordFrequency> words = new ArrayList<>();
		try (Connection connection = openConnection();
			 PreparedStatement stmt = connection.prepareStatement(TOP_WORDS_SQL)) {
			stmt.setInt(1, limit);

			try (ResultSet rs = stmt.executeQuery()) {
				while (rs.next()) {
					words.add(new WordFrequency(rs.getString("word"), rs.getLong("frequency")));
				}
			}
		} catch (SQLException e) {
			throw new StoreException("Failed to read top words: " + e.getMessage(), e);
		}
		return words;
	}

	@Override
	public void ping() throws StoreException {
		try (Connection connection = openConnection();
			 Statement stmt = connection.createStatement();
			 ResultSet rs = stmt.executeQuery("SELECT 1")) {
			rs.next();
		} catch (SQLException e) {
			throw new StoreException(describe() + " unreachable: " + e.getMessage(), e);
		}
	}

	private void upsert(Connection connection, String word, int occurrences) throws SQLException {
		try (PreparedStatement stmt = connection.prepareStatement(upsertWordSql())) {
			stmt.setString(1, word);
			stmt.setInt(2, occurrences);
			stmt.executeUpdate();
		}
	}

	private long readCount(Connection connection, String word) throws SQLException {
		try (PreparedStatement stmt = connection.prepareStatement(SELECT_COUNT_SQL)) {
			stmt.setString(1, word);
			try (ResultSet rs = stmt.executeQuery()) {
				if (rs.next()) {
					return rs.getLong(1);
				}
			}
		}
		throw new SQLException("Word '" + word + "' missing right after upsert");
	}

	private static void rollback(Connection connection, SQLException cause) {
		try {
			connection.rollback();
		} catch (SQLException rollbackFailure) {
			cause.addSuppressed(rollbackFailure);
		}
	}

	private static void requirePositive(String word, int occurrences) {
		if (word == null || word.isBlank()) {
			throw new IllegalArgumentException("Word must not be blank");
		}
		if (occurrences < 1) {
			throw new IllegalArgumentException("Occurrences must be positive for '" + word + "': " + occurrences);
		}
	}
}
