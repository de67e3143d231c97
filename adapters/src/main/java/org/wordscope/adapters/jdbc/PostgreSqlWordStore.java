package org.wordscope.adapters.jdbc;

import org.wordscope.core.error.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Properties;

public class PostgreSqlWordStore extends JdbcWordStore {
	private static final Logger logger = LoggerFactory.getLogger(PostgreSqlWordStore.class);

	private final String url;
	private final Properties connectionProperties;

	public PostgreSqlWordStore(String url, String username, String password, Duration timeout) throws StoreException {
		super(Clock.systemUTC());
		this.url = url;
		this.connectionProperties = new Properties();
		connectionProperties.setProperty("user", username);
		connectionProperties.setProperty("password", password);
		String seconds = String.valueOf(Math.max(1, timeout.toSeconds()));
		connectionProperties.setProperty("connectTimeout", seconds);
		connectionProperties.setProperty("loginTimeout", seconds);
		connectionProperties.setProperty("socketTimeout", seconds);

		try {
			createTablesIfNotExist();
			logger.info("Connected to PostgreSQL database: {}", url);
		} catch (SQLException e) {
			logger.error("Failed to connect to PostgreSQL database: {}", url, e);
			throw new StoreException("Failed to connect to PostgreSQL database: " + url, e);
		}
	}

	@Override
	protected Connection openConnection() throws SQLException {
		return DriverManager.getConnection(url, connectionProperties);
	}

	@Override
	protected List<String> schemaStatements() {
		return List.of(
				"""
	            CREATE TABLE IF NOT EXISTS paragraphs (
	                id BIGSERIAL PRIMARY KEY,
	                content TEXT NOT NULL,
	                created_at TIMESTAMPTZ NOT NULL DEFAULT now()
	            )
	        """,
				"""
	            CREATE TABLE IF NOT EXISTS word_frequencies (
	                id BIGSERIAL PRIMARY KEY,
	                word TEXT NOT NULL UNIQUE,
	                frequency BIGINT NOT NULL,
	                updated_at TIMESTAMPTZ DEFAULT now()
	            )
	        """,
				"CREATE INDEX IF NOT EXISTS ix_word_frequencies_ranking ON word_frequencies (frequency DESC, word ASC)"
		);
	}

	@Override
	protected long insertPassage(Connection connection, String content, Instant createdAt) throws SQLException {
		String sql = "INSERT INTO paragraphs (content, created_at) VALUES (?, ?) RETURNING id";

		try (PreparedStatement stmt = connection.prepareStatement(sql)) {
			stmt.setString(1, content);
			stmt.setTimestamp(2, Timestamp.from(createdAt));

			try (ResultSet rs = stmt.executeQuery()) {
				if (rs.next()) {
					return rs.getLong(1);
				}
			}
		}
		throw new SQLException("INSERT INTO paragraphs returned no id");
	}

	@Override
	protected String upsertWordSql() {
		return """
            INSERT INTO word_frequencies (word, frequency)
            VALUES (?, ?)
            ON CONFLICT (word) DO UPDATE SET
                frequency = word_frequencies.frequency + EXCLUDED.frequency,
                updated_at = now()
        """;
	}

	@Override
	protected String describe() {
		return "PostgreSQL";
	}
}
