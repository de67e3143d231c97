package org.wordscope.adapters.jdbc;

import org.wordscope.core.error.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * SQLite-backed store for local runs and tests. Passage timestamps are stored as epoch milliseconds.
 */
public class SqliteWordStore extends JdbcWordStore {
	private static final Logger logger = LoggerFactory.getLogger(SqliteWordStore.class);

	private final String url;
	private final long busyTimeoutMs;

	public SqliteWordStore(String dbPath, Duration busyTimeout) throws StoreException {
		this(dbPath, busyTimeout, Clock.systemUTC());
	}

	public SqliteWordStore(String dbPath, Duration busyTimeout, Clock clock) throws StoreException {
		super(clock);
		this.url = "jdbc:sqlite:" + dbPath;
		this.busyTimeoutMs = busyTimeout.toMillis();

		try {
			createTablesIfNotExist();
			enableWriteAheadLog();
			logger.info("Connected to SQLite database: {}", dbPath);
		} catch (SQLException e) {
			logger.error("Failed to connect to SQLite database: {}", dbPath, e);
			throw new StoreException("Failed to open SQLite database: " + dbPath, e);
		}
	}

	@Override
	protected Connection openConnection() throws SQLException {
		Connection connection = DriverManager.getConnection(url);
		try (Statement stmt = connection.createStatement()) {
			stmt.execute("PRAGMA busy_timeout = " + busyTimeoutMs);
		} catch (SQLException e) {
			connection.close();
			throw e;
		}
		return connection;
	}

	private void enableWriteAheadLog() throws SQLException {
		try (Connection connection = openConnection();
			 Statement stmt = connection.createStatement()) {
			stmt.execute("PRAGMA journal_mode = WAL");
		}
	}

	@Override
	protected List<String> schemaStatements() {
		return List.of(
				"""
	            CREATE TABLE IF NOT EXISTS paragraphs (
	                id INTEGER PRIMARY KEY AUTOINCREMENT,
	                content TEXT NOT NULL,
	                created_at INTEGER NOT NULL
	            )
	        """,
				"""
	            CREATE TABLE IF NOT EXISTS word_frequencies (
	                word TEXT PRIMARY KEY,
	                frequency INTEGER NOT NULL,
	                updated_at DATETIME DEFAULT CURRENT_TIMESTAMP
	            )
	        """,
				"CREATE INDEX IF NOT EXISTS idx_word_frequencies_ranking ON word_frequencies(frequency DESC, word ASC)"
		);
	}

	@Override
	protected long insertPassage(Connection connection, String content, Instant createdAt) throws SQLException {
		String sql = "INSERT INTO paragraphs (content, created_at) VALUES (?, ?)";

		try (PreparedStatement stmt = connection.prepareStatement(sql)) {
			stmt.setString(1, content);
			stmt.setLong(2, createdAt.toEpochMilli());
			stmt.executeUpdate();
		}

		try (Statement stmt = connection.createStatement();
			 ResultSet rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
			if (rs.next()) {
				return rs.getLong(1);
			}
		}
		throw new SQLException("SQLite did not report the inserted passage id");
	}

	@Override
	protected String upsertWordSql() {
		return """
            INSERT INTO word_frequencies (word, frequency)
            VALUES (?, ?)
            ON CONFLICT(word) DO UPDATE SET
                frequency = frequency + excluded.frequency,
                updated_at = CURRENT_TIMESTAMP
        """;
	}

	@Override
	protected String describe() {
		return "SQLite";
	}
}
