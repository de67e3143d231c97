package org.wordscope.adapters.lucene;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.FuzzyQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchNoDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.AlreadyClosedException;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.util.automaton.LevenshteinAutomata;
import org.wordscope.core.error.IndexException;
import org.wordscope.core.model.Passage;
import org.wordscope.core.port.IndexHits;
import org.wordscope.core.port.QueryClause;
import org.wordscope.core.port.SearchIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link SearchIndex} backed by a local Lucene index.
 *
 * <p>Each passage is one document keyed by its id; re-indexing the same id replaces the document.
 * Every write is committed and the searcher refreshed before returning, so a passage is searchable as
 * soon as {@link #indexDocument(Passage)} completes.</p>
 *
 * <p>Query words run through the same {@link StandardAnalyzer} as the content. Each resulting token
 * becomes a {@link FuzzyQuery}; the per-word queries are combined with MUST (AND) or SHOULD (OR).</p>
 */
public class LuceneSearchIndex implements SearchIndex, AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(LuceneSearchIndex.class);

	static final String ID = "id";
	static final String CONTENT = "content";
	static final String CREATED_AT = "created_at";

	private final Directory directory;
	private final Analyzer analyzer;
	private final IndexWriter indexWriter;
	private final SearcherManager searcherManager;

	public LuceneSearchIndex(Directory directory) throws IndexException {
		this.directory = directory;
		this.analyzer = new StandardAnalyzer();
		try {
			IndexWriterConfig config = new IndexWriterConfig(analyzer)
					.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
			this.indexWriter = new IndexWriter(directory, config);
			// Make sure an empty index has a commit point for the first reader
			indexWriter.commit();
			this.searcherManager = new SearcherManager(indexWriter, null);
		} catch (IOException e) {
			throw new IndexException("Failed to open search index: " + e.getMessage(), e);
		}
	}

	public static LuceneSearchIndex open(Path indexPath) throws IndexException {
		try {
			Files.createDirectories(indexPath);
			LuceneSearchIndex index = new LuceneSearchIndex(FSDirectory.open(indexPath));
			logger.info("Opened search index at {}", indexPath.toAbsolutePath());
			return index;
		} catch (IOException e) {
			throw new IndexException("Failed to open search index at " + indexPath + ": " + e.getMessage(), e);
		}
	}

	@Override
	public void indexDocument(Passage passage) throws IndexException {
		Document doc = new Document();
		doc.add(new StringField(ID, Long.toString(passage.id()), Field.Store.YES));
		doc.add(new TextField(CONTENT, passage.content(), Field.Store.YES));
		doc.add(new StoredField(CREATED_AT, passage.createdAt().toEpochMilli()));

		try {
			indexWriter.updateDocument(new Term(ID, Long.toString(passage.id())), doc);
			indexWriter.commit();
			searcherManager.maybeRefreshBlocking();
			logger.debug("Indexed passage {}", passage.id());
		} catch (IOException | AlreadyClosedException e) {
			throw new IndexException("Failed to index passage " + passage.id() + ": " + e.getMessage(), e);
		}
	}

	@Override
	public IndexHits query(List<QueryClause> clauses, int fuzziness, int limit) throws IndexException {
		if (clauses.isEmpty() || limit < 1) {
			return IndexHits.empty();
		}
		int maxEdits = Math.max(0, Math.min(fuzziness, LevenshteinAutomata.MAXIMUM_SUPPORTED_DISTANCE));

		try {
			Query query = buildQuery(clauses, maxEdits);
			IndexSearcher searcher = searcherManager.acquire();
			try {
				long total = searcher.count(query);
				TopDocs topDocs = searcher.search(query, limit);
				StoredFields storedFields = searcher.storedFields();

				List<IndexHits.Hit> hits = new ArrayList<>(topDocs.scoreDocs.length);
				for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
					hits.add(new IndexHits.Hit(toPassage(storedFields.document(scoreDoc.doc)), scoreDoc.score));
				}
				logger.debug("Query {} matched {} documents, returning {}", query, total, hits.size());
				return new IndexHits(hits, total);
			} finally {
				searcherManager.release(searcher);
			}
		} catch (IOException | AlreadyClosedException e) {
			throw new IndexException("Search failed: " + e.getMessage(), e);
		}
	}

	Query buildQuery(List<QueryClause> clauses, int maxEdits) throws IOException {
		BooleanQuery.Builder builder = new BooleanQuery.Builder();
		boolean allShould = true;

		for (QueryClause clause : clauses) {
			BooleanClause.Occur occur = clause.occur() == QueryClause.Occur.MUST
					? BooleanClause.Occur.MUST
					: BooleanClause.Occur.SHOULD;
			allShould &= occur == BooleanClause.Occur.SHOULD;
			builder.add(wordQuery(clause.term(), maxEdits), occur);
		}

		if (allShould) {
			builder.setMinimumNumberShouldMatch(1);
		}
		return builder.build();
	}

	private Query wordQuery(String word, int maxEdits) throws IOException {
		List<String> tokens = analyze(word);
		if (tokens.isEmpty()) {
			return new MatchNoDocsQuery("no indexable token in '" + word + "'");
		}
		if (tokens.size() == 1) {
			return new FuzzyQuery(new Term(CONTENT, tokens.get(0)), maxEdits);
		}

		BooleanQuery.Builder builder = new BooleanQuery.Builder();
		for (String token : tokens) {
			builder.add(new FuzzyQuery(new Term(CONTENT, token), maxEdits), BooleanClause.Occur.MUST);
		}
		return builder.build();
	}

	private List<String> analyze(String word) throws IOException {
		List<String> tokens = new ArrayList<>();
		try (TokenStream stream = analyzer.tokenStream(CONTENT, word)) {
			CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
			stream.reset();
			while (stream.incrementToken()) {
				tokens.add(term.toString());
			}
			stream.end();
		}
		return tokens;
	}

	private static Passage toPassage(Document doc) {
		long id = Long.parseLong(doc.get(ID));
		Number createdAt = doc.getField(CREATED_AT).numericValue();
		return new Passage(id, doc.get(CONTENT), Instant.ofEpochMilli(createdAt.longValue()));
	}

	@Override
	public void ping() throws IndexException {
		try {
			IndexSearcher searcher = searcherManager.acquire();
			try {
				searcher.getIndexReader().numDocs();
			} finally {
				searcherManager.release(searcher);
			}
		} catch (IOException | AlreadyClosedException e) {
			throw new IndexException("Search index unavailable: " + e.getMessage(), e);
		}
	}

	@Override
	public void close() throws IOException {
		logger.info("Closing search index");
		try {
			searcherManager.close();
			indexWriter.close();
		} finally {
			directory.close();
		}
	}
}
