package org.wordscope.core.port;

import org.wordscope.core.error.IndexException;
import org.wordscope.core.model.Passage;

import java.util.List;

/**
 * Inverted index supporting fuzzy multi-term boolean queries with relevance ranking.
 */
public interface SearchIndex {
	/**
	 * Add or replace the document for this passage, keyed by the passage id
	 */
	void indexDocument(Passage passage) throws IndexException;

	/**
	 * Run a boolean query. Hits come back by relevance score descending, ties in index order.
	 *
	 * @param clauses one clause per query word; SHOULD-only queries need at least one match
	 * @param fuzziness maximum edit distance per term
	 * @param limit maximum number of hits returned; {@link IndexHits#total()} is not capped
	 */
	IndexHits query(List<QueryClause> clauses, int fuzziness, int limit) throws IndexException;

	void ping() throws IndexException;
}
