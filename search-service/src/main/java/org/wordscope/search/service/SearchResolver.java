package org.wordscope.search.service;

import org.wordscope.core.error.IndexException;
import org.wordscope.core.error.ValidationException;
import org.wordscope.core.model.Passage;
import org.wordscope.core.model.SearchOperator;
import org.wordscope.core.port.IndexHits;
import org.wordscope.core.port.QueryClause;
import org.wordscope.core.port.SearchIndex;
import org.wordscope.search.model.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a word list and a boolean operator into one fuzzy index query.
 *
 * <p>Results keep the order the index returned them in; only the first page is kept.</p>
 */
public class SearchResolver {
	private static final Logger logger = LoggerFactory.getLogger(SearchResolver.class);

	public static final int DEFAULT_PAGE_SIZE = 10;
	public static final int DEFAULT_FUZZINESS = 2;

	private final SearchIndex index;
	private final int pageSize;
	private final int fuzziness;

	public SearchResolver(SearchIndex index, int pageSize, int fuzziness) {
		if (pageSize < 1) {
			throw new IllegalArgumentException("Page size must be positive: " + pageSize);
		}
		if (fuzziness < 0 || fuzziness > 2) {
			throw new IllegalArgumentException("Fuzziness must be between 0 and 2: " + fuzziness);
		}
		this.index = index;
		this.pageSize = pageSize;
		this.fuzziness = fuzziness;
	}

	public SearchResolver(SearchIndex index) {
		this(index, DEFAULT_PAGE_SIZE, DEFAULT_FUZZINESS);
	}

	/**
	 * @param words    query words; blank entries are ignored
	 * @param operator {@code and} or {@code or}, case-insensitive
	 * @throws ValidationException if the operator is unknown or no usable word remains
	 * @throws SearchUnavailableException if the index fails
	 */
	public SearchResult search(List<String> words, String operator) throws SearchUnavailableException {
		SearchOperator parsed = SearchOperator.parse(operator);
		List<QueryClause> clauses = toClauses(words, parsed);

		IndexHits hits;
		try {
			hits = index.query(clauses, fuzziness, pageSize);
		} catch (IndexException e) {
			logger.error("Search for {} ({}) failed: {}", words, parsed, e.getMessage());
			throw new SearchUnavailableException("Search index unavailable: " + e.getMessage(), e);
		}

		List<Passage> passages = new ArrayList<>(Math.min(pageSize, hits.hits().size()));
		for (IndexHits.Hit hit : hits.hits()) {
			if (passages.size() == pageSize) {
				break;
			}
			passages.add(hit.passage());
		}

		logger.info("Search {} ({}) matched {} passages, returning {}", words, parsed, hits.total(), passages.size());
		return new SearchResult(passages, hits.total());
	}

	private static List<QueryClause> toClauses(List<String> words, SearchOperator operator) {
		if (words == null) {
			throw new ValidationException("words is required");
		}

		List<QueryClause> clauses = new ArrayList<>(words.size());
		for (String word : words) {
			if (word == null || word.isBlank()) {
				continue;
			}
			String term = word.trim();
			clauses.add(operator == SearchOperator.AND ? QueryClause.must(term) : QueryClause.should(term));
		}

		if (clauses.isEmpty()) {
			throw new ValidationException("At least one non-blank word is required");
		}
		return clauses;
	}

	public int pageSize() {
		return pageSize;
	}

	public int fuzziness() {
		return fuzziness;
	}
}
