package org.wordscope.core.port;

/**
 * One term of a boolean index query.
 *
 * @param term raw query word, analyzed by the index
 * @param occur whether the term must match or only contributes when it does
 */
public record QueryClause(String term, Occur occur) {

	public enum Occur {
		MUST,
		SHOULD
	}

	public static QueryClause must(String term) {
		return new QueryClause(term, Occur.MUST);
	}

	public static QueryClause should(String term) {
		return new QueryClause(term, Occur.SHOULD);
	}
}
