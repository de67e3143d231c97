package org.wordscope.search.service;

import java.io.IOException;

/**
 * The search index could not answer the query.
 */
public class SearchUnavailableException extends IOException {
	public SearchUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
