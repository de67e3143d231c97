package org.wordscope.dictionary.service;

import java.io.IOException;

/**
 * The frequency ranking could not be read from the cache or the durable store.
 */
public class DictionaryUnavailableException extends IOException {
	public DictionaryUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
