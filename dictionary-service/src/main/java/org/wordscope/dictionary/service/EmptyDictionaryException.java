package org.wordscope.dictionary.service;

import java.io.IOException;

/**
 * No word has been counted yet.
 */
public class EmptyDictionaryException extends IOException {
	public EmptyDictionaryException(String message) {
		super(message);
	}
}
