package org.wordscope.ingestion.service;

import java.io.IOException;

/**
 * A passage could not be ingested because the text source or the system of record failed.
 */
public class IngestionFailedException extends IOException {
	public IngestionFailedException(String message) {
		super(message);
	}

	public IngestionFailedException(String message, Throwable cause) {
		super(message, cause);
	}
}
