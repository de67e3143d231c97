package org.wordscope.core.port;

import org.wordscope.core.error.TextSourceException;

public interface TextSource {
	/**
	 * Fetch one passage of raw text
	 * @return non-blank text
	 * @throws TextSourceException if the source is unreachable or returns nothing usable
	 */
	String fetchPassage() throws TextSourceException;
}
