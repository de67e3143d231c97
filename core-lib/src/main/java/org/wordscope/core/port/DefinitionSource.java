package org.wordscope.core.port;

import org.wordscope.core.error.DefinitionException;

import java.util.Optional;

public interface DefinitionSource {
	/**
	 * Look up a definition for a single word
	 * @return the definition, or empty if the source does not know the word
	 * @throws DefinitionException on transport failure or a malformed response
	 */
	Optional<String> lookup(String word) throws DefinitionException;
}
