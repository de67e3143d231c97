package org.wordscope.core.port;

import org.wordscope.core.error.StoreException;
import org.wordscope.core.model.Passage;
import org.wordscope.core.model.WordFrequency;

import java.util.List;
import java.util.Map;

/**
 * Durable store holding passages and the global word frequency table. This is the system of record.
 */
public interface WordStore {
	/**
	 * Persist a new passage and assign its id
	 */
	Passage createPassage(String content) throws StoreException;

	/**
	 * Atomically add {@code occurrences} to the word's counter, inserting it if absent
	 * @return the counter value after the increment
	 */
	long incrementWord(String word, int occurrences) throws StoreException;

	/**
	 * Increment several words in one transaction. Either every counter moves or none does.
	 */
	void incrementWords(Map<String, Integer> occurrences) throws StoreException;

	/**
	 * Top words ordered by count descending, word ascending on ties
	 */
	List<WordFrequency> topWords(int limit) throws StoreException;

	/**
	 * Cheap round trip used by health checks
	 */
	void ping() throws StoreException;

	default long incrementWord(String word) throws StoreException {
		return incrementWord(word, 1);
	}
}
