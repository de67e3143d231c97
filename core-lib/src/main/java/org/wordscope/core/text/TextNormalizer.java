package org.wordscope.core.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw passage text into the word tokens that feed the frequency table.
 *
 * <p>Lower-cases, splits on anything that is not a letter, then drops stopwords and words shorter
 * than the configured minimum. Pure: no I/O and no shared mutable state.</p>
 */
public class TextNormalizer {
	public static final int DEFAULT_MIN_WORD_LENGTH = 4;

	public static final String DEFAULT_STOP_WORDS =
			"a,about,above,after,again,against,all,also,am,an,and,any,are,as,at,be,because,been,before,"
			+ "being,below,between,both,but,by,can,could,did,do,does,doing,down,during,each,even,few,for,"
			+ "from,further,had,has,have,having,he,her,here,hers,herself,him,himself,his,how,into,is,it,"
			+ "its,itself,just,more,most,much,must,myself,nor,not,now,of,off,once,only,other,ought,our,"
			+ "ours,ourselves,out,over,own,same,shall,she,should,some,such,than,that,their,theirs,them,"
			+ "themselves,then,there,these,they,this,those,through,to,too,under,until,upon,very,was,were,"
			+ "what,when,where,which,while,whom,whose,why,will,with,within,without,would,yet,you,your,"
			+ "yours,yourself,yourselves,the";

	private static final Pattern WORD_PATTERN = Pattern.compile("\\p{L}+");

	private final int minWordLength;
	private final Set<String> stopWords;

	public TextNormalizer(int minWordLength, Set<String> stopWords) {
		if (minWordLength < 1) {
			throw new IllegalArgumentException("minWordLength must be positive: " + minWordLength);
		}
		this.minWordLength = minWordLength;
		this.stopWords = Set.copyOf(stopWords);
	}

	public static TextNormalizer withDefaults() {
		return new TextNormalizer(DEFAULT_MIN_WORD_LENGTH, parseStopWords(DEFAULT_STOP_WORDS));
	}

	/**
	 * Normalized tokens in text order, duplicates kept
	 */
	public List<String> normalize(String text) {
		if (text == null || text.isBlank()) {
			return Collections.emptyList();
		}

		List<String> words = new ArrayList<>();
		Matcher matcher = WORD_PATTERN.matcher(text.toLowerCase(Locale.ROOT));
		while (matcher.find()) {
			String word = matcher.group();
			if (isValidWord(word)) {
				words.add(word);
			}
		}
		return words;
	}

	/**
	 * Occurrences per normalized word, in order of first appearance
	 */
	public Map<String, Integer> countOccurrences(String text) {
		Map<String, Integer> counts = new LinkedHashMap<>();
		for (String word : normalize(text)) {
			counts.merge(word, 1, Integer::sum);
		}
		return counts;
	}

	public int minWordLength() {
		return minWordLength;
	}

	public Set<String> stopWords() {
		return stopWords;
	}

	private boolean isValidWord(String word) {
		if (word.length() < minWordLength) {
			return false;
		}

		return !stopWords.contains(word);
	}

	/**
	 * Parse stop words from comma-separated string
	 */
	public static Set<String> parseStopWords(String stopWordsStr) {
		if (stopWordsStr == null || stopWordsStr.trim().isEmpty()) {
			return new HashSet<>();
		}

		String[] words = stopWordsStr.split(",");
		Set<String> stopWords = new HashSet<>();

		for (String word : words) {
			String cleaned = word.trim().toLowerCase(Locale.ROOT);
			if (!cleaned.isEmpty()) {
				stopWords.add(cleaned);
			}
		}

		return stopWords;
	}
}
