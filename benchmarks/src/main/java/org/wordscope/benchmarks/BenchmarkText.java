package org.wordscope.benchmarks;

import java.util.Random;

/**
 * Deterministic pseudo-prose for benchmarks that must not depend on network sources.
 */
final class BenchmarkText {
	private static final String[] VOCABULARY = {
			"lighthouse", "keeper", "harbour", "storm", "the", "and", "of", "meadow", "river", "stone",
			"silence", "whisper", "lantern", "voyage", "anchor", "compass", "tide", "shore", "gull", "fog",
			"a", "in", "was", "forest", "ember", "glacier", "horizon", "quarry", "violin", "elephant"
	};

	private BenchmarkText() {}

	static String passage(int words, long seed) {
		Random random = new Random(seed);
		StringBuilder text = new StringBuilder(words * 8);
		for (int i = 0; i < words; i++) {
			if (i > 0) {
				text.append(i % 12 == 0 ? ". " : " ");
			}
			text.append(VOCABULARY[random.nextInt(VOCABULARY.length)]);
		}
		return text.append('.').toString();
	}
}
