package org.wordscope.testkit;

import org.wordscope.core.error.TextSourceException;
import org.wordscope.core.port.TextSource;

import java.util.ArrayDeque;
import java.util.Deque;

public class StubTextSource implements TextSource {
	private final Deque<String> texts = new ArrayDeque<>();

	public StubTextSource(String... texts) {
		for (String text : texts) {
			this.texts.add(text);
		}
	}

	@Override
	public synchronized String fetchPassage() throws TextSourceException {
		String next = texts.poll();
		if (next == null) {
			throw new TextSourceException("Text source unreachable");
		}
		return next;
	}
}
