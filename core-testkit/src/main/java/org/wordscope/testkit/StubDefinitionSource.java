package org.wordscope.testkit;

import org.wordscope.core.error.DefinitionException;
import org.wordscope.core.port.DefinitionSource;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

public class StubDefinitionSource implements DefinitionSource {
	private final Map<String, String> definitions = new HashMap<>();
	private final Set<String> failing = new HashSet<>();
	private final AtomicInteger lookups = new AtomicInteger();

	public StubDefinitionSource define(String word, String definition) {
		definitions.put(word, definition);
		return this;
	}

	public StubDefinitionSource failFor(String word) {
		failing.add(word);
		return this;
	}

	@Override
	public Optional<String> lookup(String word) throws DefinitionException {
		lookups.incrementAndGet();
		if (failing.contains(word)) {
			throw new DefinitionException("Malformed response for '" + word + "'");
		}
		return Optional.ofNullable(definitions.get(word));
	}

	public int lookups() {
		return lookups.get();
	}
}
