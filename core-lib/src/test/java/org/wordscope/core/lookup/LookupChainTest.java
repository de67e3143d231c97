package org.wordscope.core.lookup;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

public class LookupChainTest {

	private final List<String> asked = new ArrayList<>();

	private LookupStage<String, String> stage(String name, Function<String, Lookup<String>> answer) {
		return new LookupStage<>() {
			@Override
			public String name() {
				return name;
			}

			@Override
			public Lookup<String> lookup(String key) {
				asked.add(name);
				return answer.apply(key);
			}
		};
	}

	@Test
	public void testFirstHitStopsTheChain() {
		LookupChain<String, String> chain = new LookupChain<>("test", List.of(
				stage("cache", key -> Lookup.hit("cached")),
				stage("store", key -> Lookup.hit("stored"))));

		Lookup<String> result = chain.resolve("k");

		assertTrue(result.isHit());
		assertEquals("cached", result.value());
		assertEquals(List.of("cache"), asked);
	}

	@Test
	public void testMissAndErrorBothFallThrough() {
		LookupChain<String, String> chain = new LookupChain<>("test", List.of(
				stage("broken", key -> Lookup.error(new IOException("down"))),
				stage("empty", key -> Lookup.miss()),
				stage("store", key -> Lookup.hit("stored"))));

		Lookup<String> result = chain.resolve("k");

		assertEquals("stored", result.value());
		assertEquals(List.of("broken", "empty", "store"), asked);
	}

	@Test
	public void testLastStageDecidesWhenNothingHits() {
		IOException storeDown = new IOException("store down");
		LookupChain<String, String> erroring = new LookupChain<>("test", List.of(
				stage("cache", key -> Lookup.miss()),
				stage("store", key -> Lookup.error(storeDown))));
		LookupChain<String, String> missing = new LookupChain<>("test", List.of(
				stage("cache", key -> Lookup.error(new IOException("cache down"))),
				stage("store", key -> Lookup.miss())));

		Lookup<String> error = erroring.resolve("k");
		Lookup<String> miss = missing.resolve("k");

		assertEquals(Lookup.Status.ERROR, error.status());
		assertSame(storeDown, error.error().orElseThrow());
		assertEquals(Lookup.Status.MISS, miss.status());
	}

	@Test
	public void testValueOnMissIsRejected() {
		assertThrows(IllegalStateException.class, () -> Lookup.miss().value());
	}

	@Test
	public void testEmptyChainIsRejected() {
		assertThrows(IllegalArgumentException.class, () -> new LookupChain<String, String>("empty", List.of()));
	}
}
