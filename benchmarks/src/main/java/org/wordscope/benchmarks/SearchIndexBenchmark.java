package org.wordscope.benchmarks;

import org.apache.lucene.store.ByteBuffersDirectory;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.wordscope.adapters.lucene.LuceneSearchIndex;
import org.wordscope.core.error.IndexException;
import org.wordscope.core.model.Passage;
import org.wordscope.core.port.QueryClause;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for fuzzy multi-term queries against an in-memory Lucene index
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class SearchIndexBenchmark {

	private static final List<QueryClause> AND_QUERY = List.of(QueryClause.must("lighthouse"), QueryClause.must("harbor"));
	private static final List<QueryClause> OR_QUERY = List.of(QueryClause.should("violin"), QueryClause.should("glaciar"));

	@Param({"1000", "10000"})
	private int passageCount;

	@Param({"0", "2"})
	private int fuzziness;

	private LuceneSearchIndex index;

	@Setup(Level.Trial)
	public void setup() throws IndexException {
		index = new LuceneSearchIndex(new ByteBuffersDirectory());
		Instant now = Instant.now();
		for (long id = 1; id <= passageCount; id++) {
			index.indexDocument(new Passage(id, BenchmarkText.passage(40, id), now));
		}
	}

	@TearDown(Level.Trial)
	public void tearDown() throws IOException {
		index.close();
	}

	/**
	 * Benchmark: AND query, misspelling included
	 */
	@Benchmark
	public void andQuery(Blackhole blackhole) throws IndexException {
		blackhole.consume(index.query(AND_QUERY, fuzziness, 10));
	}

	/**
	 * Benchmark: OR query, misspelling included
	 */
	@Benchmark
	public void orQuery(Blackhole blackhole) throws IndexException {
		blackhole.consume(index.query(OR_QUERY, fuzziness, 10));
	}
}
