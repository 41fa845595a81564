package com.joshlong.organizer.api.search;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

class RelevanceScorerTest {

	private final Instant now = Instant.parse("2026-01-15T12:00:00Z");

	@Test
	void averageTermFrequency() {
		var frequencies = Map.of("apple", 2, "pie", 1, "recipe", 1);
		Assertions.assertEquals(0.5, RelevanceScorer.averageTermFrequency(frequencies, List.of("apple")), 1e-9);
		Assertions.assertEquals(0.375, RelevanceScorer.averageTermFrequency(frequencies, List.of("apple", "pie")),
				1e-9);
		Assertions.assertEquals(0.25, RelevanceScorer.averageTermFrequency(frequencies, List.of("apple", "cider")),
				1e-9, "absent tokens count as zero");
		Assertions.assertEquals(0.0, RelevanceScorer.averageTermFrequency(Map.of(), List.of("apple")));
	}

	@Test
	void recencySteps() {
		Assertions.assertEquals(0.0, RelevanceScorer.recency(null, this.now));
		Assertions.assertEquals(0.0, RelevanceScorer.recency(new AccessHistory(), this.now));
		Assertions.assertEquals(1.0, RelevanceScorer.recency(this.accessedAgo(Duration.ofMinutes(59)), this.now));
		Assertions.assertEquals(0.7, RelevanceScorer.recency(this.accessedAgo(Duration.ofHours(1)), this.now));
		Assertions.assertEquals(0.7, RelevanceScorer.recency(this.accessedAgo(Duration.ofHours(23)), this.now));
		Assertions.assertEquals(0.4, RelevanceScorer.recency(this.accessedAgo(Duration.ofDays(1)), this.now));
		Assertions.assertEquals(0.4, RelevanceScorer.recency(this.accessedAgo(Duration.ofDays(6)), this.now));
		Assertions.assertEquals(0.1, RelevanceScorer.recency(this.accessedAgo(Duration.ofDays(7)), this.now));
		Assertions.assertEquals(0.1, RelevanceScorer.recency(this.accessedAgo(Duration.ofDays(365)), this.now));
	}

	@Test
	void recencyUsesTheLatestAccess() {
		var history = new AccessHistory();
		history.record(this.now.minus(Duration.ofMinutes(5)));
		history.record(this.now.minus(Duration.ofDays(30)));
		Assertions.assertEquals(1.0, RelevanceScorer.recency(history, this.now));
	}

	@Test
	void usageSaturatesAtTenAccesses() {
		var history = new AccessHistory();
		Assertions.assertEquals(0.0, RelevanceScorer.usage(null));
		for (var i = 0; i < 4; i++)
			history.record(this.now);
		Assertions.assertEquals(0.4, RelevanceScorer.usage(history), 1e-9);
		for (var i = 0; i < 20; i++)
			history.record(this.now);
		Assertions.assertEquals(1.0, RelevanceScorer.usage(history));
	}

	@Test
	void accessHistoryKeepsTheMostRecentHundred() {
		var history = new AccessHistory();
		for (var i = 0; i < 150; i++)
			history.record(this.now.plusSeconds(i));
		Assertions.assertEquals(AccessHistory.CAPACITY, history.count());
		Assertions.assertEquals(this.now.plusSeconds(149), history.lastAccess().orElseThrow());
	}

	@Test
	void score() {
		var history = this.accessedAgo(Duration.ofHours(2));
		var score = RelevanceScorer.score(Map.of("apple", 1, "pie", 1), List.of("apple"), history, this.now);
		// 0.5 * 0.5 + 0.3 * 0.7 + 0.2 * 0.1
		Assertions.assertEquals(0.48, score, 1e-9);
	}

	private AccessHistory accessedAgo(Duration duration) {
		var history = new AccessHistory();
		history.record(this.now.minus(duration));
		return history;
	}

}
