package com.joshlong.organizer.api.search;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * scores a document against a tokenized query as a fixed linear blend of
 * <ul>
 * <li>the mean normalized term frequency of the query tokens (50%)</li>
 * <li>a step-decayed recency score based on the last recorded access (30%)</li>
 * <li>a usage score based on how many accesses are on record (20%)</li>
 * </ul>
 * The weights and thresholds are constants; results must be reproducible.
 */
abstract class RelevanceScorer {

	static final double TERM_FREQUENCY_WEIGHT = 0.5;

	static final double RECENCY_WEIGHT = 0.3;

	static final double USAGE_WEIGHT = 0.2;

	static final double USAGE_SATURATION = 10.0;

	static double score(Map<String, Integer> frequencies, List<String> queryTokens, @Nullable AccessHistory history,
			Instant now) {
		return TERM_FREQUENCY_WEIGHT * averageTermFrequency(frequencies, queryTokens)
				+ RECENCY_WEIGHT * recency(history, now) + USAGE_WEIGHT * usage(history);
	}

	static double averageTermFrequency(Map<String, Integer> frequencies, List<String> queryTokens) {
		if (queryTokens.isEmpty())
			return 0.0;
		var total = 0;
		for (var count : frequencies.values())
			total += count;
		if (total == 0)
			return 0.0;
		var sum = 0.0;
		for (var token : queryTokens)
			sum += (double) frequencies.getOrDefault(token, 0) / total;
		return sum / queryTokens.size();
	}

	static double recency(@Nullable AccessHistory history, Instant now) {
		if (history == null)
			return 0.0;
		return history.lastAccess().map(last -> {
			var elapsed = Duration.between(last, now);
			if (elapsed.compareTo(Duration.ofHours(1)) < 0)
				return 1.0;
			if (elapsed.compareTo(Duration.ofDays(1)) < 0)
				return 0.7;
			if (elapsed.compareTo(Duration.ofDays(7)) < 0)
				return 0.4;
			return 0.1;
		}).orElse(0.0);
	}

	static double usage(@Nullable AccessHistory history) {
		if (history == null)
			return 0.0;
		return Math.min(1.0, history.count() / USAGE_SATURATION);
	}

}
