package com.joshlong.organizer.api.search;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

class SearchEngineHealthIndicator implements HealthIndicator {

	private final SearchEngine searchEngine;

	SearchEngineHealthIndicator(SearchEngine searchEngine) {
		this.searchEngine = searchEngine;
	}

	@Override
	public Health health() {
		var statistics = this.searchEngine.statistics();
		return Health.up() //
			.withDetail("documents", statistics.documents()) //
			.withDetail("indexedTokens", statistics.indexedTokens()) //
			.withDetail("autocompleteTokens", statistics.autocompleteTokens()) //
			.withDetail("cachedQueries", statistics.cachedQueries()) //
			.build();
	}

}
