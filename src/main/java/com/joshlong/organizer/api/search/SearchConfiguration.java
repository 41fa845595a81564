package com.joshlong.organizer.api.search;

import com.joshlong.organizer.api.ApiProperties;
import com.joshlong.organizer.api.autocomplete.PrefixIndex;
import com.joshlong.organizer.api.cache.BoundedResultCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
class SearchConfiguration {

	@Bean
	PrefixIndex prefixIndex() {
		return new PrefixIndex();
	}

	@Bean
	DefaultSearchEngine defaultSearchEngine(ApiProperties properties, PrefixIndex prefixIndex, Clock clock) {
		var cache = new BoundedResultCache<String, List<SearchHit>>(properties.search().cacheCapacity());
		return new DefaultSearchEngine(prefixIndex, cache, clock);
	}

	@Bean
	SearchEngineHealthIndicator searchEngineHealthIndicator(SearchEngine searchEngine) {
		return new SearchEngineHealthIndicator(searchEngine);
	}

}
